package io.formulainline.core.engine;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.formulainline.core.error.CircularDependencyException;
import io.formulainline.core.error.ExpansionNoOpException;
import io.formulainline.core.error.FormulaException;
import io.formulainline.core.error.FormulaParseException;
import io.formulainline.core.error.ParameterCountMismatchException;
import io.formulainline.core.error.UndefinedFunctionException;
import io.formulainline.core.grammar.FormulaParser;
import io.formulainline.core.model.FormulaDefinition;
import io.formulainline.core.spi.CallExtractor;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class ExpansionEngineTest {

    private static final FormulaDefinition DOUBLE = def("DOUBLE", "x * 2", "x");

    @Nested
    @DisplayName("Composition")
    class Composition {

        @Test
        @DisplayName("QUAD = DOUBLE(DOUBLE(y)) expands to ((y * 2) * 2)")
        void nestedCallsExpandInsideOut() {
            ExpansionEngine engine = engine(DOUBLE, def("QUAD", "DOUBLE(DOUBLE(y))", "y"));

            assertThat(engine.expand("QUAD")).isEqualTo("((y * 2) * 2)");
        }

        @Test
        @DisplayName("F(y) + F(z) expands both calls independently")
        void sameCalleeTwice() {
            ExpansionEngine engine = engine(def("F", "x + 1", "x"), def("CALLER", "F(y) + F(z)"));

            assertThat(engine.expand("CALLER")).isEqualTo("(y + 1) + (z + 1)");
        }

        @Test
        @DisplayName("Substitution never touches x inside max")
        void wholeIdentifierSubstitution() {
            ExpansionEngine engine = engine(def("F", "x + max(x, 1)", "x"), def("CALLER", "F(10)"));

            assertThat(engine.expand("CALLER")).isEqualTo("(10 + max(10, 1))");
        }

        @Test
        void stringContentIsNeverSubstituted() {
            ExpansionEngine engine = engine(def("LABEL", "x & \": x\"", "x"), def("CALLER", "LABEL(A1)"));

            assertThat(engine.expand("CALLER")).isEqualTo("(A1 & \": x\")");
        }

        @Test
        void rangeSidesAreSubstituted() {
            ExpansionEngine engine = engine(
                    def("SPAN", "SUM(first:last)", "first", "last"), def("CALLER", "SPAN(A1, B10)"));

            assertThat(engine.expand("CALLER")).isEqualTo("(SUM(A1:B10))");
        }

        @Test
        void rangeArgumentIsInsertedVerbatim() {
            ExpansionEngine engine = engine(def("TOTAL", "SUM(rng)", "rng"), def("CALLER", "TOTAL($A$1:$A$10)"));

            assertThat(engine.expand("CALLER")).isEqualTo("(SUM($A$1:$A$10))");
        }

        @Test
        void binaryArgumentIsParenthesized() {
            ExpansionEngine engine = engine(DOUBLE, def("CALLER", "DOUBLE(a + b)"));

            assertThat(engine.expand("CALLER")).isEqualTo("((a + b) * 2)");
        }

        @Test
        void textOutsideCallSitesIsCopied() {
            ExpansionEngine engine = engine(DOUBLE, def("CALLER", "1+DOUBLE(3)"));

            assertThat(engine.expand("CALLER")).isEqualTo("1+(3 * 2)");
        }

        @Test
        void callInsideBuiltInArgument() {
            ExpansionEngine engine = engine(DOUBLE, def("CALLER", "SUM(DOUBLE(A1), 1)"));

            assertThat(engine.expand("CALLER")).isEqualTo("SUM((A1 * 2), 1)");
        }

        @Test
        void callInsideLetBinding() {
            ExpansionEngine engine = engine(DOUBLE, def("CALLER", "LET(v, DOUBLE(A1), v + 1)"));

            assertThat(engine.expand("CALLER")).isEqualTo("LET(v, (A1 * 2), v + 1)");
        }

        @Test
        void zeroParameterCallee() {
            ExpansionEngine engine = engine(def("TAU", "PI() * 2"), def("CALLER", "TAU() / 4"));

            assertThat(engine.expand("CALLER")).isEqualTo("(PI() * 2) / 4");
        }

        @Test
        void argumentsAreExpandedBeforeSubstitution() {
            ExpansionEngine engine = engine(
                    DOUBLE, def("INC", "n + 1", "n"), def("CALLER", "INC(DOUBLE(INC(0)))"));

            assertThat(engine.expand("CALLER")).isEqualTo("(((0 + 1) * 2) + 1)");
        }

        @Test
        void transitiveCalleeIsFullyExpanded() {
            ExpansionEngine engine = engine(
                    DOUBLE, def("QUAD", "DOUBLE(DOUBLE(y))", "y"), def("OCT", "DOUBLE(QUAD(z))", "z"));

            assertThat(engine.expand("OCT")).isEqualTo("((((z * 2) * 2)) * 2)");
        }
    }

    @Nested
    @DisplayName("Formulas without catalog calls")
    class Idempotence {

        @Test
        void bodyIsReturnedUnchanged() {
            String body = "SUM( A1:A10 ) +  IF(,,)";
            ExpansionEngine engine = engine(def("PLAIN", body));

            assertThat(engine.expand("PLAIN")).isEqualTo(body);
        }

        @Test
        void calleeNameInsideStringIsNotACall() {
            ExpansionEngine engine = engine(DOUBLE, def("TEXT", "\"DOUBLE(1)\""));

            assertThat(engine.expand("TEXT")).isEqualTo("\"DOUBLE(1)\"");
        }

        @Test
        void repeatedExpansionReturnsCachedText() {
            ExpansionEngine engine = engine(DOUBLE, def("CALLER", "DOUBLE(1)"));

            assertThat(engine.expand("CALLER")).isSameAs(engine.expand("CALLER"));
        }
    }

    @Nested
    @DisplayName("Failures")
    class Failures {

        @Test
        void undefinedFormula() {
            ExpansionEngine engine = engine(DOUBLE);

            assertThatThrownBy(() -> engine.expand("NOPE"))
                    .isInstanceOfSatisfying(UndefinedFunctionException.class, e -> {
                        assertThat(e.formulaName()).isEqualTo("NOPE");
                        assertThat(e.phase()).isEqualTo(FormulaException.Phase.EXPANSION);
                    });
        }

        @Test
        void parameterCountMismatch() {
            ExpansionEngine engine = engine(DOUBLE, def("CALLER", "1 + DOUBLE(1, 2)"));

            assertThatThrownBy(() -> engine.expand("CALLER"))
                    .isInstanceOfSatisfying(ParameterCountMismatchException.class, e -> {
                        assertThat(e.formulaName()).isEqualTo("CALLER");
                        assertThat(e.callee()).isEqualTo("DOUBLE");
                        assertThat(e.expected()).isEqualTo(1);
                        assertThat(e.actual()).isEqualTo(2);
                        assertThat(e.position()).isEqualTo(4);
                    });
        }

        @Test
        void mismatchInNestedArgument() {
            ExpansionEngine engine = engine(DOUBLE, def("CALLER", "DOUBLE(DOUBLE())"));

            assertThatThrownBy(() -> engine.expand("CALLER"))
                    .isInstanceOfSatisfying(
                            ParameterCountMismatchException.class, e -> assertThat(e.actual()).isZero());
        }

        @Test
        void cycleReachableFromRequestedFormula() {
            ExpansionEngine engine = engine(
                    def("A", "B(1)", "x"), def("B", "C(1)", "x"), def("C", "A(1)", "x"), def("ENTRY", "A(2)"));

            assertThatThrownBy(() -> engine.expand("ENTRY"))
                    .isInstanceOfSatisfying(CircularDependencyException.class, e -> {
                        assertThat(e.formulaName()).isEqualTo("ENTRY");
                        assertThat(e.cycles()).containsExactly(List.of("A", "B", "C", "A"));
                        assertThat(e.getMessage()).contains("A -> B -> C -> A");
                    });
        }

        @Test
        void unrelatedFormulaStillExpandsButExpandAllRefuses() {
            ExpansionEngine engine = engine(def("A", "B(1)", "x"), def("B", "A(1)", "x"), def("SAFE", "1 + 1"));

            assertThat(engine.expand("SAFE")).isEqualTo("1 + 1");
            assertThatThrownBy(engine::expandAll).isInstanceOf(CircularDependencyException.class);
        }

        @Test
        void parseErrorNamesTheFormula() {
            ExpansionEngine engine = engine(def("BROKEN", "SUM(1,"));

            assertThatThrownBy(() -> engine.expand("BROKEN"))
                    .isInstanceOfSatisfying(FormulaParseException.class, e -> {
                        assertThat(e.formulaName()).isEqualTo("BROKEN");
                        assertThat(e.position()).isEqualTo(6);
                        assertThat(e.getMessage()).startsWith("BROKEN: Syntax error");
                    });
        }

        @Test
        void parseErrorDoesNotBlockUnrelatedFormulas() {
            ExpansionEngine engine = engine(def("GOOD", "1 + 1"), def("BAD", "SUM(1,"));

            assertThat(engine.expand("GOOD")).isEqualTo("1 + 1");
            assertThat(engine.dependencyGraph().parseFailures()).containsOnlyKeys("BAD");
            assertThatThrownBy(engine::expandAll)
                    .isInstanceOfSatisfying(FormulaParseException.class, e -> assertThat(e.formulaName())
                            .isEqualTo("BAD"));
        }

        @Test
        void parseErrorOfCalleeFailsTheCaller() {
            ExpansionEngine engine =
                    engine(def("BAD", "SUM(x,", "x"), def("MIDDLE", "BAD(1) + 1"), def("TOP", "MIDDLE() * 2"));

            assertThatThrownBy(() -> engine.expand("TOP"))
                    .isInstanceOfSatisfying(FormulaParseException.class, e -> {
                        assertThat(e.formulaName()).isEqualTo("BAD");
                        assertThat(e.getMessage()).startsWith("BAD: Syntax error");
                    });
        }

        @Test
        @DisplayName("A call the extractor misses is caught instead of shipped unexpanded")
        void missedCallIsDetected() {
            CallExtractor blind = (root, knownNames) -> List.of();
            FormulaRegistry registry =
                    FormulaRegistry.of(def("KNOWNCALL", "x * 3", "x"), def("CALLER", "KNOWNCALL(1) + 2"));
            ExpansionEngine engine = new ExpansionEngine(registry, new FormulaParser(), blind);

            assertThatThrownBy(() -> engine.expand("CALLER"))
                    .isInstanceOfSatisfying(ExpansionNoOpException.class, e -> {
                        assertThat(e.unexpandedCalls()).containsExactly("KNOWNCALL");
                        assertThat(e.formulaName()).isEqualTo("CALLER");
                        assertThat(e.getMessage()).contains("KNOWNCALL(1) + 2");
                    });
        }
    }

    @Nested
    class WholeCatalog {

        @Test
        void expandAllIsInNameOrder() {
            ExpansionEngine engine = engine(def("QUAD", "DOUBLE(DOUBLE(y))", "y"), DOUBLE, def("ONE", "1"));

            Map<String, String> expanded = engine.expandAll();

            assertThat(expanded).containsOnlyKeys("DOUBLE", "ONE", "QUAD");
            assertThat(expanded.keySet()).containsExactly("DOUBLE", "ONE", "QUAD");
            assertThat(expanded.get("QUAD")).isEqualTo("((y * 2) * 2)");
        }

        @Test
        void graphIsExposedWithoutExpanding() {
            ExpansionEngine engine = engine(DOUBLE, def("QUAD", "DOUBLE(DOUBLE(y))", "y"));

            assertThat(engine.dependencyGraph().dependenciesOf("QUAD")).containsExactly("DOUBLE");
            assertThat(engine.cycles()).isEmpty();
        }

        @Test
        void concurrentExpansionAgrees() throws Exception {
            ExpansionEngine engine = engine(
                    DOUBLE, def("QUAD", "DOUBLE(DOUBLE(y))", "y"), def("OCT", "DOUBLE(QUAD(z))", "z"));
            ExecutorService pool = Executors.newFixedThreadPool(4);
            try {
                List<Callable<String>> tasks = new ArrayList<>();
                for (int i = 0; i < 16; i++) {
                    tasks.add(() -> engine.expand("OCT"));
                }
                for (Future<String> result : pool.invokeAll(tasks)) {
                    assertThat(result.get()).isEqualTo("((((z * 2) * 2)) * 2)");
                }
            } finally {
                pool.shutdownNow();
            }
        }
    }

    private static FormulaDefinition def(String name, String body, String... parameters) {
        return FormulaDefinition.of(name, List.of(parameters), body);
    }

    private static ExpansionEngine engine(FormulaDefinition... definitions) {
        return new ExpansionEngine(FormulaRegistry.of(definitions));
    }
}
