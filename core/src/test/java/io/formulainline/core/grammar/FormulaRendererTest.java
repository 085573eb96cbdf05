package io.formulainline.core.grammar;

import static org.assertj.core.api.Assertions.assertThat;

import io.formulainline.core.model.FunctionCall;
import io.formulainline.core.model.Node;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

class FormulaRendererTest {

    private final FormulaParser parser = new FormulaParser();
    private final FormulaRenderer renderer = new FormulaRenderer();

    @ParameterizedTest(name = "{0} -> {1}")
    @CsvSource(
            delimiter = '|',
            value = {
                "IF(,,)|IF(,,)",
                "BLANK()|BLANK()",
                "FUNC(A1,)|FUNC(A1,)",
                "FUNC(,B1)|FUNC(, B1)",
                "FUNC(A1,,B1)|FUNC(A1,, B1)",
                "SUM( A1 ,B1 )|SUM(A1, B1)",
                "1+2|1 + 2",
                "--A1|--A1",
                "A1*-1|A1 * -1",
                "{1, 2; 3, 4}|{1,2;3,4}",
                "((A1))|((A1))",
                "$A$1:$B$10|$A$1:$B$10",
                "1.50|1.50"
            })
    void rendersCanonicalText(String input, String expected) {
        assertThat(renderer.render(parser.parse(input))).isEqualTo(expected);
    }

    @Test
    void doubledQuoteStringKeepsItsConvention() {
        assertThat(renderer.render(parser.parse("'it''s'"))).isEqualTo("'it''s'");
    }

    @Test
    void backslashStringKeepsItsConvention() {
        assertThat(renderer.render(parser.parse("\"say \\\"hi\\\"\""))).isEqualTo("\"say \\\"hi\\\"\"");
    }

    @Test
    void subclassCanReplaceCalls() {
        FormulaRenderer upper = new FormulaRenderer() {
            @Override
            public String visitCall(FunctionCall node) {
                return node.name().equals("F") ? "<f>" : super.visitCall(node);
            }
        };

        assertThat(upper.render(parser.parse("SUM(F(1), 2)"))).isEqualTo("SUM(<f>, 2)");
    }

    @Test
    @DisplayName("Descriptions ignore spans but keep depth and empty slots")
    void describeIsSpanFree() {
        assertThat(FormulaRenderer.describe(parser.parse("  F(A1,)")))
                .isEqualTo(FormulaRenderer.describe(parser.parse("F(A1,)")))
                .isEqualTo("(call F d0 (cell A1) (empty))");
    }

    @ParameterizedTest
    @ValueSource(
            strings = {
                "IF(,,)",
                "FUNC(A1,,B1)",
                "FUNC(,B1)",
                "BLANK()",
                "--A1",
                "+-A1",
                "A1 * -1",
                "1 - 2 * 3 ^ 4 & \"x\"",
                "{1,2;3,4}",
                "((A1))",
                "\"He said \"\"hi\"\"\"",
                "'single ''quoted'''",
                "\"back \\\"slash\\\"\"",
                "LET(x, SUM(A1:A10), IF(x > 0, x, -x))",
                "BYROW($A$1:$A$10, LAMBDA(row, IFERROR(INDEX(row, 1), \"\")))",
                "A1 <> B1",
                "NORM.DIST(0, 0, 1, TRUE)",
                "2:2",
                "IF(\n  A1 >= 1,\n  {1, 2},\n  (3)\n)"
            })
    @DisplayName("parse(render(parse(text))) is structurally equal to parse(text)")
    void roundTrip(String text) {
        Node first = parser.parse(text);
        Node second = parser.parse(renderer.render(first));

        assertThat(FormulaRenderer.describe(second)).isEqualTo(FormulaRenderer.describe(first));
    }
}
