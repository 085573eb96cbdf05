package io.formulainline.core.lint;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.formulainline.core.error.CatalogParseException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class FormulaLinterTest {

    @TempDir
    Path catalog;

    private final FormulaLinter linter = new FormulaLinter();

    private void write(String fileName, String name, String parameters, String formula) throws IOException {
        Files.writeString(catalog.resolve(fileName), "name: " + name + "\n"
                + "version: 1.0.0\n"
                + "description: " + name + " formula\n"
                + "parameters:" + parameters + "\n"
                + "formula: '" + formula + "'\n");
    }

    private static String param(String name) {
        return "\n  - name: " + name + "\n    description: " + name + " value\n    example: \"1\"";
    }

    @Test
    void fixtureCatalogPasses() {
        LintSummary summary = linter.lintDirectory(Path.of("src/test/resources/catalog"), "*.yaml");

        assertThat(summary.filesChecked()).isEqualTo(2);
        // quad.yaml keeps its leading '=' in the raw document
        assertThat(summary.errors()).singleElement().satisfies(finding -> {
            assertThat(finding.rule()).isEqualTo("no-leading-equals");
            assertThat(finding.file().getFileName()).hasToString("quad.yaml");
        });
    }

    @Test
    void defaultRulesInReportingOrder() {
        assertThat(linter.rules())
                .extracting(rule -> rule.name())
                .containsExactly(
                        "no-leading-equals",
                        "no-top-level-lambda",
                        "require-parameter-examples",
                        "valid-formula-syntax");
    }

    @Test
    void perFileFindingsAreCollectedAcrossFiles() throws IOException {
        write("a.yaml", "A", " []", "=1 + 1");
        write("b.yaml", "B", " []", "SUM(1,");
        Files.writeString(catalog.resolve("c.yaml"), "name: [broken\n");

        LintSummary summary = linter.lintDirectory(catalog, "*.yaml");

        assertThat(summary.filesChecked()).isEqualTo(3);
        assertThat(summary.passed()).isFalse();
        assertThat(summary.errors())
                .extracting(LintFinding::rule)
                .containsExactly("no-leading-equals", "valid-formula-syntax", FormulaLinter.YAML_RULE);
    }

    @Test
    void cleanCatalogPasses() throws IOException {
        write("double.yaml", "DOUBLE", param("x"), "x * 2");
        write("quad.yaml", "QUAD", param("y"), "DOUBLE(DOUBLE(y))");

        LintSummary summary = linter.lintDirectory(catalog, "*.yaml");

        assertThat(summary.passed()).isTrue();
        assertThat(summary.report().findings()).isEmpty();
    }

    @Test
    void selfInvokingLambdaWarnsAndFailsSyntax() throws IOException {
        write("a.yaml", "A", " []", "LAMBDA(1)()");

        LintSummary summary = linter.lintDirectory(catalog, "*.yaml");

        assertThat(summary.warnings()).extracting(LintFinding::rule).containsExactly("no-top-level-lambda");
        assertThat(summary.errors()).extracting(LintFinding::rule).containsExactly("valid-formula-syntax");
    }

    @Test
    void cyclesAreReportedWithoutExpanding() throws IOException {
        write("a.yaml", "A", param("x"), "B(x) + 1");
        write("b.yaml", "B", param("y"), "A(y) * 2");

        LintSummary summary = linter.lintDirectory(catalog, "*.yaml");

        assertThat(summary.errors()).singleElement().satisfies(finding -> {
            assertThat(finding.rule()).isEqualTo(FormulaLinter.CYCLE_RULE);
            assertThat(finding.message()).isEqualTo("Circular dependency: A -> B -> A");
            assertThat(finding.file()).isEqualTo(catalog.resolve("a.yaml"));
        });
    }

    @Test
    void argumentCountMismatchIsReported() throws IOException {
        write("double.yaml", "DOUBLE", param("x"), "x * 2");
        write("user.yaml", "USER", " []", "1 + DOUBLE(1, 2)");

        LintSummary summary = linter.lintDirectory(catalog, "*.yaml");

        assertThat(summary.errors()).singleElement().satisfies(finding -> {
            assertThat(finding.rule()).isEqualTo(FormulaLinter.ARGUMENT_COUNT_RULE);
            assertThat(finding.file()).isEqualTo(catalog.resolve("user.yaml"));
            assertThat(finding.message())
                    .isEqualTo("Call to DOUBLE at position 4 passes 2 argument(s) but DOUBLE declares 1 parameter(s)");
        });
    }

    @Test
    void schemaViolationsSurfaceAsDefinitionErrors() throws IOException {
        Files.writeString(catalog.resolve("x.yaml"), "name: X\nversion: 1.0.0\nparameters: []\nformula: '1'\n");

        LintSummary summary = linter.lintDirectory(catalog, "*.yaml");

        assertThat(summary.errors()).singleElement().satisfies(finding -> {
            assertThat(finding.rule()).isEqualTo(FormulaLinter.DEFINITION_RULE);
            assertThat(finding.message()).startsWith("Formula definition violates schema");
        });
    }

    @Test
    void missingDirectoryIsThrown() {
        assertThatThrownBy(() -> linter.lintDirectory(catalog.resolve("missing"), "*.yaml"))
                .isInstanceOf(CatalogParseException.class);
    }
}
