package io.formulainline.core.lint;

import com.fasterxml.jackson.databind.JsonNode;
import io.formulainline.core.catalog.FormulaCatalogParser;
import io.formulainline.core.error.FormulaParseException;
import io.formulainline.core.grammar.FormulaParser;
import io.formulainline.core.spi.LintRule;
import java.nio.file.Path;

/** The comment-stripped formula parses as exactly one expression. */
public final class ValidFormulaSyntaxRule implements LintRule {

    private final FormulaParser parser = new FormulaParser();

    @Override
    public String name() {
        return "valid-formula-syntax";
    }

    @Override
    public String description() {
        return "Formula must be parseable by the formula grammar";
    }

    @Override
    public LintReport check(Path file, JsonNode document) {
        JsonNode formula = document.get("formula");
        if (formula == null || !formula.isTextual()) {
            return LintReport.empty();
        }
        try {
            parser.parse(FormulaCatalogParser.normalizeBody(formula.asText()));
            return LintReport.empty();
        } catch (FormulaParseException e) {
            return LintReport.of(LintFinding.error(
                    name(),
                    file,
                    "Formula syntax error at position " + e.position() + ": expected " + e.expected()));
        }
    }
}
