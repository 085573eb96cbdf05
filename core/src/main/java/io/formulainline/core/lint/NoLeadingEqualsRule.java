package io.formulainline.core.lint;

import com.fasterxml.jackson.databind.JsonNode;
import io.formulainline.core.spi.LintRule;
import java.nio.file.Path;

/** The formula field holds the body only; the leading {@code =} is added by the spreadsheet. */
public final class NoLeadingEqualsRule implements LintRule {

    @Override
    public String name() {
        return "no-leading-equals";
    }

    @Override
    public String description() {
        return "Formula field must not start with '=' character";
    }

    @Override
    public LintReport check(Path file, JsonNode document) {
        JsonNode formula = document.get("formula");
        if (formula == null || !formula.isTextual()) {
            return LintReport.empty();
        }
        if (formula.asText().stripLeading().startsWith("=")) {
            return LintReport.of(LintFinding.error(
                    name(), file, "Formula starts with '=' character. Remove the leading '=' from the formula field."));
        }
        return LintReport.empty();
    }
}
