package io.formulainline.core.lint;

import com.fasterxml.jackson.databind.JsonNode;
import io.formulainline.core.spi.LintRule;
import java.nio.file.Path;
import java.util.Locale;

/**
 * A named function is stored without its {@code LAMBDA(params, ...)} wrapper, which the spreadsheet
 * adds from the parameter list. An uninvoked top-level {@code LAMBDA(} is an error; a self-invoking
 * {@code LAMBDA(...)(...)} is only a warning since it behaves like its body.
 */
public final class NoTopLevelLambdaRule implements LintRule {

    private static final String PREFIX = "LAMBDA(";

    @Override
    public String name() {
        return "no-top-level-lambda";
    }

    @Override
    public String description() {
        return "Formula field must not start with uninvoked LAMBDA wrapper";
    }

    @Override
    public LintReport check(Path file, JsonNode document) {
        JsonNode formula = document.get("formula");
        if (formula == null || !formula.isTextual()) {
            return LintReport.empty();
        }
        String text = formula.asText().strip();
        if (!text.toUpperCase(Locale.ROOT).startsWith(PREFIX)) {
            return LintReport.empty();
        }
        int close = matchingParen(text, PREFIX.length() - 1);
        if (close >= 0 && text.substring(close + 1).stripLeading().startsWith("(")) {
            return LintReport.of(LintFinding.warning(
                    name(),
                    file,
                    "Formula uses self-executing LAMBDA pattern. For parameterless functions this is unnecessary;"
                            + " consider removing the LAMBDA wrapper."));
        }
        return LintReport.of(LintFinding.error(
                name(),
                file,
                "Formula starts with uninvoked LAMBDA wrapper. The spreadsheet adds the LAMBDA wrapper from the"
                        + " declared parameters; only include the formula body."));
    }

    /** Offset of the parenthesis closing the one at {@code open}, skipping strings, or -1. */
    static int matchingParen(String text, int open) {
        int depth = 0;
        char quote = 0;
        for (int i = open; i < text.length(); i++) {
            char c = text.charAt(i);
            if (quote != 0) {
                if (c == '\\' && i + 1 < text.length() && text.charAt(i + 1) == quote) {
                    i++;
                } else if (c == quote) {
                    quote = 0;
                }
            } else if (c == '"' || c == '\'') {
                quote = c;
            } else if (c == '(') {
                depth++;
            } else if (c == ')' && --depth == 0) {
                return i;
            }
        }
        return -1;
    }
}
