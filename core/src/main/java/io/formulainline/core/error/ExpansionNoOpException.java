package io.formulainline.core.error;

import java.util.List;

/**
 * Thrown when an expanded formula still contains calls to catalog formulas. This means a call was
 * missed by the extractor or left untouched by substitution, and the text must not be published.
 */
public final class ExpansionNoOpException extends FormulaExpansionException {

    private static final long serialVersionUID = 1L;

    private final List<String> unexpandedCalls;

    public ExpansionNoOpException(String formulaName, List<String> unexpandedCalls, String originalText) {
        super(
                formulaName + ": Formula expansion failed - calls to " + String.join(", ", unexpandedCalls)
                        + " were not expanded.\n  Original formula: " + abbreviate(originalText),
                formulaName);
        this.unexpandedCalls = List.copyOf(unexpandedCalls);
    }

    /** Names of the catalog formulas still called in the output, sorted. */
    public List<String> unexpandedCalls() {
        return unexpandedCalls;
    }

    private static String abbreviate(String text) {
        return text.length() > 100 ? text.substring(0, 100) + "..." : text;
    }
}
