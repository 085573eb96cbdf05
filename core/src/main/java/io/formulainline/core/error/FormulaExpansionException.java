package io.formulainline.core.error;

/**
 * Abstract parent for expansion errors. Thrown by the expansion engine when a formula cannot be
 * turned into a self-contained text. Every subclass is fatal for the formula being expanded.
 */
public abstract class FormulaExpansionException extends FormulaException {

    private static final long serialVersionUID = 1L;

    protected FormulaExpansionException(String message, String formulaName) {
        super(message, formulaName, Phase.EXPANSION);
    }

    protected FormulaExpansionException(String message, Throwable cause, String formulaName) {
        super(message, cause, formulaName, Phase.EXPANSION);
    }
}
