package io.formulainline.core.error;

/** Thrown when a requested formula name is not present in the registry. */
public final class UndefinedFunctionException extends FormulaExpansionException {

    private static final long serialVersionUID = 1L;

    public UndefinedFunctionException(String formulaName) {
        super("Undefined formula: '" + formulaName + "'", formulaName);
    }
}
