package io.formulainline.core.error;

/** Thrown when a call site passes a different number of arguments than the callee declares. */
public final class ParameterCountMismatchException extends FormulaExpansionException {

    private static final long serialVersionUID = 1L;

    private final String callee;
    private final int expected;
    private final int actual;
    private final int position;

    public ParameterCountMismatchException(String formulaName, String callee, int expected, int actual, int position) {
        super(
                formulaName + ": call to " + callee + " at position " + position
                        + " has a parameter count mismatch: expected " + expected + ", got " + actual,
                formulaName);
        this.callee = callee;
        this.expected = expected;
        this.actual = actual;
        this.position = position;
    }

    /** Name of the formula being called. */
    public String callee() {
        return callee;
    }

    /** Number of parameters the callee declares. */
    public int expected() {
        return expected;
    }

    /** Number of arguments present at the call site. */
    public int actual() {
        return actual;
    }

    /** Start offset of the call site in the caller's body. */
    public int position() {
        return position;
    }
}
