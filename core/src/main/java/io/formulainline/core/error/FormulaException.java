package io.formulainline.core.error;

/**
 * Abstract base for all formula-inline exceptions. Never thrown directly; use the concrete
 * subclasses under {@link CatalogLoadException}, {@link FormulaExpansionException} or {@link
 * FormulaParseException}.
 */
public abstract class FormulaException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    /** Phase in which the error occurred. */
    public enum Phase {
        LOAD,
        PARSE,
        EXPANSION
    }

    private final String formulaName;
    private final Phase phase;

    protected FormulaException(String message, String formulaName, Phase phase) {
        super(message);
        this.formulaName = formulaName;
        this.phase = phase;
    }

    protected FormulaException(String message, Throwable cause, String formulaName, Phase phase) {
        super(message, cause);
        this.formulaName = formulaName;
        this.phase = phase;
    }

    /** The formula that triggered the error, or {@code null} if not yet identified. */
    public String formulaName() {
        return formulaName;
    }

    /** Human-readable error description (alias for {@link #getMessage()}). */
    public String detail() {
        return getMessage();
    }

    /** The phase in which the error occurred. */
    public Phase phase() {
        return phase;
    }
}
