package io.formulainline.core.error;

/**
 * Abstract parent for catalog load errors. Thrown while reading formula definition files, before
 * any formula text is parsed. Carries an additional {@code source} field identifying the file that
 * caused the error.
 */
public abstract class CatalogLoadException extends FormulaException {

    private static final long serialVersionUID = 1L;

    private final String source;

    protected CatalogLoadException(String message, String formulaName, String source) {
        super(message, formulaName, Phase.LOAD);
        this.source = source;
    }

    protected CatalogLoadException(String message, Throwable cause, String formulaName, String source) {
        super(message, cause, formulaName, Phase.LOAD);
        this.source = source;
    }

    /** The file path or resource identifier that caused the error. */
    public String source() {
        return source;
    }
}
