package io.formulainline.core.error;

/**
 * Thrown when a formula definition file has invalid YAML, missing required fields or duplicate
 * names.
 */
public final class CatalogParseException extends CatalogLoadException {

    private static final long serialVersionUID = 1L;

    public CatalogParseException(String message, String formulaName, String source) {
        super(message, formulaName, source);
    }

    public CatalogParseException(String message, Throwable cause, String formulaName, String source) {
        super(message, cause, formulaName, source);
    }
}
