package io.formulainline.core.error;

import java.util.List;

/** Thrown when a formula definition document does not conform to the formula JSON Schema. */
public final class SchemaValidationException extends CatalogLoadException {

    private static final long serialVersionUID = 1L;

    private final List<String> violations;

    public SchemaValidationException(String message, List<String> violations, String formulaName, String source) {
        super(message, formulaName, source);
        this.violations = List.copyOf(violations);
    }

    /** Individual schema violation messages, in validator order. */
    public List<String> violations() {
        return violations;
    }
}
