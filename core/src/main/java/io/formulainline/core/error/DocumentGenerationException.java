package io.formulainline.core.error;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Thrown when a document cannot be generated. Carries every per-formula failure so all of them can
 * be reported at once; empty when the template itself is unusable.
 */
public final class DocumentGenerationException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final List<FormulaException> failures;

    public DocumentGenerationException(String message) {
        super(message);
        this.failures = List.of();
    }

    public DocumentGenerationException(List<FormulaException> failures) {
        super(buildMessage(failures), failures.isEmpty() ? null : failures.get(0));
        this.failures = List.copyOf(failures);
        for (int i = 1; i < this.failures.size(); i++) {
            addSuppressed(this.failures.get(i));
        }
    }

    /** The formula failures, in document order. */
    public List<FormulaException> failures() {
        return failures;
    }

    private static String buildMessage(List<FormulaException> failures) {
        return "Formula expansion failures detected (" + failures.size() + " formula(s)):"
                + failures.stream()
                        .map(f -> "\n  - " + describe(f))
                        .collect(Collectors.joining())
                + "\nThese formulas must be fixed before the document can be generated.";
    }

    private static String describe(FormulaException failure) {
        String prefix = failure.formulaName() + ": ";
        if (failure.formulaName() == null || failure.getMessage().startsWith(prefix)) {
            return failure.getMessage();
        }
        return prefix + failure.getMessage();
    }
}
