package io.formulainline.core.lint;

import java.nio.file.Path;
import java.util.Objects;

/**
 * One problem reported by a lint rule.
 *
 * @param severity whether the problem fails the lint run
 * @param rule     name of the rule that reported it
 * @param file     file the problem was found in
 * @param message  description without the file name
 */
public record LintFinding(Severity severity, String rule, Path file, String message) {

    public enum Severity {
        ERROR,
        WARNING
    }

    public LintFinding {
        Objects.requireNonNull(severity, "severity must not be null");
        Objects.requireNonNull(rule, "rule must not be null");
        Objects.requireNonNull(message, "message must not be null");
    }

    /**
     * Creates a finding that fails the run.
     *
     * @param rule    reporting rule
     * @param file    offending file
     * @param message description
     * @return an error finding
     */
    public static LintFinding error(String rule, Path file, String message) {
        return new LintFinding(Severity.ERROR, rule, file, message);
    }

    /**
     * Creates a finding that is reported but does not fail the run.
     *
     * @param rule    reporting rule
     * @param file    offending file
     * @param message description
     * @return a warning finding
     */
    public static LintFinding warning(String rule, Path file, String message) {
        return new LintFinding(Severity.WARNING, rule, file, message);
    }

    public boolean isError() {
        return severity == Severity.ERROR;
    }

    @Override
    public String toString() {
        return (file != null ? file + ": " : "") + message + " [" + rule + "]";
    }
}
