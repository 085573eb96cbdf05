package io.formulainline.core.lint;

import java.util.ArrayList;
import java.util.List;

/** Findings for one file, or for one rule applied to one file. */
public record LintReport(List<LintFinding> findings) {

    private static final LintReport EMPTY = new LintReport(List.of());

    public LintReport {
        findings = List.copyOf(findings);
    }

    public static LintReport empty() {
        return EMPTY;
    }

    /**
     * Creates a report from individual findings.
     *
     * @param findings findings in reporting order
     * @return a report holding them
     */
    public static LintReport of(LintFinding... findings) {
        return new LintReport(List.of(findings));
    }

    /**
     * This report followed by the findings of {@code other}.
     *
     * @param other findings to append
     * @return the combined report; {@code this} when {@code other} is empty
     */
    public LintReport merge(LintReport other) {
        if (other.findings.isEmpty()) {
            return this;
        }
        List<LintFinding> merged = new ArrayList<>(findings);
        merged.addAll(other.findings);
        return new LintReport(merged);
    }

    public List<LintFinding> errors() {
        return findings.stream().filter(LintFinding::isError).toList();
    }

    public List<LintFinding> warnings() {
        return findings.stream().filter(finding -> !finding.isError()).toList();
    }

    public boolean hasErrors() {
        return findings.stream().anyMatch(LintFinding::isError);
    }
}
