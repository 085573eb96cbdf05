package io.formulainline.core.lint;

import java.util.List;

/**
 * Result of linting a whole catalog directory.
 *
 * @param filesChecked number of definition files examined
 * @param report       every finding, per-file findings first, then catalog-level ones
 */
public record LintSummary(int filesChecked, LintReport report) {

    public List<LintFinding> errors() {
        return report.errors();
    }

    public List<LintFinding> warnings() {
        return report.warnings();
    }

    public int errorCount() {
        return errors().size();
    }

    public int warningCount() {
        return warnings().size();
    }

    /** True when no errors were found; warnings do not fail a run. */
    public boolean passed() {
        return !report.hasErrors();
    }
}
