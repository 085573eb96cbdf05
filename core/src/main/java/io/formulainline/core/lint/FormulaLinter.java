package io.formulainline.core.lint;

import com.fasterxml.jackson.databind.JsonNode;
import io.formulainline.core.catalog.FormulaCatalogParser;
import io.formulainline.core.engine.AstCallExtractor;
import io.formulainline.core.engine.CycleDetector;
import io.formulainline.core.engine.DependencyGraph;
import io.formulainline.core.engine.FormulaRegistry;
import io.formulainline.core.error.CircularDependencyException;
import io.formulainline.core.error.FormulaException;
import io.formulainline.core.error.FormulaParseException;
import io.formulainline.core.grammar.FormulaParser;
import io.formulainline.core.model.FormulaDefinition;
import io.formulainline.core.model.FunctionCall;
import io.formulainline.core.spi.CallExtractor;
import io.formulainline.core.spi.LintRule;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs {@link LintRule}s over a catalog directory.
 *
 * <p>
 * Each file is checked on its own first. When every file is free of errors, the catalog is
 * checked as a whole for circular dependencies and for calls with the wrong number of arguments;
 * neither check expands anything. Problems with a file are reported as findings, never thrown.
 */
public final class FormulaLinter {

    private static final Logger LOG = LoggerFactory.getLogger(FormulaLinter.class);

    static final String YAML_RULE = "valid-yaml";
    static final String DEFINITION_RULE = "valid-definition";
    static final String CYCLE_RULE = "no-circular-dependencies";
    static final String ARGUMENT_COUNT_RULE = "matching-argument-count";

    private final List<LintRule> rules;
    private final FormulaCatalogParser catalogParser = new FormulaCatalogParser();
    private final FormulaParser parser = new FormulaParser();
    private final CallExtractor extractor = new AstCallExtractor();

    /**
     * Creates a linter running {@link #defaultRules()}.
     *
     */
    public FormulaLinter() {
        this(defaultRules());
    }

    /**
     * Creates a linter with a custom rule set.
     *
     * @param rules per-file rules, applied in this order
     */
    public FormulaLinter(List<LintRule> rules) {
        this.rules = List.copyOf(rules);
    }

    /**
     * The built-in per-file rules, in reporting order.
     *
     * @return the four standard rules
     */
    public static List<LintRule> defaultRules() {
        return List.of(
                new NoLeadingEqualsRule(),
                new NoTopLevelLambdaRule(),
                new RequireParameterExamplesRule(),
                new ValidFormulaSyntaxRule());
    }

    /**
     * Returns the per-file rules this linter applies.
     *
     * @return the rules in reporting order
     */
    public List<LintRule> rules() {
        return rules;
    }

    /**
     * Applies every rule to one file. An unreadable file yields a single error finding.
     *
     * @param file a definition file
     * @return the findings of every rule, in rule order
     */
    public LintReport lintFile(Path file) {
        JsonNode document;
        try {
            document = catalogParser.readDocument(file);
        } catch (FormulaException e) {
            return LintReport.of(LintFinding.error(YAML_RULE, file, e.getMessage()));
        }
        LintReport report = LintReport.empty();
        for (LintRule rule : rules) {
            report = report.merge(rule.check(file, document));
        }
        return report;
    }

    /**
     * Lints every file in {@code directory} matching {@code glob}, then the catalog as a whole.
     *
     * <p>
     * Catalog-level checks run only when every file loaded without errors.
     *
     * @param directory the catalog directory
     * @param glob      file-name pattern
     * @return the number of files checked and all findings
     * @throws io.formulainline.core.error.CatalogParseException if the directory cannot be listed
     */
    public LintSummary lintDirectory(Path directory, String glob) {
        List<Path> files = FormulaCatalogParser.listFiles(directory, glob);
        LintReport report = LintReport.empty();
        for (Path file : files) {
            LintReport fileReport = lintFile(file);
            LOG.debug(
                    "File linted: file={}, errors={}, warnings={}",
                    file,
                    fileReport.errors().size(),
                    fileReport.warnings().size());
            report = report.merge(fileReport);
        }
        if (!report.hasErrors()) {
            report = report.merge(lintCatalog(files));
        }
        LintSummary summary = new LintSummary(files.size(), report);
        LOG.info(
                "Lint complete: files={}, errors={}, warnings={}",
                summary.filesChecked(),
                summary.errorCount(),
                summary.warningCount());
        return summary;
    }

    private LintReport lintCatalog(List<Path> files) {
        Map<String, Path> sources = new LinkedHashMap<>();
        FormulaRegistry.Builder builder = FormulaRegistry.builder();
        LintReport report = LintReport.empty();
        for (Path file : files) {
            try {
                FormulaDefinition definition = catalogParser.parse(file);
                builder.add(definition);
                sources.put(definition.name(), file);
            } catch (FormulaException e) {
                report = report.merge(LintReport.of(LintFinding.error(DEFINITION_RULE, file, e.getMessage())));
            }
        }
        if (report.hasErrors()) {
            return report;
        }
        FormulaRegistry registry = builder.build();
        DependencyGraph graph = DependencyGraph.build(registry, parser, extractor);
        if (!graph.parseFailures().isEmpty()) {
            for (FormulaParseException e : graph.parseFailures().values()) {
                report = report.merge(
                        LintReport.of(LintFinding.error(DEFINITION_RULE, sources.get(e.formulaName()), e.getMessage())));
            }
            return report;
        }
        for (List<String> cycle : new CycleDetector().detectCycles(graph)) {
            report = report.merge(LintReport.of(LintFinding.error(
                    CYCLE_RULE,
                    sources.get(cycle.get(0)),
                    "Circular dependency: " + CircularDependencyException.render(cycle))));
        }
        for (FormulaDefinition definition : registry.definitions()) {
            report = report.merge(checkArgumentCounts(definition, registry, sources.get(definition.name())));
        }
        return report;
    }

    private LintReport checkArgumentCounts(FormulaDefinition definition, FormulaRegistry registry, Path file) {
        LintReport report = LintReport.empty();
        for (FunctionCall call : extractor.extract(parser.parse(definition.body()), registry.names())) {
            int expected = registry.get(call.name()).parameters().size();
            if (call.args().size() != expected) {
                report = report.merge(LintReport.of(LintFinding.error(
                        ARGUMENT_COUNT_RULE,
                        file,
                        "Call to " + call.name() + " at position " + call.span().start() + " passes "
                                + call.args().size() + " argument(s) but " + call.name() + " declares "
                                + expected + " parameter(s)")));
            }
        }
        return report;
    }
}
