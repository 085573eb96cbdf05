package io.formulainline.tool;

import io.formulainline.core.catalog.FormulaCatalogParser;
import io.formulainline.core.doc.ReadmeGenerator;
import io.formulainline.core.engine.ExpansionEngine;
import io.formulainline.core.engine.FormulaRegistry;
import io.formulainline.core.error.CircularDependencyException;
import io.formulainline.core.error.DocumentGenerationException;
import io.formulainline.core.lint.FormulaLinter;
import io.formulainline.core.lint.LintFinding;
import io.formulainline.core.lint.LintSummary;
import io.formulainline.core.spi.LintRule;
import io.formulainline.tool.config.ConfigLoadException;
import io.formulainline.tool.config.ConfigLoader;
import io.formulainline.tool.config.ToolConfig;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Command-line runner for a formula catalog.
 *
 * <ul>
 *   <li>{@code generate} loads the catalog, refuses to continue on any circular dependency, and
 *       writes the README from its template
 *   <li>{@code lint} runs every lint rule and reports errors and warnings
 * </ul>
 *
 * <p>
 * {@link #run} returns the process exit code: 0 on success, 1 on any error, 2 for a usage error.
 * Command output goes to the {@code out} stream, error messages to {@code err}; log events go through
 * SLF4J.
 */
public final class CatalogTool {

    private static final Logger LOG = LoggerFactory.getLogger(CatalogTool.class);

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;
    static final int EXIT_USAGE = 2;

    static final String USAGE = String.join(
            "\n",
            "Usage: formula-inline <command> [--config <path>]",
            "",
            "Commands:",
            "  generate   Expand every formula and write the README from its template",
            "  lint       Check every formula definition file and the catalog as a whole",
            "",
            "Options:",
            "  --config <path>   configuration file (default: " + ConfigLoader.DEFAULT_CONFIG_FILE + ")");

    private final PrintStream out;
    private final PrintStream err;
    private final Function<String, String> envLookup;

    /**
     * Creates a tool writing to the given streams.
     *
     * @param out       receives reports and usage text
     * @param err       receives error messages
     * @param envLookup resolves environment variables for the configuration overlay
     */
    public CatalogTool(PrintStream out, PrintStream err, Function<String, String> envLookup) {
        this.out = out;
        this.err = err;
        this.envLookup = envLookup;
    }

    /**
     * Runs one command and returns its exit code.
     *
     * @param args command-line arguments: a command, optionally {@code --config <path>}
     * @return 0 on success, 1 when the command fails, 2 on a usage error
     */
    public int run(String[] args) {
        String command = null;
        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            if ("--config".equals(arg)) {
                i++;
            } else if ("--help".equals(arg) || "-h".equals(arg)) {
                out.println(USAGE);
                return EXIT_OK;
            } else if (arg.startsWith("-") || command != null) {
                return usageError("Unexpected argument: " + arg);
            } else {
                command = arg;
            }
        }
        if (command == null) {
            return usageError("Missing command");
        }
        if (!"generate".equals(command) && !"lint".equals(command)) {
            return usageError("Unknown command: " + command);
        }

        try {
            ToolConfig config = loadConfig(args);
            LogbackConfigurator.configure(config.loggingFormat(), config.loggingLevel());
            LOG.debug("Configuration loaded: command={}, config={}", command, config);
            return "generate".equals(command) ? generate(config) : lint(config);
        } catch (IllegalArgumentException e) {
            return usageError(e.getMessage());
        } catch (IOException | RuntimeException e) {
            err.println("Error: " + e.getMessage());
            LOG.debug("Command failed: command={}", command, e);
            return EXIT_FAILURE;
        }
    }

    private ToolConfig loadConfig(String[] args) {
        Path configPath = ConfigLoader.resolveConfigPath(args);
        boolean explicit = List.of(args).contains("--config");
        if (explicit && !Files.exists(configPath)) {
            throw ConfigLoadException.forFile("Configuration file not found: " + configPath, configPath, null);
        }
        return ConfigLoader.load(configPath, envLookup);
    }

    private int generate(ToolConfig config) throws IOException {
        out.println("Loading formula catalog: " + config.catalogDir());
        FormulaRegistry registry =
                new FormulaCatalogParser().loadDirectory(config.catalogDir(), config.catalogPattern());
        out.println("Found " + registry.size() + " valid formula(s)");

        List<List<String>> cycles = new ExpansionEngine(registry).cycles();
        if (!cycles.isEmpty()) {
            throw new CircularDependencyException(null, cycles);
        }

        Path templatePath = config.readmeTemplate();
        if (!Files.isRegularFile(templatePath)) {
            throw new DocumentGenerationException("README template not found: " + templatePath);
        }
        String readme = new ReadmeGenerator().generate(Files.readString(templatePath), registry);
        Files.writeString(config.readmeOutput(), readme);

        LOG.info("README generated: formulas={}, output={}", registry.size(), config.readmeOutput());
        out.println("README generated: " + config.readmeOutput());
        return EXIT_OK;
    }

    private int lint(ToolConfig config) {
        FormulaLinter linter = new FormulaLinter();
        out.println("Running " + linter.rules().size() + " lint rule(s):");
        for (LintRule rule : linter.rules()) {
            out.println("  - " + rule.name() + ": " + rule.description());
        }
        out.println();

        LintSummary summary = linter.lintDirectory(config.catalogDir(), config.catalogPattern());

        if (summary.warningCount() > 0) {
            out.println("Found " + summary.warningCount() + " warning(s):");
            for (LintFinding warning : summary.warnings()) {
                LOG.warn("Lint warning: rule={}, file={}", warning.rule(), warning.file());
                out.println("  " + warning);
            }
            out.println();
        }

        if (summary.passed()) {
            out.println("All " + summary.filesChecked() + " file(s) passed lint checks"
                    + (summary.warningCount() > 0 ? " (with warnings above)" : ""));
            return EXIT_OK;
        }
        out.println("Found " + summary.errorCount() + " error(s) in " + summary.filesChecked() + " file(s):");
        for (LintFinding error : summary.errors()) {
            out.println("  " + error);
        }
        out.println();
        out.println("Please fix the errors above and run the linter again.");
        return EXIT_FAILURE;
    }

    private int usageError(String message) {
        err.println(message);
        err.println(USAGE);
        return EXIT_USAGE;
    }
}
