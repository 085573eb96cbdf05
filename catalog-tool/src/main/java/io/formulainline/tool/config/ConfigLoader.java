package io.formulainline.tool.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Loads {@link ToolConfig} from a YAML file with an environment variable overlay.
 *
 * <pre>
 * catalog:
 *   dir: formulas
 *   pattern: "*.yaml"
 * readme:
 *   template: .readme-template.md
 *   output: README.md
 * logging:
 *   level: INFO
 *   format: text
 * </pre>
 *
 * <p>
 * A missing file means all defaults. Every key can be overridden by a {@code FORMULA_INLINE_*}
 * environment variable, which wins over the YAML value. A variable counts as set only if its
 * trimmed value is non-empty.
 */
public final class ConfigLoader {

    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    /** Configuration file looked up in the working directory when {@code --config} is absent. */
    public static final String DEFAULT_CONFIG_FILE = "formula-inline.yaml";

    static final String ENV_PREFIX = "FORMULA_INLINE_";

    private ConfigLoader() {
        // utility class
    }

    /**
     * Loads {@code configPath} with overrides from {@link System#getenv}.
     *
     * @param configPath the YAML file; a missing file means defaults
     * @return the resolved configuration
     */
    public static ToolConfig load(Path configPath) {
        return load(configPath, System::getenv);
    }

    /**
     * Loads {@code configPath} with overrides from {@code envLookup}, which returns {@code null} for
     * an undefined variable.
     *
     * @param configPath the YAML file; a missing file means defaults
     * @param envLookup  environment variable lookup
     * @return the resolved configuration
     * @throws ConfigLoadException if the file is not valid YAML or a value is invalid
     */
    public static ToolConfig load(Path configPath, Function<String, String> envLookup) {
        JsonNode root = Files.exists(configPath) ? readTree(configPath) : YAML_MAPPER.missingNode();
        ToolConfig.Builder builder = ToolConfig.builder();

        JsonNode catalog = root.path("catalog");
        yamlString(catalog, "dir", builder::catalogDir);
        yamlString(catalog, "pattern", builder::catalogPattern);

        JsonNode readme = root.path("readme");
        yamlString(readme, "template", builder::readmeTemplate);
        yamlString(readme, "output", builder::readmeOutput);

        JsonNode logging = root.path("logging");
        yamlString(logging, "level", builder::loggingLevel);
        yamlString(logging, "format", builder::loggingFormat);

        envString(envLookup, "CATALOG_DIR", builder::catalogDir);
        envString(envLookup, "CATALOG_PATTERN", builder::catalogPattern);
        envString(envLookup, "README_TEMPLATE", builder::readmeTemplate);
        envString(envLookup, "README_OUTPUT", builder::readmeOutput);
        envString(envLookup, "LOGGING_LEVEL", builder::loggingLevel);
        envString(envLookup, "LOGGING_FORMAT", builder::loggingFormat);

        return builder.build();
    }

    /**
     * Resolves the configuration file from command-line arguments.
     *
     * @param args command-line arguments
     * @return the path after {@code --config}, or {@link #DEFAULT_CONFIG_FILE}
     * @throws IllegalArgumentException if {@code --config} is the last argument
     */
    public static Path resolveConfigPath(String[] args) {
        for (int i = 0; i < args.length; i++) {
            if ("--config".equals(args[i])) {
                if (i + 1 >= args.length) {
                    throw new IllegalArgumentException("--config requires a file path argument");
                }
                return Path.of(args[i + 1]);
            }
        }
        return Path.of(DEFAULT_CONFIG_FILE);
    }

    private static JsonNode readTree(Path configPath) {
        try (InputStream in = Files.newInputStream(configPath)) {
            JsonNode root = YAML_MAPPER.readTree(in);
            if (root == null || root.isMissingNode() || root.isNull()) {
                return YAML_MAPPER.missingNode();
            }
            if (!root.isObject()) {
                throw ConfigLoadException.forFile(
                        "Configuration must be a YAML mapping: " + configPath, configPath, null);
            }
            return root;
        } catch (IOException e) {
            throw ConfigLoadException.forFile("Failed to parse YAML configuration: " + configPath, configPath, e);
        }
    }

    private static void yamlString(JsonNode section, String field, Consumer<String> setter) {
        JsonNode value = section.get(field);
        if (value != null && !value.isNull()) {
            setter.accept(value.asText());
        }
    }

    /** Applies {@code FORMULA_INLINE_<name>} if it is set. */
    private static void envString(Function<String, String> envLookup, String name, Consumer<String> setter) {
        String value = envLookup.apply(ENV_PREFIX + name);
        if (value != null && !value.trim().isEmpty()) {
            setter.accept(value.trim());
        }
    }
}
