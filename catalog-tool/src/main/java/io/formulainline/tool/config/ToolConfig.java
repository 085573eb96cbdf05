package io.formulainline.tool.config;

import java.nio.file.Path;
import java.util.Locale;
import java.util.Set;

/**
 * Settings of the catalog tool. Every field has a default; use {@link #builder()} to override.
 *
 * @param catalogDir     directory holding the formula definition files
 * @param catalogPattern glob selecting definition files inside {@code catalogDir}
 * @param readmeTemplate Markdown template with the generated-content markers
 * @param readmeOutput   file the generated README is written to
 * @param loggingLevel   root log level
 * @param loggingFormat  {@code text} or {@code json}
 */
public record ToolConfig(
        Path catalogDir,
        String catalogPattern,
        Path readmeTemplate,
        Path readmeOutput,
        String loggingLevel,
        String loggingFormat) {

    static final Set<String> LOGGING_FORMATS = Set.of("text", "json");

    /**
     * All defaults.
     *
     * @return the configuration used when no file or variable sets anything
     */
    public static ToolConfig defaults() {
        return builder().build();
    }

    /**
     * Returns a new {@link Builder}.
     *
     * @return a fresh builder preloaded with the defaults
     */
    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String catalogDir = "formulas";
        private String catalogPattern = "*.yaml";
        private String readmeTemplate = ".readme-template.md";
        private String readmeOutput = "README.md";
        private String loggingLevel = "INFO";
        private String loggingFormat = "text";

        Builder() {}

        public Builder catalogDir(String catalogDir) {
            this.catalogDir = catalogDir;
            return this;
        }

        public Builder catalogPattern(String catalogPattern) {
            this.catalogPattern = catalogPattern;
            return this;
        }

        public Builder readmeTemplate(String readmeTemplate) {
            this.readmeTemplate = readmeTemplate;
            return this;
        }

        public Builder readmeOutput(String readmeOutput) {
            this.readmeOutput = readmeOutput;
            return this;
        }

        public Builder loggingLevel(String loggingLevel) {
            this.loggingLevel = loggingLevel;
            return this;
        }

        public Builder loggingFormat(String loggingFormat) {
            this.loggingFormat = loggingFormat;
            return this;
        }

        /**
         * Validates the values and builds the configuration.
         *
         * @return the validated configuration
         * @throws ConfigLoadException if a value is blank or the logging format is unknown
         */
        public ToolConfig build() {
            requireNonBlank("catalog.dir", catalogDir);
            requireNonBlank("catalog.pattern", catalogPattern);
            requireNonBlank("readme.template", readmeTemplate);
            requireNonBlank("readme.output", readmeOutput);
            requireNonBlank("logging.level", loggingLevel);
            String format = loggingFormat == null ? null : loggingFormat.toLowerCase(Locale.ROOT);
            if (!LOGGING_FORMATS.contains(format)) {
                throw ConfigLoadException.forKey(
                        "logging.format",
                        "Invalid logging.format '" + loggingFormat + "': expected one of [json, text]");
            }
            return new ToolConfig(
                    Path.of(catalogDir),
                    catalogPattern,
                    Path.of(readmeTemplate),
                    Path.of(readmeOutput),
                    loggingLevel.toUpperCase(Locale.ROOT),
                    format);
        }

        private static void requireNonBlank(String key, String value) {
            if (value == null || value.isBlank()) {
                throw ConfigLoadException.forKey(key, "Configuration key '" + key + "' must not be blank");
            }
        }
    }
}
