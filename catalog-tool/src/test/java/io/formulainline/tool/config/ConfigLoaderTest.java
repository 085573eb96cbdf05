package io.formulainline.tool.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

@DisplayName("ConfigLoader")
class ConfigLoaderTest {

    private static final Path FULL = Path.of("src/test/resources/config/full-config.yaml");
    private static final Path PARTIAL = Path.of("src/test/resources/config/partial-config.yaml");

    private final Map<String, String> envVars = new HashMap<>();

    @TempDir
    Path tempDir;

    @BeforeEach
    void setUp() {
        envVars.clear();
    }

    @Nested
    @DisplayName("YAML mapping")
    class YamlMapping {

        @Test
        void missingFileMeansDefaults() {
            ToolConfig config = ConfigLoader.load(tempDir.resolve("absent.yaml"), envVars::get);

            assertThat(config).isEqualTo(ToolConfig.defaults());
            assertThat(config.catalogDir()).isEqualTo(Path.of("formulas"));
            assertThat(config.catalogPattern()).isEqualTo("*.yaml");
            assertThat(config.readmeTemplate()).isEqualTo(Path.of(".readme-template.md"));
            assertThat(config.readmeOutput()).isEqualTo(Path.of("README.md"));
            assertThat(config.loggingLevel()).isEqualTo("INFO");
            assertThat(config.loggingFormat()).isEqualTo("text");
        }

        @Test
        void everyKeyIsMapped() {
            ToolConfig config = ConfigLoader.load(FULL, envVars::get);

            assertThat(config.catalogDir()).isEqualTo(Path.of("catalog/formulas"));
            assertThat(config.catalogPattern()).isEqualTo("*.yml");
            assertThat(config.readmeTemplate()).isEqualTo(Path.of("docs/template.md"));
            assertThat(config.readmeOutput()).isEqualTo(Path.of("docs/README.md"));
            assertThat(config.loggingLevel()).isEqualTo("DEBUG");
            assertThat(config.loggingFormat()).isEqualTo("json");
        }

        @Test
        void absentKeysKeepDefaults() {
            ToolConfig config = ConfigLoader.load(PARTIAL, envVars::get);

            assertThat(config.catalogDir()).isEqualTo(Path.of("my-formulas"));
            assertThat(config.catalogPattern()).isEqualTo("*.yaml");
            assertThat(config.readmeOutput()).isEqualTo(Path.of("README.md"));
        }

        @Test
        void emptyFileMeansDefaults() throws IOException {
            Path file = Files.writeString(tempDir.resolve("empty.yaml"), "");

            assertThat(ConfigLoader.load(file, envVars::get)).isEqualTo(ToolConfig.defaults());
        }

        @Test
        void invalidYamlIsRejected() throws IOException {
            Path file = Files.writeString(tempDir.resolve("bad.yaml"), "catalog: [unclosed\n");

            assertThatThrownBy(() -> ConfigLoader.load(file, envVars::get))
                    .isInstanceOfSatisfying(ConfigLoadException.class, e -> {
                        assertThat(e.configPath()).isEqualTo(file);
                        assertThat(e.key()).isNull();
                        assertThat(e.getCause()).isNotNull();
                    })
                    .hasMessageStartingWith("Failed to parse YAML configuration");
        }

        @Test
        void scalarDocumentIsRejected() throws IOException {
            Path file = Files.writeString(tempDir.resolve("scalar.yaml"), "hello\n");

            assertThatThrownBy(() -> ConfigLoader.load(file, envVars::get))
                    .isInstanceOf(ConfigLoadException.class)
                    .hasMessageStartingWith("Configuration must be a YAML mapping");
        }

        @Test
        void unknownLoggingFormatIsRejected() throws IOException {
            Path file = Files.writeString(tempDir.resolve("fmt.yaml"), "logging:\n  format: xml\n");

            assertThatThrownBy(() -> ConfigLoader.load(file, envVars::get))
                    .isInstanceOfSatisfying(ConfigLoadException.class, e -> {
                        assertThat(e.key()).isEqualTo("logging.format");
                        assertThat(e.configPath()).isNull();
                    })
                    .hasMessageContaining("Invalid logging.format 'xml'");
        }

        @Test
        void blankValueNamesItsKey() {
            assertThatThrownBy(() -> ToolConfig.builder().catalogDir(" ").build())
                    .isInstanceOfSatisfying(
                            ConfigLoadException.class, e -> assertThat(e.key()).isEqualTo("catalog.dir"))
                    .hasMessage("Configuration key 'catalog.dir' must not be blank");
        }
    }

    @Nested
    @DisplayName("Environment variable overlay")
    class EnvOverlay {

        @Test
        void envWinsOverYaml() {
            envVars.put("FORMULA_INLINE_CATALOG_DIR", "/opt/formulas");
            envVars.put("FORMULA_INLINE_CATALOG_PATTERN", "*.yaml");
            envVars.put("FORMULA_INLINE_README_TEMPLATE", "t.md");
            envVars.put("FORMULA_INLINE_README_OUTPUT", "out.md");
            envVars.put("FORMULA_INLINE_LOGGING_LEVEL", "warn");
            envVars.put("FORMULA_INLINE_LOGGING_FORMAT", "TEXT");

            ToolConfig config = ConfigLoader.load(FULL, envVars::get);

            assertThat(config.catalogDir()).isEqualTo(Path.of("/opt/formulas"));
            assertThat(config.catalogPattern()).isEqualTo("*.yaml");
            assertThat(config.readmeTemplate()).isEqualTo(Path.of("t.md"));
            assertThat(config.readmeOutput()).isEqualTo(Path.of("out.md"));
            assertThat(config.loggingLevel()).isEqualTo("WARN");
            assertThat(config.loggingFormat()).isEqualTo("text");
        }

        @Test
        void blankValuesCountAsUnset() {
            envVars.put("FORMULA_INLINE_CATALOG_DIR", "   ");
            envVars.put("FORMULA_INLINE_LOGGING_LEVEL", "");

            ToolConfig config = ConfigLoader.load(FULL, envVars::get);

            assertThat(config.catalogDir()).isEqualTo(Path.of("catalog/formulas"));
            assertThat(config.loggingLevel()).isEqualTo("DEBUG");
        }

        @Test
        void valuesAreTrimmed() {
            envVars.put("FORMULA_INLINE_README_OUTPUT", "  docs/OUT.md \n");

            assertThat(ConfigLoader.load(tempDir.resolve("absent.yaml"), envVars::get).readmeOutput())
                    .isEqualTo(Path.of("docs/OUT.md"));
        }
    }

    @Nested
    @DisplayName("Command-line path")
    class ConfigPath {

        @Test
        void defaultsToWorkingDirectoryFile() {
            assertThat(ConfigLoader.resolveConfigPath(new String[] {"lint"}))
                    .isEqualTo(Path.of(ConfigLoader.DEFAULT_CONFIG_FILE));
        }

        @Test
        void configFlagOverrides() {
            assertThat(ConfigLoader.resolveConfigPath(new String[] {"--config", "x.yaml", "lint"}))
                    .isEqualTo(Path.of("x.yaml"));
        }

        @Test
        void configFlagNeedsAValue() {
            assertThatThrownBy(() -> ConfigLoader.resolveConfigPath(new String[] {"lint", "--config"}))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessage("--config requires a file path argument");
        }
    }
}
