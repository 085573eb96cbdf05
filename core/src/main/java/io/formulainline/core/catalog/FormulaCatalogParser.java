package io.formulainline.core.catalog;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.networknt.schema.JsonSchema;
import com.networknt.schema.JsonSchemaFactory;
import com.networknt.schema.SpecVersion;
import com.networknt.schema.ValidationMessage;
import io.formulainline.core.engine.FormulaRegistry;
import io.formulainline.core.error.CatalogParseException;
import io.formulainline.core.error.SchemaValidationException;
import io.formulainline.core.model.FormulaDefinition;
import io.formulainline.core.model.Parameter;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.StreamSupport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads formula definition files into {@link FormulaDefinition}s and whole directories into a
 * {@link FormulaRegistry}.
 *
 * <p>
 * A definition file is one YAML mapping:
 *
 * <pre>
 * name: DOUBLE
 * version: 1.0.0
 * description: Doubles a value
 * parameters:
 *   - name: x
 *     description: Value to double
 *     example: "A1"
 * formula: |
 *   x * 2 // comment
 * notes: optional
 * </pre>
 *
 * <p>
 * Unknown keys are rejected before the document is checked against the bundled JSON Schema. The
 * formula text is comment-stripped and trimmed, and a leading {@code =} is removed.
 *
 * <p>
 * Thread-safe.
 */
public final class FormulaCatalogParser {

    private static final Logger LOG = LoggerFactory.getLogger(FormulaCatalogParser.class);

    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());
    private static final String SCHEMA_RESOURCE = "/schema/formula.schema.json";

    /** Recognized top-level keys. */
    private static final Set<String> KNOWN_ROOT_KEYS =
            Set.of("name", "version", "description", "parameters", "formula", "notes");

    /** Recognized keys of one parameter entry. */
    private static final Set<String> KNOWN_PARAMETER_KEYS = Set.of("name", "description", "example");

    private final JsonSchema schema;

    public FormulaCatalogParser() {
        this.schema = loadSchema();
    }

    /**
     * Parses one definition file.
     *
     * @param path the YAML definition file
     * @return the validated definition
     * @throws CatalogParseException     if the file cannot be read, is not a YAML mapping, has
     *                                   unknown keys, or repeats a parameter name
     * @throws SchemaValidationException if the document violates the formula schema
     */
    public FormulaDefinition parse(Path path) {
        Objects.requireNonNull(path, "path must not be null");
        return toDefinition(readDocument(path), path);
    }

    /**
     * Reads the raw YAML document of a definition file without validating it.
     *
     * @param path the YAML definition file
     * @return the document root, always an object node
     * @throws CatalogParseException if the file is unreadable, empty, or not a YAML mapping
     */
    public JsonNode readDocument(Path path) {
        String source = path.toString();
        JsonNode root;
        try {
            root = YAML_MAPPER.readTree(path.toFile());
        } catch (IOException e) {
            throw new CatalogParseException("Failed to read or parse YAML: " + e.getMessage(), e, null, source);
        }
        if (root == null || root.isMissingNode() || root.isNull()) {
            throw new CatalogParseException("File is empty", null, source);
        }
        if (!root.isObject()) {
            throw new CatalogParseException("Formula definition must be a YAML mapping", null, source);
        }
        return root;
    }

    /**
     * Validates a document read by {@link #readDocument} and converts it.
     *
     * @param root document root
     * @param path file the document came from; its file name becomes the definition's source
     * @return the definition with its body normalized
     */
    public FormulaDefinition toDefinition(JsonNode root, Path path) {
        String source = path.toString();
        String name = root.path("name").isTextual() ? root.get("name").asText() : null;

        rejectUnknownKeys(root, KNOWN_ROOT_KEYS, "formula root", name, source);
        JsonNode parametersNode = root.get("parameters");
        if (parametersNode != null && parametersNode.isArray()) {
            for (JsonNode parameter : parametersNode) {
                rejectUnknownKeys(parameter, KNOWN_PARAMETER_KEYS, "parameter", name, source);
            }
        }
        validateAgainstSchema(root, name, source);

        List<Parameter> parameters = new ArrayList<>();
        for (JsonNode parameter : parametersNode) {
            parameters.add(new Parameter(
                    parameter.get("name").asText(),
                    parameter.get("description").asText().strip(),
                    optionalText(parameter, "example")));
        }

        String body = normalizeBody(root.get("formula").asText());
        if (body.isEmpty()) {
            throw new CatalogParseException("Formula text is empty after removing comments", name, source);
        }

        try {
            return new FormulaDefinition(
                    name,
                    root.get("version").asText(),
                    root.get("description").asText().strip(),
                    parameters,
                    body,
                    optionalText(root, "notes"),
                    path.getFileName().toString());
        } catch (IllegalArgumentException e) {
            throw new CatalogParseException(e.getMessage(), e, name, source);
        }
    }

    /**
     * Loads every file in {@code directory} matching {@code glob}, in file-name order.
     *
     * @param directory the catalog directory
     * @param glob      file-name pattern, such as {@code *.yaml}
     * @return a registry of every definition found
     * @throws CatalogParseException if the directory cannot be listed, any file fails to parse, or
     *                               two files define the same formula name
     */
    public FormulaRegistry loadDirectory(Path directory, String glob) {
        List<Path> files = listFiles(directory, glob);
        if (files.isEmpty()) {
            LOG.warn("No formula files found: dir={}, pattern={}", directory, glob);
        }
        FormulaRegistry.Builder builder = FormulaRegistry.builder();
        for (Path file : files) {
            FormulaDefinition definition = parse(file);
            builder.add(definition);
            LOG.debug("Formula loaded: name={}, parameters={}, source={}",
                    definition.name(), definition.parameters().size(), definition.source());
        }
        FormulaRegistry registry = builder.build();
        LOG.info("Catalog loaded: formulas={}, source={}", registry.size(), directory);
        return registry;
    }

    /**
     * Files in {@code directory} matching {@code glob}, sorted by file name.
     *
     * @param directory the catalog directory
     * @param glob      file-name pattern
     * @return matching regular files
     * @throws CatalogParseException if the directory cannot be listed
     */
    public static List<Path> listFiles(Path directory, String glob) {
        if (!Files.isDirectory(directory)) {
            throw new CatalogParseException("Catalog directory does not exist: " + directory, null, directory.toString());
        }
        List<Path> files = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(directory, glob)) {
            for (Path file : stream) {
                if (Files.isRegularFile(file)) {
                    files.add(file);
                }
            }
        } catch (IOException e) {
            throw new CatalogParseException(
                    "Failed to list catalog directory: " + e.getMessage(), e, null, directory.toString());
        }
        files.sort(Comparator.comparing(file -> file.getFileName().toString()));
        return files;
    }

    /**
     * Comment-stripped, trimmed formula text without a leading {@code =}.
     *
     * @param formula the body as written in the file
     * @return the text the grammar sees
     */
    public static String normalizeBody(String formula) {
        String body = CommentStripper.strip(formula).strip();
        if (body.startsWith("=")) {
            body = body.substring(1).strip();
        }
        return body;
    }

    private void validateAgainstSchema(JsonNode root, String name, String source) {
        Set<ValidationMessage> errors = schema.validate(root);
        if (!errors.isEmpty()) {
            List<String> violations =
                    errors.stream().map(ValidationMessage::getMessage).sorted().collect(Collectors.toList());
            throw new SchemaValidationException(
                    "Formula definition violates schema: " + String.join("; ", violations), violations, name, source);
        }
    }

    private static String optionalText(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        return value.asText();
    }

    private static void rejectUnknownKeys(
            JsonNode node, Set<String> knownKeys, String blockName, String formulaName, String source) {
        if (node == null || !node.isObject()) {
            return;
        }
        List<String> unknown = StreamSupport.stream(((Iterable<String>) node::fieldNames).spliterator(), false)
                .filter(key -> !knownKeys.contains(key))
                .collect(Collectors.toList());
        if (!unknown.isEmpty()) {
            throw new CatalogParseException(
                    "Unknown key" + (unknown.size() > 1 ? "s" : "") + " in '" + blockName + "': " + unknown
                            + "; recognized keys are: " + knownKeys.stream().sorted().collect(Collectors.toList()),
                    formulaName,
                    source);
        }
    }

    private static JsonSchema loadSchema() {
        try (InputStream in = FormulaCatalogParser.class.getResourceAsStream(SCHEMA_RESOURCE)) {
            if (in == null) {
                throw new IllegalStateException("Missing classpath resource " + SCHEMA_RESOURCE);
            }
            JsonNode schemaNode = new ObjectMapper().readTree(in);
            return JsonSchemaFactory.getInstance(SpecVersion.VersionFlag.V202012).getSchema(schemaNode);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to load " + SCHEMA_RESOURCE, e);
        }
    }
}
