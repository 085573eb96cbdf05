package io.formulainline.core.spi;

import com.fasterxml.jackson.databind.JsonNode;
import io.formulainline.core.lint.LintReport;
import java.nio.file.Path;

/**
 * A single style or validity check applied to one formula definition document.
 *
 * <p>
 * Implementations MUST be stateless and thread-safe.
 */
public interface LintRule {

    /** Rule identifier as shown in lint output, e.g. {@code no-leading-equals}. */
    String name();

    /** One-line description of what the rule enforces. */
    String description();

    /**
     * Checks one document.
     *
     * @param file     file the document was read from, used for messages only
     * @param document the parsed YAML document
     * @return findings for this file, never {@code null}
     */
    LintReport check(Path file, JsonNode document);
}
