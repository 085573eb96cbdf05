package io.formulainline.core.lint;

import com.fasterxml.jackson.databind.JsonNode;
import io.formulainline.core.spi.LintRule;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/** Every parameter documents a concrete example argument. */
public final class RequireParameterExamplesRule implements LintRule {

    @Override
    public String name() {
        return "require-parameter-examples";
    }

    @Override
    public String description() {
        return "All parameters must have non-empty example values";
    }

    @Override
    public LintReport check(Path file, JsonNode document) {
        JsonNode parameters = document.get("parameters");
        if (parameters == null || !parameters.isArray()) {
            return LintReport.empty();
        }
        List<LintFinding> findings = new ArrayList<>();
        int index = 0;
        for (JsonNode parameter : parameters) {
            if (parameter.isObject()) {
                String parameterName = parameter.path("name").asText("parameter-" + index);
                JsonNode example = parameter.get("example");
                if (example == null || example.isNull()) {
                    findings.add(LintFinding.error(
                            name(),
                            file,
                            "Parameter '" + parameterName + "' is missing 'example' field."
                                    + " Provide a concrete example value (e.g. '\"A1:B10\"', '0', 'BLANK()')"));
                } else if (example.isTextual() && example.asText().isEmpty()) {
                    findings.add(LintFinding.error(
                            name(),
                            file,
                            "Parameter '" + parameterName + "' has empty example."
                                    + " Provide a concrete example value (e.g. '\"A1:B10\"', '0', '\"\"', 'BLANK()')"));
                }
            }
            index++;
        }
        return new LintReport(findings);
    }
}
