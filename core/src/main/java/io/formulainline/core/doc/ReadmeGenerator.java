package io.formulainline.core.doc;

import io.formulainline.core.engine.ExpansionEngine;
import io.formulainline.core.engine.FormulaRegistry;
import io.formulainline.core.error.DocumentGenerationException;
import io.formulainline.core.error.FormulaException;
import io.formulainline.core.model.FormulaDefinition;
import io.formulainline.core.model.Parameter;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Fills the generated region of a Markdown template with the catalog: a quick-reference list
 * followed by one collapsible section per formula holding its fully expanded text.
 *
 * <p>
 * Generation is all or nothing. Every formula is expanded first; if any fails, all failures are
 * raised together in a {@link DocumentGenerationException} and no text is returned.
 */
public final class ReadmeGenerator {

    private static final Logger LOG = LoggerFactory.getLogger(ReadmeGenerator.class);

    public static final String START_MARKER = "<!-- AUTO-GENERATED CONTENT START -->";
    public static final String END_MARKER = "<!-- AUTO-GENERATED CONTENT END -->";

    static final String GENERATED_NOTICE = "<!-- This section is automatically generated by formula-inline -->";

    private static final Comparator<FormulaDefinition> BY_NAME_IGNORING_CASE =
            Comparator.comparing((FormulaDefinition definition) -> definition.name().toLowerCase(Locale.ROOT))
                    .thenComparing(FormulaDefinition::name);

    /**
     * Renders {@code template} with the generated region replaced.
     *
     * @param template README template holding both markers
     * @param registry the formulas to document
     * @return the complete README text
     * @throws DocumentGenerationException if the template lacks either marker or any formula fails
     *                                     to expand
     */
    public String generate(String template, FormulaRegistry registry) {
        int start = template.indexOf(START_MARKER);
        int end = template.indexOf(END_MARKER);
        if (start < 0 || end < 0 || end < start) {
            throw new DocumentGenerationException("Template missing AUTO-GENERATED CONTENT markers");
        }
        String content = formulaList(registry);
        return template.substring(0, start) + START_MARKER + "\n" + GENERATED_NOTICE + "\n\n" + content + "\n"
                + END_MARKER + template.substring(end + END_MARKER.length());
    }

    /** The Markdown placed between the markers. */
    String formulaList(FormulaRegistry registry) {
        if (registry.size() == 0) {
            return "_No formulas available yet._\n";
        }
        List<FormulaDefinition> sorted = new ArrayList<>(registry.definitions());
        sorted.sort(BY_NAME_IGNORING_CASE);
        Map<String, String> expanded = expandAll(registry, sorted);

        List<String> lines = new ArrayList<>();
        lines.add("### Quick Reference\n");
        for (FormulaDefinition definition : sorted) {
            lines.add("- **[" + definition.name() + "](#" + anchor(definition.name()) + ")** - "
                    + collapseWhitespace(definition.description()));
        }
        lines.add("");
        lines.add("### Detailed Formulas\n");
        for (FormulaDefinition definition : sorted) {
            appendDetails(lines, definition, expanded.get(definition.name()));
        }
        return String.join("\n", lines);
    }

    private static Map<String, String> expandAll(FormulaRegistry registry, List<FormulaDefinition> sorted) {
        ExpansionEngine engine = new ExpansionEngine(registry);
        Map<String, String> expanded = new LinkedHashMap<>();
        List<FormulaException> failures = new ArrayList<>();
        for (FormulaDefinition definition : sorted) {
            try {
                expanded.put(definition.name(), engine.expand(definition.name()));
            } catch (FormulaException e) {
                LOG.error("Formula expansion failed: name={}, phase={}, error={}",
                        definition.name(), e.phase(), e.getMessage());
                failures.add(e);
            }
        }
        if (!failures.isEmpty()) {
            throw new DocumentGenerationException(failures);
        }
        LOG.info("Formulas expanded for document: formulas={}", expanded.size());
        return expanded;
    }

    private static void appendDetails(List<String> lines, FormulaDefinition definition, String formulaText) {
        String name = definition.name();
        lines.add("<details>");
        lines.add("<summary><strong>" + name + "</strong></summary>\n");
        lines.add("### " + name + "\n");

        lines.add("**Description**\n");
        appendBlock(lines, "v" + definition.version() + " " + collapseWhitespace(definition.description()));

        List<Parameter> parameters = definition.parameters();
        if (!parameters.isEmpty()) {
            lines.add("**Parameters**\n");
            lines.add("```");
            for (int i = 0; i < parameters.size(); i++) {
                lines.add((i + 1) + ". " + parameters.get(i).name());
            }
            lines.add("```\n");
        }

        lines.add("**Formula**\n");
        appendBlock(lines, formulaText);

        for (Parameter parameter : parameters) {
            lines.add("#### " + parameter.name() + "\n");
            lines.add("**Description:**\n");
            appendBlock(lines, collapseWhitespace(parameter.description()));
            if (parameter.example() != null && !parameter.example().isEmpty()) {
                lines.add("**Example:**\n");
                appendBlock(lines, parameter.example());
            }
        }

        if (definition.notes() != null && !definition.notes().isBlank()) {
            lines.add("**Notes**\n");
            appendBlock(lines, collapseWhitespace(definition.notes()));
        }
        lines.add("</details>\n");
    }

    private static void appendBlock(List<String> lines, String text) {
        lines.add("```");
        lines.add(text);
        lines.add("```\n");
    }

    static String anchor(String name) {
        return name.toLowerCase(Locale.ROOT).replace(' ', '-');
    }

    static String collapseWhitespace(String text) {
        return text == null ? "" : String.join(" ", text.strip().split("\\s+"));
    }
}
