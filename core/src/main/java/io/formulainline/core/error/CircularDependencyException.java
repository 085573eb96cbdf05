package io.formulainline.core.error;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Thrown when the dependency graph contains a cycle that the requested expansion depends on. Each
 * cycle is the ordered list of names from the start of the cycle back to itself.
 */
public final class CircularDependencyException extends FormulaExpansionException {

    private static final long serialVersionUID = 1L;

    private final List<List<String>> cycles;

    public CircularDependencyException(String formulaName, List<List<String>> cycles) {
        super(buildMessage(cycles), formulaName);
        this.cycles = cycles.stream().map(List::copyOf).collect(Collectors.toUnmodifiableList());
    }

    /** The offending cycles, each rendered from its start node back to itself. */
    public List<List<String>> cycles() {
        return cycles;
    }

    /** Renders a cycle path as {@code A -> B -> A}. */
    public static String render(List<String> cycle) {
        return String.join(" -> ", cycle);
    }

    private static String buildMessage(List<List<String>> cycles) {
        return "Circular dependencies detected:"
                + cycles.stream().map(c -> "\n  - " + render(c)).collect(Collectors.joining());
    }
}
