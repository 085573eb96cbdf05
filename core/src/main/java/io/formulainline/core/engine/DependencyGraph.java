package io.formulainline.core.engine;

import io.formulainline.core.error.CircularDependencyException;
import io.formulainline.core.error.FormulaParseException;
import io.formulainline.core.grammar.FormulaParser;
import io.formulainline.core.model.FormulaDefinition;
import io.formulainline.core.model.FunctionCall;
import io.formulainline.core.model.Node;
import io.formulainline.core.spi.CallExtractor;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Directed call graph between catalog formulas: an edge {@code A -> B} means the body of {@code A}
 * calls {@code B} somewhere, at any nesting depth. Built from a registry, never persisted.
 *
 * <p>
 * A formula whose body does not parse stays in the graph as a node without edges; its parse
 * error is kept in {@link #parseFailures()} so callers decide which formulas it affects.
 */
public final class DependencyGraph {

    private final Map<String, Set<String>> edges;
    private final Map<String, FormulaParseException> parseFailures;

    private DependencyGraph(Map<String, Set<String>> edges, Map<String, FormulaParseException> parseFailures) {
        this.edges = edges;
        this.parseFailures = parseFailures;
    }

    /**
     * Builds the graph for every formula in {@code registry}. Bodies that do not parse are recorded
     * instead of thrown.
     *
     * @param registry  the formulas to connect
     * @param parser    parser for the bodies
     * @param extractor finds the catalog calls in each parsed body
     * @return the call graph, with any parse failures attached
     */
    public static DependencyGraph build(FormulaRegistry registry, FormulaParser parser, CallExtractor extractor) {
        Map<String, Set<String>> edges = new LinkedHashMap<>();
        Map<String, FormulaParseException> failures = new LinkedHashMap<>();
        for (FormulaDefinition definition : registry.definitions()) {
            Node root;
            try {
                root = parser.parse(definition.body());
            } catch (FormulaParseException e) {
                failures.put(definition.name(), e.withFormulaName(definition.name()));
                edges.put(definition.name(), Set.of());
                continue;
            }
            Set<String> callees = new LinkedHashSet<>();
            for (FunctionCall call : extractor.extract(root, registry.names())) {
                callees.add(call.name());
            }
            edges.put(definition.name(), callees);
        }
        DependencyGraph graph = of(edges);
        return new DependencyGraph(graph.edges, Collections.unmodifiableMap(failures));
    }

    /**
     * Graph with the given adjacency; targets without an entry of their own become leaf nodes.
     *
     * @param adjacency callees per formula name
     * @return a graph without parse failures
     */
    public static DependencyGraph of(Map<String, ? extends Collection<String>> adjacency) {
        Map<String, Set<String>> edges = new LinkedHashMap<>();
        adjacency.forEach((name, callees) -> edges.put(name, Collections.unmodifiableSet(new LinkedHashSet<>(callees))));
        for (Collection<String> callees : adjacency.values()) {
            for (String callee : callees) {
                edges.putIfAbsent(callee, Set.of());
            }
        }
        return new DependencyGraph(Collections.unmodifiableMap(edges), Map.of());
    }

    /**
     * All nodes in insertion order.
     *
     * @return the formula names, unparsable ones included
     */
    public Set<String> names() {
        return edges.keySet();
    }

    /**
     * Formulas called directly by {@code name}.
     *
     * @param name a formula name
     * @return the direct callees; empty for leaves, unparsable bodies and unknown names
     */
    public Set<String> dependenciesOf(String name) {
        return edges.getOrDefault(name, Set.of());
    }

    /**
     * Parse errors of the bodies that could not be read, keyed by formula name in registry order.
     * Each error already carries its formula name.
     *
     * @return the failures; empty when every body parsed
     */
    public Map<String, FormulaParseException> parseFailures() {
        return parseFailures;
    }

    /**
     * Counts the distinct caller-callee pairs.
     *
     * @return the number of edges
     */
    public int edgeCount() {
        return edges.values().stream().mapToInt(Set::size).sum();
    }

    /**
     * Every formula reachable from {@code name} through one or more edges. The start node is only
     * included when it lies on a cycle.
     *
     * @param name the start formula
     * @return the reachable formulas in discovery order
     */
    public Set<String> reachableFrom(String name) {
        Set<String> reached = new LinkedHashSet<>();
        Deque<String> pending = new ArrayDeque<>(dependenciesOf(name));
        while (!pending.isEmpty()) {
            String next = pending.pop();
            if (reached.add(next)) {
                pending.addAll(dependenciesOf(next));
            }
        }
        return reached;
    }

    /**
     * Nodes ordered so that every formula comes after all formulas it calls.
     *
     * @return callees first, callers last
     * @throws CircularDependencyException if the graph has a cycle
     */
    public List<String> topologicalOrder() {
        List<List<String>> cycles = new CycleDetector().detectCycles(this);
        if (!cycles.isEmpty()) {
            throw new CircularDependencyException(null, cycles);
        }
        List<String> order = new ArrayList<>();
        Set<String> done = new LinkedHashSet<>();
        for (String name : edges.keySet()) {
            visitPostOrder(name, done, order);
        }
        return order;
    }

    private void visitPostOrder(String name, Set<String> done, List<String> order) {
        if (!done.add(name)) {
            return;
        }
        for (String callee : dependenciesOf(name)) {
            visitPostOrder(callee, done, order);
        }
        order.add(name);
    }
}
