package io.formulainline.core.engine;

import io.formulainline.core.error.CircularDependencyException;
import io.formulainline.core.error.ExpansionNoOpException;
import io.formulainline.core.error.FormulaParseException;
import io.formulainline.core.error.ParameterCountMismatchException;
import io.formulainline.core.error.UndefinedFunctionException;
import io.formulainline.core.grammar.FormulaParser;
import io.formulainline.core.model.BinaryOp;
import io.formulainline.core.model.FormulaDefinition;
import io.formulainline.core.model.FunctionCall;
import io.formulainline.core.model.Node;
import io.formulainline.core.spi.CallExtractor;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Inlines catalog formulas into each other.
 *
 * <p>
 * For a formula body, every call to a catalog formula is replaced, at its exact source span, by
 * the callee's expanded body with parameters bound to the call's arguments and the whole wrapped in
 * one pair of parentheses. Arguments are expanded before the callee; an argument that is a bare
 * binary expression is parenthesized before substitution. Text outside call sites is copied
 * unchanged, so a formula without catalog calls expands to its own body.
 *
 * <p>
 * Every result is checked before it is cached: it must reparse, and neither the extractor nor a
 * token scan may find a catalog call in it. A result that fails the check raises {@link
 * ExpansionNoOpException}.
 *
 * <p>
 * The dependency graph is built and checked for cycles once, on first use. Expansions are cached
 * per engine instance; create a new engine for a new registry. Thread-safe.
 */
public final class ExpansionEngine {

    private static final Logger LOG = LoggerFactory.getLogger(ExpansionEngine.class);

    private final FormulaRegistry registry;
    private final FormulaParser parser;
    private final CallExtractor extractor;
    private final ExpansionCache cache = new ExpansionCache();

    private DependencyGraph graph;
    private List<List<String>> cycles;

    /**
     * Creates an engine with the default parser and call extractor.
     *
     * @param registry the formulas to expand
     */
    public ExpansionEngine(FormulaRegistry registry) {
        this(registry, new FormulaParser(), new AstCallExtractor());
    }

    /**
     * Creates an engine with explicit collaborators.
     *
     * @param registry  the formulas to expand
     * @param parser    parser for formula bodies
     * @param extractor finds catalog calls in a parsed body
     */
    public ExpansionEngine(FormulaRegistry registry, FormulaParser parser, CallExtractor extractor) {
        this.registry = registry;
        this.parser = parser;
        this.extractor = extractor;
    }

    /**
     * Returns the fully expanded text of one formula.
     *
     * @param name the formula to expand
     * @return the body with every catalog call inlined
     * @throws UndefinedFunctionException      if {@code name} is not in the registry
     * @throws CircularDependencyException     if a cycle is reachable from {@code name}
     * @throws ParameterCountMismatchException if a call site passes the wrong number of arguments
     * @throws ExpansionNoOpException          if a catalog call survives expansion
     * @throws FormulaParseException           if the body of {@code name}, or of a formula it reaches,
     *                                         does not parse
     */
    public String expand(String name) {
        FormulaDefinition definition = registry.get(name);
        if (definition == null) {
            throw new UndefinedFunctionException(name);
        }
        requireAcyclicFrom(name);
        requireParsableFrom(name);
        return expandDefinition(definition);
    }

    /**
     * Expands every formula, in name order.
     *
     * @return expanded text per formula name
     * @throws CircularDependencyException if the catalog has any cycle, before anything is expanded
     * @throws FormulaParseException       if any body does not parse, before anything is expanded
     */
    public Map<String, String> expandAll() {
        List<List<String>> found = cycles();
        if (!found.isEmpty()) {
            throw new CircularDependencyException(null, found);
        }
        Map<String, FormulaParseException> broken = dependencyGraph().parseFailures();
        if (!broken.isEmpty()) {
            throw broken.values().iterator().next();
        }
        Map<String, String> expanded = new LinkedHashMap<>();
        for (String name : registry.names()) {
            expanded.put(name, expand(name));
        }
        LOG.info("Catalog expanded: formulas={}, cached={}", expanded.size(), cache.size());
        return Collections.unmodifiableMap(expanded);
    }

    /**
     * Returns the call graph of the registry, building it on first use.
     *
     * @return the dependency graph
     */
    public DependencyGraph dependencyGraph() {
        ensureGraph();
        return graph;
    }

    /**
     * Returns every cycle in the call graph.
     *
     * @return cycles as closed paths, empty when the catalog is acyclic
     */
    public List<List<String>> cycles() {
        ensureGraph();
        return cycles;
    }

    private synchronized void ensureGraph() {
        if (graph != null) {
            return;
        }
        DependencyGraph built = DependencyGraph.build(registry, parser, extractor);
        cycles = new CycleDetector().detectCycles(built);
        graph = built;
        built.parseFailures().forEach((name, failure) ->
                LOG.warn("Formula body does not parse: name={}, position={}", name, failure.position()));
        LOG.info(
                "Dependency graph built: formulas={}, edges={}, cycles={}",
                built.names().size(),
                built.edgeCount(),
                cycles.size());
    }

    private void requireAcyclicFrom(String name) {
        List<List<String>> found = cycles();
        if (found.isEmpty()) {
            return;
        }
        Set<String> reachable = new TreeSet<>(dependencyGraph().reachableFrom(name));
        reachable.add(name);
        List<List<String>> relevant = found.stream()
                .filter(cycle -> cycle.stream().anyMatch(reachable::contains))
                .collect(Collectors.toList());
        if (!relevant.isEmpty()) {
            throw new CircularDependencyException(name, relevant);
        }
    }

    private void requireParsableFrom(String name) {
        Map<String, FormulaParseException> failures = dependencyGraph().parseFailures();
        if (failures.isEmpty()) {
            return;
        }
        FormulaParseException own = failures.get(name);
        if (own != null) {
            throw own;
        }
        for (String reached : new TreeSet<>(dependencyGraph().reachableFrom(name))) {
            FormulaParseException failure = failures.get(reached);
            if (failure != null) {
                throw failure;
            }
        }
    }

    private String expandDefinition(FormulaDefinition definition) {
        String cached = cache.get(definition.name());
        if (cached != null) {
            return cached;
        }
        String expanded = expandBody(definition);
        return cache.putIfAbsent(definition.name(), expanded);
    }

    private String expandBody(FormulaDefinition definition) {
        String name = definition.name();
        String body = definition.body();
        Set<String> knownNames = registry.names();
        List<FunctionCall> calls = extractor.extract(parse(body, name), knownNames);

        // Splice outermost calls right to left so earlier spans stay valid; nested calls are
        // expanded while their enclosing call's arguments are rendered.
        List<FunctionCall> outermost = calls.stream()
                .filter(call -> calls.stream().noneMatch(other -> other.span().strictlyContains(call.span())))
                .sorted(Comparator.comparingInt((FunctionCall call) -> call.span().start()).reversed())
                .collect(Collectors.toList());
        StringBuilder text = new StringBuilder(body);
        for (FunctionCall call : outermost) {
            text.replace(call.span().start(), call.span().end(), callSiteText(call, name));
        }
        String result = text.toString();

        verify(definition, calls, result);
        LOG.debug("Formula expanded: name={}, calls={}, length={}", name, calls.size(), result.length());
        return result;
    }

    private String callSiteText(FunctionCall call, String callerName) {
        FormulaDefinition callee = registry.get(call.name());
        List<String> parameterNames = callee.parameterNames();
        if (call.args().size() != parameterNames.size()) {
            throw new ParameterCountMismatchException(
                    callerName,
                    call.name(),
                    parameterNames.size(),
                    call.args().size(),
                    call.span().start());
        }
        ExpandingRenderer renderer = new ExpandingRenderer(registry.names(), nested -> callSiteText(nested, callerName));
        Map<String, String> bindings = new HashMap<>();
        for (int i = 0; i < parameterNames.size(); i++) {
            Node arg = call.args().get(i);
            String argText = renderer.render(arg);
            bindings.put(parameterNames.get(i), arg instanceof BinaryOp ? "(" + argText + ")" : argText);
        }
        String calleeText = expandDefinition(callee);
        LOG.debug("Call site expanded: caller={}, callee={}, position={}", callerName, call.name(), call.span().start());
        return "(" + ParameterSubstitutor.substitute(calleeText, bindings) + ")";
    }

    private void verify(FormulaDefinition definition, List<FunctionCall> calls, String result) {
        Set<String> knownNames = registry.names();
        Set<String> remaining = new TreeSet<>();
        for (FunctionCall call : extractor.extract(parse(result, definition.name()), knownNames)) {
            remaining.add(call.name());
        }
        remaining.addAll(CallSiteScanner.calledNames(result, knownNames));
        if (remaining.isEmpty() && !calls.isEmpty() && result.equals(definition.body())) {
            calls.forEach(call -> remaining.add(call.name()));
        }
        if (!remaining.isEmpty()) {
            throw new ExpansionNoOpException(definition.name(), List.copyOf(remaining), definition.body());
        }
    }

    private Node parse(String text, String formulaName) {
        try {
            return parser.parse(text);
        } catch (FormulaParseException e) {
            throw e.withFormulaName(formulaName);
        }
    }
}
