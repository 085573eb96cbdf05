package io.formulainline.core.engine;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Set;

/**
 * Depth-first cycle search with an explicit stack. Each back edge to a node still on the stack is
 * reported as the path from that node back to itself, e.g. {@code [A, B, C, A]}.
 *
 * <p>
 * Nodes are visited in graph order and each node is expanded once, so every cycle is reported
 * from the first of its nodes the search reaches.
 */
public final class CycleDetector {

    /**
     * Returns every cycle found, or an empty list for an acyclic graph.
     *
     * @param graph the call graph to search
     * @return closed paths such as {@code [A, B, A]}, in discovery order
     */
    public List<List<String>> detectCycles(DependencyGraph graph) {
        List<List<String>> cycles = new ArrayList<>();
        Set<String> visited = new HashSet<>();
        for (String root : graph.names()) {
            if (visited.add(root)) {
                search(graph, root, visited, cycles);
            }
        }
        return cycles;
    }

    private static void search(DependencyGraph graph, String root, Set<String> visited, List<List<String>> cycles) {
        Deque<Iterator<String>> stack = new ArrayDeque<>();
        List<String> path = new ArrayList<>();
        Set<String> onPath = new HashSet<>();
        path.add(root);
        onPath.add(root);
        stack.push(graph.dependenciesOf(root).iterator());
        while (!stack.isEmpty()) {
            Iterator<String> callees = stack.peek();
            if (!callees.hasNext()) {
                stack.pop();
                onPath.remove(path.remove(path.size() - 1));
                continue;
            }
            String callee = callees.next();
            if (onPath.contains(callee)) {
                List<String> cycle = new ArrayList<>(path.subList(path.indexOf(callee), path.size()));
                cycle.add(callee);
                cycles.add(List.copyOf(cycle));
            } else if (visited.add(callee)) {
                path.add(callee);
                onPath.add(callee);
                stack.push(graph.dependenciesOf(callee).iterator());
            }
        }
    }
}
