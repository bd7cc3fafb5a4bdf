package com.leanblueprint.maven.graph;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Depth-first post-order sort over resolved dependencies.
 * <p>
 * Roots are visited in input order and dependencies in insertion order, so ties
 * keep first-occurrence order. Dependencies outside the input are treated as
 * satisfied. A node is descended at most once, which makes cycles terminate: every
 * node is emitted exactly once, although edges inside a cycle cannot all be honored.
 */
public final class TopologicalSorter {

    public static <T extends Node> List<T> sort(List<T> nodes) {
        Map<String, T> byName = new LinkedHashMap<>();
        for (T node : nodes) {
            byName.putIfAbsent(node.getName(), node);
        }

        Set<String> visited = new HashSet<>();
        List<T> result = new ArrayList<>(byName.size());
        for (T node : byName.values()) {
            visit(node, byName, visited, result);
        }
        return result;
    }

    // Iterative so that long dependency chains cannot overflow the stack
    private static <T extends Node> void visit(T root, Map<String, T> byName, Set<String> visited, List<T> result) {
        if (!visited.add(root.getName())) {
            return;
        }
        List<Frame<T>> stack = new ArrayList<>();
        stack.add(new Frame<>(root));
        while (!stack.isEmpty()) {
            Frame<T> top = stack.get(stack.size() - 1);
            if (top.pending.isEmpty()) {
                stack.remove(stack.size() - 1);
                result.add(top.node);
                continue;
            }
            String used = top.pending.remove(0);
            T dependency = byName.get(used);
            if (dependency != null && visited.add(used)) {
                stack.add(new Frame<>(dependency));
            }
        }
    }

    private static final class Frame<T extends Node> {
        final T node;
        final List<String> pending;

        Frame(T node) {
            this.node = node;
            this.pending = new ArrayList<>(node.getUses());
        }
    }

    private TopologicalSorter() {
    }
}
