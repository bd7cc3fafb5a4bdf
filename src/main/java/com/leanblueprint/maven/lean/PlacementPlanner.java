package com.leanblueprint.maven.lean;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.leanblueprint.maven.graph.DeclarationLocation;
import com.leanblueprint.maven.graph.NodeWithPosition;
import com.leanblueprint.maven.graph.TopologicalSorter;

/**
 * Decides where every node ends up in the Lean sources.
 * <p>
 * Placeable nodes are declared inside one of the target modules and get their
 * attribute in place. Every other node is rendered as a stub and prepended to the
 * first placeable node, in topological order, that directly uses it; stubs nobody
 * uses go to the overflow file. The scan is a plain linear pass, so the result is
 * predictable rather than optimal.
 */
public class PlacementPlanner {

    private static final Comparator<NodeWithPosition> BY_LOCATION = Comparator
            .comparing((NodeWithPosition n) -> n.getLocation().getModule())
            .thenComparingInt(n -> n.getLocation().getRange().getPos().getLine())
            .thenComparingInt(n -> n.getLocation().getRange().getPos().getColumn());

    private final List<String> modules;
    private final StubRenderer stubRenderer;

    public PlacementPlanner(List<String> modules, StubRenderer stubRenderer) {
        this.modules = List.copyOf(modules);
        this.stubRenderer = stubRenderer;
    }

    public Plan plan(List<NodeWithPosition> nodes) throws IOException {
        List<NodeWithPosition> topological = TopologicalSorter.sort(nodes);

        Map<String, List<String>> prepends = new LinkedHashMap<>();
        List<String> overflow = new ArrayList<>();
        for (int i = 0; i < topological.size(); i++) {
            NodeWithPosition node = topological.get(i);
            if (isPlaceable(node)) {
                continue;
            }
            String stub = stubRenderer.render(node);
            NodeWithPosition consumer = null;
            for (NodeWithPosition candidate : topological.subList(i, topological.size())) {
                if (isPlaceable(candidate) && candidate.getUses().contains(node.getName())) {
                    consumer = candidate;
                    break;
                }
            }
            if (consumer != null) {
                prepends.computeIfAbsent(consumer.getName(), k -> new ArrayList<>()).add(stub);
            } else {
                overflow.add(stub);
            }
        }

        List<NodeWithPosition> spliceOrder = new ArrayList<>();
        for (NodeWithPosition node : nodes) {
            if (isPlaceable(node)) {
                requireDeclaration(node);
                spliceOrder.add(node);
            }
        }
        // Later declarations first, so that earlier ranges in the same file stay valid
        spliceOrder.sort(BY_LOCATION.reversed());

        return new Plan(spliceOrder, prepends, overflow);
    }

    /**
     * A node is placeable when it is declared in one of the target modules or a submodule of one.
     */
    public boolean isPlaceable(NodeWithPosition node) {
        DeclarationLocation location = node.getLocation();
        if (location == null || location.getModule() == null) {
            return false;
        }
        String module = location.getModule();
        for (String target : modules) {
            if (module.equals(target) || module.startsWith(target + ".")) {
                return true;
            }
        }
        return false;
    }

    /**
     * Fails with the node's name when a placeable node lacks the file or range needed to splice it.
     */
    static void requireDeclaration(NodeWithPosition node) {
        if (!node.hasLean() || node.getFile() == null || node.getLocation() == null
                || node.getLocation().getRange() == null) {
            throw new IllegalStateException("Node " + node.getName()
                    + " is placeable but has no Lean declaration file or range"
                    + " (hasLean=" + node.hasLean() + ", file=" + node.getFile() + ")");
        }
    }

    public static final class Plan {
        private final List<NodeWithPosition> spliceOrder;
        private final Map<String, List<String>> prepends;
        private final List<String> overflow;

        Plan(List<NodeWithPosition> spliceOrder, Map<String, List<String>> prepends, List<String> overflow) {
            this.spliceOrder = Collections.unmodifiableList(spliceOrder);
            this.prepends = Collections.unmodifiableMap(prepends);
            this.overflow = Collections.unmodifiableList(overflow);
        }

        /** Placeable nodes in reverse source order. */
        public List<NodeWithPosition> getSpliceOrder() {
            return spliceOrder;
        }

        public List<String> prependsFor(String name) {
            return prepends.getOrDefault(name, List.of());
        }

        public List<String> getOverflow() {
            return overflow;
        }
    }
}
