package com.leanblueprint.maven.graph;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Nodes in first-occurrence order plus the identifier and label indices built
 * while parsing the blueprint.
 * <p>
 * Nodes hold no references to each other; edges are identifiers looked up here.
 */
public class NodeGraph {

    private final List<Node> nodes = new ArrayList<>();
    private final Map<String, Node> byName = new LinkedHashMap<>();
    private final Map<String, Node> byLabel = new LinkedHashMap<>();
    private final Map<String, List<SourceSpan>> rawSources = new LinkedHashMap<>();

    /**
     * Adds the node unless its identifier is taken.
     *
     * @return the node registered under the identifier (the existing one on collision)
     */
    public Node addIfAbsent(Node node) {
        Node existing = byName.get(node.getName());
        if (existing != null) {
            return existing;
        }
        nodes.add(node);
        byName.put(node.getName(), node);
        return node;
    }

    public boolean containsName(String name) {
        return byName.containsKey(name);
    }

    public Node getByName(String name) {
        return byName.get(name);
    }

    public void putLabel(String label, Node node) {
        byLabel.put(label, node);
    }

    public Node getByLabel(String label) {
        return byLabel.get(label);
    }

    /** Records a LaTeX environment that contributed to the node. */
    public void addRawSource(String name, SourceSpan span) {
        rawSources.computeIfAbsent(name, k -> new ArrayList<>()).add(span);
    }

    public List<Node> getNodes() {
        return Collections.unmodifiableList(nodes);
    }

    public Map<String, Node> getLabelIndex() {
        return Collections.unmodifiableMap(byLabel);
    }

    public Map<String, List<SourceSpan>> getRawSources() {
        return Collections.unmodifiableMap(rawSources);
    }
}
