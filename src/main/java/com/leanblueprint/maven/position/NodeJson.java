package com.leanblueprint.maven.position;

import java.io.IOException;
import java.util.Arrays;
import java.util.List;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.leanblueprint.maven.graph.Node;
import com.leanblueprint.maven.graph.NodeWithPosition;

/**
 * JSON form of the node list exchanged with the position lookup.
 */
public final class NodeJson {

    private static final ObjectMapper mapper = new ObjectMapper();

    public static String write(List<? extends Node> nodes) throws IOException {
        return mapper.writeValueAsString(nodes);
    }

    public static String writePretty(List<? extends Node> nodes) throws IOException {
        return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(nodes);
    }

    public static List<NodeWithPosition> readWithPosition(String json) throws IOException {
        NodeWithPosition[] nodes = mapper.readValue(json, NodeWithPosition[].class);
        return nodes == null ? List.of() : Arrays.asList(nodes);
    }

    private NodeJson() {
    }
}
