package com.leanblueprint.maven.latex;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.leanblueprint.maven.graph.Node;
import com.leanblueprint.maven.graph.NodeGraph;
import com.leanblueprint.maven.graph.NodePart;

/**
 * Turns LaTeX labels into Lean identifiers once all nodes are known.
 * <p>
 * Raw <code>&#92;uses</code> labels of known nodes move to the resolved uses. In the prose,
 * {@code \ref}-style references to known nodes become {@code \verb|name|} so that
 * transcoding keeps the Lean name intact; unknown labels containing an underscore
 * are wrapped the same way, all others stay references.
 */
public class LabelResolver {

    // Reference commands understood by pandoc's LaTeX reader
    private static final Pattern REF_PATTERN = Pattern.compile(
            "\\\\(?:ref|cref|Cref|vref|eqref|autoref)\\s*\\{([^}]*)\\}");

    private final Map<String, Node> labelIndex;

    public LabelResolver(Map<String, Node> labelIndex) {
        this.labelIndex = labelIndex;
    }

    public void resolve(NodeGraph graph) {
        for (Node node : graph.getNodes()) {
            resolvePart(node.getStatement());
            if (node.getProof() != null) {
                resolvePart(node.getProof());
            }
        }
    }

    public void resolvePart(NodePart part) {
        for (String use : new ArrayList<>(part.getUsesRaw())) {
            Node used = labelIndex.get(use);
            if (used != null) {
                part.getUsesRaw().remove(use);
                part.getUses().add(used.getName());
            }
        }
        part.setText(convertReferences(part.getText()));
    }

    public String convertReferences(String source) {
        Matcher matcher = REF_PATTERN.matcher(source);
        StringBuilder sb = new StringBuilder();
        while (matcher.find()) {
            List<String> output = new ArrayList<>();
            for (String raw : matcher.group(1).split(",")) {
                String label = raw.strip();
                Node node = labelIndex.get(label);
                if (node != null) {
                    // \verb rather than \texttt: pandoc would process braces and quotes in \texttt
                    output.add("\\verb|" + node.getName() + "|");
                } else if (label.contains("_")) {
                    output.add("\\verb|" + label + "|");
                } else {
                    output.add("\\ref{" + label + "}");
                }
            }
            matcher.appendReplacement(sb, Matcher.quoteReplacement(String.join(", ", output)));
        }
        matcher.appendTail(sb);
        return sb.toString().strip();
    }
}
