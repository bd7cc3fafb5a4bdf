package com.leanblueprint.maven.transcode;

import java.io.IOException;

import com.leanblueprint.maven.graph.Node;

/**
 * Converts the LaTeX prose of blueprint nodes into Markdown for Lean docstrings.
 */
public interface ProseTranscoder {

    String convert(String latex) throws IOException;

    /** Converts statement and proof text in place. */
    default void convertNode(Node node) throws IOException {
        node.getStatement().setText(convert(node.getStatement().getText()));
        if (node.getProof() != null) {
            node.getProof().setText(convert(node.getProof().getText()));
        }
    }
}
