package com.leanblueprint.maven.transcode;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;

import com.leanblueprint.maven.graph.Node;
import com.leanblueprint.maven.graph.NodePart;

class PandocTranscoderTest {

    @Test
    void preprocess_normalizesCitationCommands() {
        assertThat(PandocTranscoder.preprocess("\\citep[p. 3]{knuth} and \\textcite{lamport} and \\cite*{x}"))
                .isEqualTo("\\cite[p. 3]{knuth} and \\cite{lamport} and \\cite{x}");
    }

    @Test
    void postprocess_removesBreakBeforeEnd() {
        assertThat(PandocTranscoder.postprocess("text\n\n\\end{proof}")).isEqualTo("text\n\\end{proof}");
    }

    @Test
    void postprocess_restoresUnresolvedReferences() {
        assertThat(PandocTranscoder.postprocess("see [\\[lem:a\\]](#lem:a)")).isEqualTo("see \\ref{lem:a}");
    }

    @Test
    void postprocess_rewritesCitations() {
        assertThat(PandocTranscoder.postprocess("As in [@knuth; @lamport p. 3] and [@x]."))
                .isEqualTo("As in [knuth] [lamport], p. 3 and [x].");
    }

    @Test
    @EnabledOnOs({OS.LINUX, OS.MAC})
    void convertNode_runsCommandOnStatementAndProof() throws Exception {
        // Stand-in for pandoc that echoes its input; pandoc's own arguments land in $1...
        PandocTranscoder transcoder = new PandocTranscoder(List.of("sh", "-c", "cat", "pandoc"), 100, null);
        Node node = new Node("A", new NodePart(false, "\\citet{x}", null, "theorem"), false, null, null);
        node.setProof(new NodePart(false, "  proof  ", null, "proof"));

        transcoder.convertNode(node);

        assertThat(node.getStatement().getText()).isEqualTo("\\cite{x}");
        assertThat(node.getProof().getText()).isEqualTo("proof");
    }
}
