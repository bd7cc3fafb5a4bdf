package com.leanblueprint.maven.position;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;

import org.junit.jupiter.api.Test;

import com.leanblueprint.maven.graph.Node;
import com.leanblueprint.maven.graph.NodePart;
import com.leanblueprint.maven.graph.NodeWithPosition;

class NodeJsonTest {

    @Test
    void write_usesCamelCaseKeys() throws Exception {
        NodePart statement = new NodePart(true, "S", List.of("lbl"), "lemma");
        statement.setUses(List.of("B"));
        Node node = new Node("A", statement, true, 7, "Title");

        String json = NodeJson.write(List.of(node));

        assertThat(json)
                .contains("\"name\":\"A\"")
                .contains("\"leanOk\":true")
                .contains("\"uses\":[\"B\"]")
                .contains("\"usesRaw\":[\"lbl\"]")
                .contains("\"latexEnv\":\"lemma\"")
                .contains("\"notReady\":true")
                .contains("\"discussion\":7")
                .contains("\"title\":\"Title\"")
                .contains("\"proof\":null")
                .doesNotContain("hasProof");
    }

    @Test
    void readWithPosition_readsLocationAndIgnoresUnknownKeys() throws Exception {
        String json = """
                [{"name": "A", "statement": {"leanOk": false, "text": "S", "uses": [], "usesRaw": ["x"],
                  "latexEnv": "definition", "extra": 1},
                  "proof": null, "notReady": false, "discussion": null, "title": null,
                  "hasLean": true, "file": "Demo/Basic.lean", "somethingNew": "ignored",
                  "location": {"module": "Demo.Basic",
                    "range": {"pos": {"line": 3, "column": 0}, "endPos": {"line": 4, "column": 9}}}},
                 {"name": "B", "statement": {"leanOk": true, "text": "", "uses": ["A"], "usesRaw": [],
                  "latexEnv": "theorem"},
                  "proof": {"leanOk": true, "text": "P", "uses": [], "usesRaw": [], "latexEnv": "proof"},
                  "notReady": false, "hasLean": false}]
                """;

        List<NodeWithPosition> nodes = NodeJson.readWithPosition(json);

        assertThat(nodes).hasSize(2);
        NodeWithPosition a = nodes.get(0);
        assertThat(a.hasLean()).isTrue();
        assertThat(a.getFile()).isEqualTo("Demo/Basic.lean");
        assertThat(a.getLocation().getModule()).isEqualTo("Demo.Basic");
        assertThat(a.getLocation().getRange().getEndPos().getColumn()).isEqualTo(9);
        assertThat(a.getStatement().getUsesRaw()).containsExactly("x");
        NodeWithPosition b = nodes.get(1);
        assertThat(b.hasLean()).isFalse();
        assertThat(b.getLocation()).isNull();
        assertThat(b.getProof().getText()).isEqualTo("P");
        assertThat(b.getUses()).containsExactly("A");
    }
}
