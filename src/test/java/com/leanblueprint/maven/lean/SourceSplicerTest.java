package com.leanblueprint.maven.lean;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;

import java.util.List;

import org.apache.maven.plugin.logging.Log;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.leanblueprint.maven.Diagnostics;
import com.leanblueprint.maven.graph.DeclarationLocation.DeclarationRange;
import com.leanblueprint.maven.graph.DeclarationLocation.Position;
import com.leanblueprint.maven.graph.Node;

class SourceSplicerTest {

    private static final String DECLARATION = "theorem a := by\n  exact b";
    private static final String SOURCE = "import Mathlib\n\n" + DECLARATION + "\n\ntheorem c := rfl\n";
    private static final DeclarationRange RANGE = new DeclarationRange(new Position(3, 0), new Position(4, 9));

    private Diagnostics diagnostics;
    private SourceSplicer splicer;

    @BeforeEach
    void setUp() {
        diagnostics = new Diagnostics(mock(Log.class));
        splicer = new SourceSplicer(diagnostics);
    }

    @Test
    void insert_emptyDocstringOnlyAddsAttributeBlock() {
        assertThat(splicer.insertDocstringAndAttribute(DECLARATION, "", "blueprint"))
                .isEqualTo("@[blueprint]\n" + DECLARATION);
    }

    @Test
    void insert_docstringAndAttributeKeepBodyIndentation() {
        assertThat(splicer.insertDocstringAndAttribute(DECLARATION, "...", "blueprint\n  (uses := [b])"))
                .isEqualTo("/-- ... -/\n@[blueprint\n  (uses := [b])]\ntheorem a := by\n  exact b");
    }

    @Test
    void insert_twiceAccumulatesNewBeforeOld() {
        String first = splicer.insertDocstringAndAttribute(DECLARATION, "first", "attrA");
        String second = splicer.insertDocstringAndAttribute(first, "second", "attrB");

        assertThat(first).isEqualTo("/-- first -/\n@[attrA]\n" + DECLARATION);
        assertThat(second).isEqualTo("/--\nsecond\n\nfirst\n-/\n@[attrA, attrB]\n" + DECLARATION);
    }

    @Test
    void insert_existingAttributeWithNestedBrackets() {
        String declaration = "@[simp, blueprint\n  (uses := [x])]\ntheorem t := rfl";

        assertThat(splicer.insertDocstringAndAttribute(declaration, "", "foo"))
                .isEqualTo("@[simp, blueprint\n  (uses := [x]), foo]\ntheorem t := rfl");
    }

    @Test
    void insert_commandModifiersStayInFront() {
        String declaration = "open Nat in\nomit [Foo] in\ntheorem t := rfl";

        assertThat(splicer.insertDocstringAndAttribute(declaration, "D", "blueprint"))
                .isEqualTo("open Nat in\nomit [Foo] in\n/-- D -/\n@[blueprint]\ntheorem t := rfl");
    }

    @Test
    void insert_toAdditiveEmbedsAttributeAndWarnsOnce() {
        String first = splicer.insertDocstringAndAttribute("to_additive foo_add", "Doc", "blueprint");
        String second = splicer.insertDocstringAndAttribute("to_additive", "", "blueprint");

        assertThat(first).isEqualTo("to_additive (attr := blueprint) foo_add /-- Doc -/");
        assertThat(second).isEqualTo("to_additive (attr := blueprint)");
        assertThat(diagnostics.getWarnings()).hasSize(1);
    }

    @Test
    void spliceDeclaration_preservesSurroundingText() {
        Node node = new Node("a", LeanTestNodes.part("foo", List.of("b"), "definition"), false, null, null);

        String result = splicer.spliceDeclaration(SOURCE, RANGE, node, true, List.of());

        assertThat(result).isEqualTo("import Mathlib\n\n"
                + "/-- foo -/\n@[blueprint\n  (uses := [b])]\ntheorem a := by\n  exact b"
                + "\n\ntheorem c := rfl\n");
    }

    @Test
    void spliceDeclaration_prependsStubs() {
        Node node = new Node("a", LeanTestNodes.part("foo", List.of(), "definition"), false, null, null);

        String result = splicer.spliceDeclaration(SOURCE, RANGE, node, false,
                List.of("attribute [blueprint] x", "attribute [blueprint] y"));

        assertThat(result).isEqualTo("import Mathlib\n\n"
                + "attribute [blueprint] x\n\nattribute [blueprint] y\n\n"
                + "/-- foo -/\n@[blueprint]\ntheorem a := by\n  exact b"
                + "\n\ntheorem c := rfl\n");
    }
}
