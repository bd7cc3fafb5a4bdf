package com.leanblueprint.maven.lean;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.Mockito.mock;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.apache.maven.plugin.logging.Log;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.leanblueprint.maven.Diagnostics;
import com.leanblueprint.maven.graph.NodeWithPosition;

class LeanSourceWriterTest {

    private static final String IMPORT = "import Architect";

    private Path testBaseDir;
    private Diagnostics diagnostics;
    private LeanSourceWriter writer;

    @BeforeEach
    void setUp() throws Exception {
        testBaseDir = Path.of("target/test-output", getClass().getSimpleName(),
                String.valueOf(System.nanoTime()));
        Files.createDirectories(testBaseDir.resolve("Demo"));
        diagnostics = new Diagnostics(mock(Log.class));
        writer = new LeanSourceWriter(diagnostics, IMPORT);
    }

    @Test
    void addImport_afterLeadingImportBlock() {
        assertThat(LeanSourceWriter.addImport("import Mathlib\nimport Foo\n\ntheorem x := rfl\n", IMPORT))
                .isEqualTo("import Mathlib\nimport Foo\nimport Architect\n\ntheorem x := rfl\n");
    }

    @Test
    void addImport_blankLinesInsideBlock() {
        assertThat(LeanSourceWriter.addImport("import A\n\nimport B\ndef x := 1\n", IMPORT))
                .isEqualTo("import A\n\nimport B\nimport Architect\ndef x := 1\n");
    }

    @Test
    void addImport_publicImportsAndHeader() {
        assertThat(LeanSourceWriter.addImport("module\n\npublic import A", IMPORT))
                .isEqualTo("module\n\npublic import A\nimport Architect\n");
    }

    @Test
    void addImport_noImportsPrepends() {
        assertThat(LeanSourceWriter.addImport("def x := 1\n", IMPORT)).isEqualTo("import Architect\ndef x := 1\n");
    }

    @Test
    void addImport_alreadyPresentUnchanged() {
        String source = "import Mathlib\nimport Architect\n\ndef x := 1\n";
        assertThat(LeanSourceWriter.addImport(source, IMPORT)).isSameAs(source);
    }

    @Test
    void write_splicesEveryDeclarationAndImportsOnce() throws Exception {
        Path file = testBaseDir.resolve("Demo/Basic.lean");
        Files.writeString(file, "import Mathlib\n\ndef x : Nat := 1\n\ntheorem y : x = 1 := rfl\n");
        NodeWithPosition x = LeanTestNodes.located("x", "Demo.Basic", "Demo/Basic.lean", 3, 3, 16);
        NodeWithPosition y = LeanTestNodes.located("y", "Demo.Basic", "Demo/Basic.lean", 5, 5, 24);
        PlacementPlanner.Plan plan = new PlacementPlanner.Plan(List.of(y, x), Map.of("y", List.of("stub z")), List.of());

        Set<Path> modified = writer.write(plan, testBaseDir, testBaseDir.resolve("extra_nodes.lean"), false);

        assertThat(modified).containsExactly(file.normalize());
        assertThat(Files.readString(file)).isEqualTo("import Mathlib\nimport Architect\n\n"
                + "@[blueprint]\ndef x : Nat := 1\n\n"
                + "stub z\n\n@[blueprint]\ntheorem y : x = 1 := rfl\n");
        assertThat(Files.exists(testBaseDir.resolve("extra_nodes.lean"))).isFalse();
    }

    @Test
    void write_overflowKeepsExistingContent() throws Exception {
        Path overflow = testBaseDir.resolve("extra_nodes.lean");
        Files.writeString(overflow, "-- existing\n");
        PlacementPlanner.Plan plan = new PlacementPlanner.Plan(List.of(), Map.of(), List.of("stub a", "stub b"));

        Set<Path> modified = writer.write(plan, testBaseDir, overflow, false);

        assertThat(modified).isEmpty();
        assertThat(Files.readString(overflow)).isEqualTo("-- existing\nimport Architect\n\nstub a\n\nstub b\n");
        assertThat(diagnostics.getWarnings()).singleElement().asString().contains("Outputting 2 node(s)");
    }

    @Test
    void write_placeableNodeWithoutFileFails() {
        NodeWithPosition broken = LeanTestNodes.located("Broken", "Demo", null, 1, 1, 1);
        PlacementPlanner.Plan plan = new PlacementPlanner.Plan(List.of(broken), Map.of(), List.of());

        IllegalStateException e = assertThrows(IllegalStateException.class,
                () -> writer.write(plan, testBaseDir, testBaseDir.resolve("extra_nodes.lean"), false));
        assertThat(e.getMessage()).contains("Broken");
    }
}
