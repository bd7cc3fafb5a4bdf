package com.leanblueprint.maven;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.nio.file.Files;
import java.nio.file.Path;

import org.apache.maven.plugin.MojoExecutionException;
import org.apache.maven.project.MavenProject;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;

import com.leanblueprint.maven.config.ConversionConfigLoader;

class ConvertMojoTest {

    private static final String POSITIONS_JSON = """
            [{"name": "Demo.one",
              "statement": {"leanOk": false, "text": "One is one.", "uses": [], "usesRaw": [], "latexEnv": "lemma"},
              "proof": null, "notReady": false, "discussion": null, "title": null,
              "hasLean": true, "file": "Demo.lean",
              "location": {"module": "Demo",
                "range": {"pos": {"line": 1, "column": 0}, "endPos": {"line": 1, "column": 26}}}}]
            """;

    // Shell stand-ins for the Lean position tool and pandoc
    private static final String CONFIG = """
            positionLookup:
              command: [sh, -c, "cat positions.json", add_position_info]
            transcoder:
              command: [sh, -c, cat, pandoc]
            """;

    private ConvertMojo mojo;
    private Path testBaseDir;

    @BeforeEach
    void setUp() throws Exception {
        mojo = new ConvertMojo();

        testBaseDir = Path.of("target/test-output", getClass().getSimpleName(),
                String.valueOf(System.nanoTime()));
        Files.createDirectories(testBaseDir);

        MavenProject project = new MavenProject();
        project.setFile(testBaseDir.resolve("pom.xml").toFile());
        setField(mojo, "project", project);
        setField(mojo, "modules", "Demo");
    }

    static void setField(Object target, String fieldName, Object value) throws Exception {
        Class<?> type = target.getClass();
        while (type != null) {
            try {
                java.lang.reflect.Field field = type.getDeclaredField(fieldName);
                field.setAccessible(true);
                field.set(target, value);
                return;
            } catch (NoSuchFieldException e) {
                type = type.getSuperclass();
            }
        }
        throw new NoSuchFieldException(fieldName);
    }

    private void writeFixture(Path blueprintDir) throws Exception {
        Files.createDirectories(blueprintDir);
        Files.writeString(blueprintDir.resolve("web.tex"),
                "\\begin{lemma}\\label{lem:one}\\lean{Demo.one}\nOne is one.\n\\end{lemma}\n");
        Files.writeString(blueprintDir.resolve(ConversionConfigLoader.PROJECT_CONFIG_NAME), CONFIG);
        Files.writeString(testBaseDir.resolve("Demo.lean"), "theorem one : 1 = 1 := rfl\n");
        Files.writeString(testBaseDir.resolve("positions.json"), POSITIONS_JSON);
    }

    @Test
    void testExecute_missingModulesFails() throws Exception {
        setField(mojo, "modules", " , ");

        MojoExecutionException e = assertThrows(MojoExecutionException.class, mojo::execute);
        assertThat(e.getMessage()).contains("blueprint.modules");
    }

    @Test
    void testExecute_missingBlueprintFails() {
        MojoExecutionException e = assertThrows(MojoExecutionException.class, mojo::execute);
        assertThat(e.getMessage()).contains("web.tex");
    }

    @Test
    void testExecute_explicitRootWithoutRootFileFails() throws Exception {
        setField(mojo, "blueprintRoot", testBaseDir.toFile());

        assertThrows(MojoExecutionException.class, mojo::execute);
    }

    @Test
    void testResolveBlueprintRoot_prefersBlueprintSrc() throws Exception {
        Files.createDirectories(testBaseDir.resolve("blueprint/src"));
        Files.writeString(testBaseDir.resolve("blueprint/web.tex"), "");
        assertThat(mojo.resolveBlueprintRoot()).isEqualTo(testBaseDir.resolve("blueprint"));

        Files.writeString(testBaseDir.resolve("blueprint/src/web.tex"), "");
        assertThat(mojo.resolveBlueprintRoot()).isEqualTo(testBaseDir.resolve("blueprint/src"));
    }

    @Test
    void testSplitList() {
        assertThat(AbstractBlueprintMojo.splitList(" A, B.C ,,")).containsExactly("A", "B.C");
        assertThat(AbstractBlueprintMojo.splitList(null)).isEmpty();
    }

    @Test
    @EnabledOnOs({OS.LINUX, OS.MAC})
    void testExecute_convertsProject() throws Exception {
        writeFixture(testBaseDir.resolve("blueprint"));

        mojo.execute();

        assertThat(Files.readString(testBaseDir.resolve("Demo.lean"))).isEqualTo("import Architect\n"
                + "/-- One is one. -/\n"
                + "@[blueprint\n  (latexEnv := \"lemma\")]\n"
                + "theorem one : 1 = 1 := rfl\n");
        assertThat(Files.readString(testBaseDir.resolve("blueprint/web.tex"))).isEqualTo("\\inputleannode{Demo.one}\n");
    }

    @Test
    @EnabledOnOs({OS.LINUX, OS.MAC})
    void testExecute_extractOnlyWritesJsonAndLeavesSources() throws Exception {
        writeFixture(testBaseDir.resolve("blueprint"));
        Path output = testBaseDir.resolve("out/nodes.json");
        setField(mojo, "extractOnly", true);
        setField(mojo, "extractOutput", output.toFile());

        mojo.execute();

        assertThat(Files.readString(output)).isEqualTo(POSITIONS_JSON);
        assertThat(Files.readString(testBaseDir.resolve("Demo.lean"))).isEqualTo("theorem one : 1 = 1 := rfl\n");
    }

    @Test
    @EnabledOnOs({OS.LINUX, OS.MAC})
    void testExecute_failingLookupIsWrapped() throws Exception {
        writeFixture(testBaseDir.resolve("blueprint"));
        Files.delete(testBaseDir.resolve("positions.json"));

        MojoExecutionException e = assertThrows(MojoExecutionException.class, mojo::execute);
        assertThat(e.getMessage()).contains("Blueprint conversion failed");
    }
}
