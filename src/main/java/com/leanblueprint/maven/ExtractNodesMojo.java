package com.leanblueprint.maven;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import org.apache.maven.plugin.MojoExecutionException;
import org.apache.maven.plugins.annotations.Mojo;
import org.apache.maven.plugins.annotations.Parameter;

import com.leanblueprint.maven.graph.NodeGraph;
import com.leanblueprint.maven.position.NodeJson;

/**
 * Parses the blueprint and writes the extracted nodes as JSON for review.
 * Touches no Lean or LaTeX sources.
 * <p>
 * Run manually: {@code mvn blueprint:extract-nodes}
 */
@Mojo(name = "extract-nodes", requiresProject = false)
public class ExtractNodesMojo extends AbstractBlueprintMojo {

    @Parameter(property = "blueprint.nodesFile", defaultValue = "${project.build.directory}/blueprint/nodes.json")
    private File nodesFile;

    @Parameter(property = "blueprint.convertInformal", defaultValue = "false")
    private boolean convertInformal;

    @Override
    public void execute() throws MojoExecutionException {
        Path root = resolveBlueprintRoot();
        Diagnostics diagnostics = new Diagnostics(getLog());
        BlueprintConverter converter = new BlueprintConverter(diagnostics, loadConfig(root), null, null, null);

        Path out = nodesFile != null ? nodesFile.toPath().toAbsolutePath()
                : projectDir().resolve("target").resolve("blueprint").resolve("nodes.json");
        try {
            NodeGraph graph = converter.parse(root.resolve(rootFileName), convertInformal);
            Files.createDirectories(out.getParent());
            Files.writeString(out, NodeJson.writePretty(graph.getNodes()), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new MojoExecutionException("Failed to extract blueprint nodes", e);
        }
        getLog().info("Blueprint: Nodes written to " + out);
    }
}
