package com.leanblueprint.maven;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import org.apache.maven.plugin.MojoExecutionException;
import org.apache.maven.plugins.annotations.Mojo;
import org.apache.maven.plugins.annotations.Parameter;

import com.leanblueprint.maven.config.ConversionConfig;
import com.leanblueprint.maven.lean.StubRenderer;
import com.leanblueprint.maven.position.LakePositionLookup;
import com.leanblueprint.maven.template.MustacheTemplateEngine;
import com.leanblueprint.maven.template.TemplateLoader;
import com.leanblueprint.maven.transcode.PandocTranscoder;

/**
 * Converts the LaTeX blueprint of a Lean project: every converted node becomes a
 * {@code @[blueprint]} attribute on its Lean declaration (or a stub declaration),
 * and its LaTeX environment is replaced by the node input command.
 * <p>
 * Run from the Lean project root: {@code mvn blueprint:convert -Dblueprint.modules=MyProject}
 */
@Mojo(name = "convert", requiresProject = false)
public class ConvertMojo extends AbstractBlueprintMojo {

    @Parameter(property = "blueprint.modules")
    private String modules;

    @Parameter(property = "blueprint.nodes")
    private String nodes;

    @Parameter(property = "blueprint.overflowFile", defaultValue = "extra_nodes.lean")
    private String overflowFile = "extra_nodes.lean";

    @Parameter(property = "blueprint.extractOnly", defaultValue = "false")
    private boolean extractOnly;

    @Parameter(property = "blueprint.extractOutput")
    private File extractOutput;

    @Parameter(property = "blueprint.convertInformal", defaultValue = "false")
    private boolean convertInformal;

    @Parameter(property = "blueprint.addUses", defaultValue = "false")
    private boolean addUses;

    @Parameter(property = "blueprint.templateDir")
    private File templateDir;

    @Override
    public void execute() throws MojoExecutionException {
        List<String> moduleList = splitList(modules);
        if (moduleList.isEmpty()) {
            throw new MojoExecutionException("No Lean modules given; set blueprint.modules");
        }
        Path root = resolveBlueprintRoot();
        ConversionConfig config = loadConfig(root);
        Path baseDir = projectDir();

        ConversionRequest request = new ConversionRequest();
        request.setBlueprintRoot(root);
        request.setRootFileName(rootFileName);
        request.setProjectDir(baseDir);
        request.setModules(moduleList);
        request.setNodeFilter(splitList(nodes));
        request.setOverflowFile(baseDir.resolve(overflowFile));
        request.setExtractOnly(extractOnly);
        request.setConvertInformal(convertInformal);
        request.setAddUses(addUses);

        Diagnostics diagnostics = new Diagnostics(getLog());
        TemplateLoader templateLoader = new TemplateLoader(templateDir != null ? templateDir.toPath() : null, getLog());
        BlueprintConverter converter = new BlueprintConverter(diagnostics, config,
                new LakePositionLookup(config.getPositionLookupCommand(), baseDir),
                new PandocTranscoder(config.getTranscoderCommand(), config.getTranscoderColumns(), baseDir),
                new StubRenderer(new MustacheTemplateEngine(templateLoader)));

        try {
            ConversionResult result = converter.convert(request);
            if (result.isExtractOnly()) {
                writeExtracted(result.getExtractedJson());
                return;
            }
            getLog().info("Blueprint: Converted " + result.getNodeCount() + " node(s); modified "
                    + result.getModifiedLeanFiles().size() + " Lean file(s) and "
                    + result.getModifiedLatexFiles().size() + " LaTeX file(s)");
            if (result.getOverflowCount() > 0) {
                getLog().info("Blueprint: " + result.getOverflowCount() + " node(s) written to " + overflowFile);
            }
            if (!result.getWarnings().isEmpty()) {
                getLog().warn("Blueprint: Finished with " + result.getWarnings().size() + " warning(s)");
            }
        } catch (IOException | IllegalStateException e) {
            throw new MojoExecutionException("Blueprint conversion failed: " + e.getMessage(), e);
        }
    }

    private void writeExtracted(String json) throws IOException {
        if (extractOutput == null) {
            getLog().info(json);
            return;
        }
        Path out = extractOutput.toPath();
        if (out.getParent() != null) {
            Files.createDirectories(out.getParent());
        }
        Files.writeString(out, json, StandardCharsets.UTF_8);
        getLog().info("Blueprint: Node JSON written to " + out);
    }
}
