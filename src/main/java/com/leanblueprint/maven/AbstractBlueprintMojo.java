package com.leanblueprint.maven;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import org.apache.maven.plugin.AbstractMojo;
import org.apache.maven.plugin.MojoExecutionException;
import org.apache.maven.plugins.annotations.Parameter;
import org.apache.maven.project.MavenProject;

import com.leanblueprint.maven.config.ConversionConfig;
import com.leanblueprint.maven.config.ConversionConfigLoader;

/**
 * Parameters and lookups shared by the blueprint goals.
 */
public abstract class AbstractBlueprintMojo extends AbstractMojo {

    @Parameter(defaultValue = "${project}", readonly = true)
    protected MavenProject project;

    /** Blueprint source directory. Defaults to blueprint/src, else blueprint, under the project directory. */
    @Parameter(property = "blueprint.root")
    protected File blueprintRoot;

    @Parameter(property = "blueprint.rootFileName", defaultValue = "web.tex")
    protected String rootFileName = "web.tex";

    @Parameter(property = "blueprint.configFile")
    protected File configFile;

    /** Lean project directory: the Maven base directory, or the working directory outside a project. */
    protected Path projectDir() {
        if (project != null && project.getBasedir() != null) {
            return project.getBasedir().toPath();
        }
        return Path.of("").toAbsolutePath();
    }

    protected Path resolveBlueprintRoot() throws MojoExecutionException {
        if (blueprintRoot != null) {
            Path root = blueprintRoot.toPath();
            if (!Files.isRegularFile(root.resolve(rootFileName))) {
                throw new MojoExecutionException("No " + rootFileName + " found in blueprint root " + root);
            }
            return root;
        }
        Path base = projectDir();
        for (Path candidate : List.of(base.resolve("blueprint").resolve("src"), base.resolve("blueprint"))) {
            if (Files.isRegularFile(candidate.resolve(rootFileName))) {
                return candidate;
            }
        }
        throw new MojoExecutionException("Could not find " + rootFileName + " in blueprint/src or blueprint under "
                + base + "; set blueprint.root");
    }

    protected ConversionConfig loadConfig(Path root) throws MojoExecutionException {
        try {
            return ConversionConfigLoader.resolve(configFile != null ? configFile.toPath() : null, root, getLog());
        } catch (IOException e) {
            throw new MojoExecutionException("Failed to load blueprint configuration", e);
        }
    }

    static List<String> splitList(String value) {
        List<String> result = new ArrayList<>();
        if (value == null) {
            return result;
        }
        for (String item : value.split(",")) {
            String trimmed = item.trim();
            if (!trimmed.isEmpty()) {
                result.add(trimmed);
            }
        }
        return result;
    }
}
