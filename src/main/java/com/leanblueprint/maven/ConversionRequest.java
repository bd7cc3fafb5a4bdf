package com.leanblueprint.maven;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Inputs of one conversion run.
 */
public class ConversionRequest {
    private Path blueprintRoot;
    private String rootFileName = "web.tex";
    private Path projectDir;
    private List<String> modules = new ArrayList<>();
    private List<String> nodeFilter = new ArrayList<>();
    private Path overflowFile;
    private boolean extractOnly;
    private boolean convertInformal;
    private boolean addUses;

    public Path getBlueprintRoot() {
        return blueprintRoot;
    }

    public void setBlueprintRoot(Path blueprintRoot) {
        this.blueprintRoot = blueprintRoot;
    }

    public String getRootFileName() {
        return rootFileName;
    }

    public void setRootFileName(String rootFileName) {
        this.rootFileName = rootFileName;
    }

    /** Lean project directory; relative Lean file paths resolve against it. */
    public Path getProjectDir() {
        return projectDir;
    }

    public void setProjectDir(Path projectDir) {
        this.projectDir = projectDir;
    }

    public List<String> getModules() {
        return modules;
    }

    public void setModules(List<String> modules) {
        this.modules = modules;
    }

    /** Lean names to convert; empty means all nodes. */
    public List<String> getNodeFilter() {
        return nodeFilter;
    }

    public void setNodeFilter(List<String> nodeFilter) {
        this.nodeFilter = nodeFilter;
    }

    public Path getOverflowFile() {
        return overflowFile;
    }

    public void setOverflowFile(Path overflowFile) {
        this.overflowFile = overflowFile;
    }

    public boolean isExtractOnly() {
        return extractOnly;
    }

    public void setExtractOnly(boolean extractOnly) {
        this.extractOnly = extractOnly;
    }

    public boolean isConvertInformal() {
        return convertInformal;
    }

    public void setConvertInformal(boolean convertInformal) {
        this.convertInformal = convertInformal;
    }

    public boolean isAddUses() {
        return addUses;
    }

    public void setAddUses(boolean addUses) {
        this.addUses = addUses;
    }
}
