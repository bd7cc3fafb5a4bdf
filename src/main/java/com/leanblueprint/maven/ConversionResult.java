package com.leanblueprint.maven;

import java.nio.file.Path;
import java.util.List;
import java.util.Set;

/**
 * Outcome of a conversion run.
 */
public class ConversionResult {
    private final int nodeCount;
    private final String extractedJson;
    private final Set<Path> modifiedLeanFiles;
    private final Set<Path> modifiedLatexFiles;
    private final int overflowCount;
    private final List<String> warnings;

    public ConversionResult(int nodeCount, String extractedJson, Set<Path> modifiedLeanFiles,
            Set<Path> modifiedLatexFiles, int overflowCount, List<String> warnings) {
        this.nodeCount = nodeCount;
        this.extractedJson = extractedJson;
        this.modifiedLeanFiles = Set.copyOf(modifiedLeanFiles);
        this.modifiedLatexFiles = Set.copyOf(modifiedLatexFiles);
        this.overflowCount = overflowCount;
        this.warnings = List.copyOf(warnings);
    }

    public int getNodeCount() {
        return nodeCount;
    }

    /** Node JSON with positions when only extraction was requested, otherwise null. */
    public String getExtractedJson() {
        return extractedJson;
    }

    public boolean isExtractOnly() {
        return extractedJson != null;
    }

    public Set<Path> getModifiedLeanFiles() {
        return modifiedLeanFiles;
    }

    public Set<Path> getModifiedLatexFiles() {
        return modifiedLatexFiles;
    }

    public int getOverflowCount() {
        return overflowCount;
    }

    public List<String> getWarnings() {
        return warnings;
    }
}
