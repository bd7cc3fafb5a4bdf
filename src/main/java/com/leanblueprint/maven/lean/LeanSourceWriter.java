package com.leanblueprint.maven.lean;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import com.leanblueprint.maven.Diagnostics;
import com.leanblueprint.maven.graph.NodeWithPosition;

/**
 * Applies a placement plan to the Lean sources.
 * <p>
 * Files are rewritten one declaration at a time and are not restored if a later
 * step fails.
 */
public class LeanSourceWriter {

    private final Diagnostics diagnostics;
    private final SourceSplicer splicer;
    private final String importLine;

    public LeanSourceWriter(Diagnostics diagnostics, String importLine) {
        this.diagnostics = diagnostics;
        this.splicer = new SourceSplicer(diagnostics);
        this.importLine = importLine;
    }

    /**
     * @param projectDir directory that relative Lean file paths are resolved against
     * @return the Lean files that were modified, not counting the overflow file
     */
    public Set<Path> write(PlacementPlanner.Plan plan, Path projectDir, Path overflowFile, boolean forceUses)
            throws IOException {
        Set<Path> modifiedFiles = new LinkedHashSet<>();

        for (NodeWithPosition node : plan.getSpliceOrder()) {
            PlacementPlanner.requireDeclaration(node);
            Path file = projectDir.resolve(node.getFile()).normalize();
            String source = Files.readString(file);
            String updated = splicer.spliceDeclaration(source, node.getLocation().getRange(), node, forceUses,
                    plan.prependsFor(node.getName()));
            Files.writeString(file, updated);
            modifiedFiles.add(file);
        }

        for (Path file : modifiedFiles) {
            Files.writeString(file, addImport(Files.readString(file), importLine));
        }

        if (!plan.getOverflow().isEmpty()) {
            diagnostics.warn("Outputting " + plan.getOverflow().size() + " node(s) to\n  " + overflowFile
                    + "\nYou may want to move them to appropriate locations.");
            writeOverflow(overflowFile, plan.getOverflow(), importLine);
        }
        return modifiedFiles;
    }

    /**
     * Inserts {@code importLine} after the leading block of imports. Files that
     * already contain the line are returned unchanged; files without imports get it
     * as their first line.
     */
    public static String addImport(String source, String importLine) {
        List<String> lines = splitLinesKeepEnds(source);
        for (String line : lines) {
            if (line.strip().equals(importLine)) {
                return source;
            }
        }

        int firstImport = -1;
        for (int i = 0; i < lines.size(); i++) {
            if (isImport(lines.get(i))) {
                firstImport = i;
                break;
            }
        }
        if (firstImport < 0) {
            return importLine + "\n" + source;
        }

        int lastImport = firstImport;
        for (int i = firstImport + 1; i < lines.size(); i++) {
            String line = lines.get(i);
            if (isImport(line)) {
                lastImport = i;
            } else if (!line.isBlank()) {
                break;
            }
        }

        StringBuilder sb = new StringBuilder();
        for (int i = 0; i <= lastImport; i++) {
            sb.append(lines.get(i));
        }
        if (!lines.get(lastImport).endsWith("\n")) {
            sb.append('\n');
        }
        sb.append(importLine).append('\n');
        for (int i = lastImport + 1; i < lines.size(); i++) {
            sb.append(lines.get(i));
        }
        return sb.toString();
    }

    static void writeOverflow(Path overflowFile, List<String> stubs, String importLine) throws IOException {
        String existing = Files.exists(overflowFile) ? Files.readString(overflowFile) : "";
        String content = existing + importLine + "\n\n" + String.join("\n\n", stubs) + "\n";
        Path parent = overflowFile.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.writeString(overflowFile, content);
    }

    private static boolean isImport(String line) {
        return line.startsWith("import ") || line.startsWith("public import ");
    }

    static List<String> splitLinesKeepEnds(String source) {
        List<String> lines = new ArrayList<>();
        int start = 0;
        while (start < source.length()) {
            int newline = source.indexOf('\n', start);
            int end = newline < 0 ? source.length() : newline + 1;
            lines.add(source.substring(start, end));
            start = end;
        }
        return lines;
    }
}
