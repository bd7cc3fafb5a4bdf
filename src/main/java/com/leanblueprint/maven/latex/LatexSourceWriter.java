package com.leanblueprint.maven.latex;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Set;
import java.util.TreeMap;

import com.leanblueprint.maven.Diagnostics;
import com.leanblueprint.maven.graph.Node;
import com.leanblueprint.maven.graph.SourceSpan;

/**
 * Replaces converted environments in the blueprint sources with a reference to
 * the Lean node.
 * <p>
 * The first environment of a node (its statement) becomes
 * {@code \inputleannode{name}}; later ones (its proof, repeated statements) are
 * removed. Environments are mapped back to the file and offsets they were read
 * from and spliced in reverse order, so everything else is left untouched.
 */
public class LatexSourceWriter {

    private final Diagnostics diagnostics;
    private final String nodeInputCommand;

    public LatexSourceWriter(Diagnostics diagnostics, String nodeInputCommand) {
        this.diagnostics = diagnostics;
        this.nodeInputCommand = nodeInputCommand;
    }

    /**
     * @return the files that were modified
     */
    public Set<Path> write(FlattenedDocument document, List<? extends Node> nodes,
            Map<String, List<SourceSpan>> rawSources) throws IOException {
        // file -> start offset -> edit, in file order of first edit
        Map<Path, NavigableMap<Integer, Edit>> edits = new LinkedHashMap<>();
        for (Node node : nodes) {
            List<SourceSpan> spans = rawSources.getOrDefault(node.getName(), List.of());
            for (int i = 0; i < spans.size(); i++) {
                SourceSpan span = spans.get(i);
                FlattenedDocument.Location location = document.locate(span.getStart(), span.getEnd());
                if (location == null) {
                    diagnostics.warn("The LaTeX source of " + node.getName()
                            + " spans several files; leaving it in place");
                    continue;
                }
                String replacement = i == 0 ? "\\" + nodeInputCommand + "{" + node.getName() + "}" : "";
                edits.computeIfAbsent(location.getFile(), f -> new TreeMap<>())
                        .putIfAbsent(location.getStart(), new Edit(location.getEnd(), replacement));
            }
        }

        for (Map.Entry<Path, NavigableMap<Integer, Edit>> entry : edits.entrySet()) {
            StringBuilder content = new StringBuilder(document.getFileContents().get(entry.getKey()));
            for (Map.Entry<Integer, Edit> edit : entry.getValue().descendingMap().entrySet()) {
                content.replace(edit.getKey(), edit.getValue().end, edit.getValue().replacement);
            }
            Files.writeString(entry.getKey(), content.toString());
        }
        return new LinkedHashSet<>(edits.keySet());
    }

    private static class Edit {

        private final int end;
        private final String replacement;

        Edit(int end, String replacement) {
            this.end = end;
            this.replacement = replacement;
        }
    }
}
