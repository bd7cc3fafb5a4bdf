package com.leanblueprint.maven.latex;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.leanblueprint.maven.Diagnostics;

/**
 * Inlines {@code \input{...}} commands recursively into one flat document that
 * remembers which file every piece of text came from.
 * <p>
 * Included paths are resolved against the directory of the root document and
 * default to the {@code .tex} extension. A file that is already being expanded
 * further up the include chain, or that does not exist, is replaced by empty text
 * and reported.
 */
public class IncludeResolver {

    private static final Pattern INPUT_PATTERN = Pattern.compile("\\\\input\\s*\\{([^}]*)\\}");

    private final Diagnostics diagnostics;

    public IncludeResolver(Diagnostics diagnostics) {
        this.diagnostics = diagnostics;
    }

    public FlattenedDocument resolve(Path rootFile) throws IOException {
        Path normalized = rootFile.toAbsolutePath().normalize();
        StringBuilder text = new StringBuilder();
        List<FlattenedDocument.Segment> segments = new ArrayList<>();
        Map<Path, String> contents = new LinkedHashMap<>();
        append(normalized, normalized.getParent(), new ArrayDeque<>(), text, segments, contents);
        return new FlattenedDocument(text.toString(), segments, contents);
    }

    private void append(Path file, Path rootDir, Deque<Path> chain, StringBuilder out,
            List<FlattenedDocument.Segment> segments, Map<Path, String> contents) throws IOException {
        if (chain.contains(file)) {
            diagnostics.warn("Circular \\input detected for file: " + file);
            return;
        }
        chain.push(file);
        try {
            String text = Files.readString(file);
            contents.putIfAbsent(file, text);
            Matcher matcher = INPUT_PATTERN.matcher(text);
            int last = 0;
            while (matcher.find()) {
                copy(file, text, last, matcher.start(), out, segments);
                last = matcher.end();

                String inputPath = matcher.group(1).trim();
                if (!inputPath.endsWith(".tex")) {
                    inputPath += ".tex";
                }
                Path inputFile = rootDir.resolve(inputPath).normalize();
                if (!Files.isRegularFile(inputFile)) {
                    diagnostics.warn("\\input file not found: " + inputFile);
                } else {
                    append(inputFile, rootDir, chain, out, segments, contents);
                }
            }
            copy(file, text, last, text.length(), out, segments);
        } finally {
            chain.pop();
        }
    }

    private static void copy(Path file, String text, int start, int end, StringBuilder out,
            List<FlattenedDocument.Segment> segments) {
        if (end > start) {
            segments.add(new FlattenedDocument.Segment(out.length(), file, start, end - start));
            out.append(text, start, end);
        }
    }

    /**
     * Bibliography files named by {@code \bibliography{a,b}}, with the {@code .bib} extension added.
     */
    public static List<String> bibliographyFiles(String source) {
        List<String> bibs = new ArrayList<>();
        for (String bib : DirectiveExtractor.findArguments("bibliography", source)) {
            bibs.add(bib + ".bib");
        }
        return bibs;
    }
}
