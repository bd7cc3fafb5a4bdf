package com.leanblueprint.maven.latex;

import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The blueprint with every {@code \input} inlined, plus a map from offsets in the
 * flattened text back to the file each piece was read from.
 */
public class FlattenedDocument {

    private final String text;
    private final List<Segment> segments;
    private final Map<Path, String> fileContents;

    FlattenedDocument(String text, List<Segment> segments, Map<Path, String> fileContents) {
        this.text = text;
        this.segments = List.copyOf(segments);
        this.fileContents = Collections.unmodifiableMap(new LinkedHashMap<>(fileContents));
    }

    public String getText() {
        return text;
    }

    /** Files read while flattening, with the contents they had at that time. */
    public Map<Path, String> getFileContents() {
        return fileContents;
    }

    /**
     * Maps the flattened range {@code [start, end)} to a range in a single file.
     *
     * @return the location, or {@code null} when the range crosses a file boundary
     */
    public Location locate(int start, int end) {
        for (Segment segment : segments) {
            if (segment.docStart <= start && end <= segment.docStart + segment.length) {
                int offset = segment.fileStart - segment.docStart;
                return new Location(segment.file, start + offset, end + offset);
            }
        }
        return null;
    }

    /** A run of flattened text copied unchanged from one file. */
    static class Segment {

        private final int docStart;
        private final Path file;
        private final int fileStart;
        private final int length;

        Segment(int docStart, Path file, int fileStart, int length) {
            this.docStart = docStart;
            this.file = file;
            this.fileStart = fileStart;
            this.length = length;
        }
    }

    /** A character range in one blueprint file. */
    public static class Location {

        private final Path file;
        private final int start;
        private final int end;

        Location(Path file, int start, int end) {
            this.file = file;
            this.start = start;
            this.end = end;
        }

        public Path getFile() {
            return file;
        }

        public int getStart() {
            return start;
        }

        public int getEnd() {
            return end;
        }
    }
}
