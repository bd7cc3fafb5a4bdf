package com.leanblueprint.maven.graph;

/**
 * A LaTeX environment as it appeared in the flattened blueprint: its offsets in
 * the flattened text and the verbatim environment text.
 */
public class SourceSpan {

    private final int start;
    private final int end;
    private final String text;

    public SourceSpan(int start, int end, String text) {
        this.start = start;
        this.end = end;
        this.text = text;
    }

    public int getStart() {
        return start;
    }

    public int getEnd() {
        return end;
    }

    public String getText() {
        return text;
    }

    @Override
    public String toString() {
        return "[" + start + ", " + end + ") " + text;
    }
}
