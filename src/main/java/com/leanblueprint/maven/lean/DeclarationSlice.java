package com.leanblueprint.maven.lean;

import com.leanblueprint.maven.graph.DeclarationLocation.DeclarationRange;
import com.leanblueprint.maven.graph.DeclarationLocation.Position;

/**
 * A Lean source file cut into the text before a declaration, the declaration
 * itself and the text after it.
 * <p>
 * Positions use 1-based lines and 0-based columns counted in Unicode code points.
 */
public final class DeclarationSlice {

    private final String before;
    private final String declaration;
    private final String after;

    private DeclarationSlice(String before, String declaration, String after) {
        this.before = before;
        this.declaration = declaration;
        this.after = after;
    }

    public static DeclarationSlice split(String source, DeclarationRange range) {
        int start = offset(source, range.getPos());
        int end = offset(source, range.getEndPos());
        if (end < start) {
            throw new IllegalArgumentException("Declaration ends before it starts: " + start + " > " + end);
        }
        return new DeclarationSlice(source.substring(0, start), source.substring(start, end), source.substring(end));
    }

    static int offset(String source, Position position) {
        int lineStart = 0;
        for (int line = 1; line < position.getLine(); line++) {
            int newline = source.indexOf('\n', lineStart);
            if (newline < 0) {
                throw new IllegalArgumentException("Line " + position.getLine() + " is past the end of the file");
            }
            lineStart = newline + 1;
        }
        return source.offsetByCodePoints(lineStart, position.getColumn());
    }

    public String getBefore() {
        return before;
    }

    public String getDeclaration() {
        return declaration;
    }

    public String getAfter() {
        return after;
    }

    /** The file with the declaration replaced; everything around it is kept byte for byte. */
    public String with(String newDeclaration) {
        return before + newDeclaration + after;
    }
}
