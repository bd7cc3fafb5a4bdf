package com.leanblueprint.maven.graph;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Module and exact range of a Lean declaration, as reported by the position lookup.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class DeclarationLocation {

    private String module;
    private DeclarationRange range;

    public DeclarationLocation() {
    }

    public DeclarationLocation(String module, DeclarationRange range) {
        this.module = module;
        this.range = range;
    }

    public String getModule() {
        return module;
    }

    public void setModule(String module) {
        this.module = module;
    }

    public DeclarationRange getRange() {
        return range;
    }

    public void setRange(DeclarationRange range) {
        this.range = range;
    }

    /**
     * Start and end of a declaration. Lines are 1-based, columns are 0-based
     * offsets within the line.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class DeclarationRange {

        private Position pos;
        private Position endPos;

        public DeclarationRange() {
        }

        public DeclarationRange(Position pos, Position endPos) {
            this.pos = pos;
            this.endPos = endPos;
        }

        public Position getPos() {
            return pos;
        }

        public void setPos(Position pos) {
            this.pos = pos;
        }

        public Position getEndPos() {
            return endPos;
        }

        public void setEndPos(Position endPos) {
            this.endPos = endPos;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Position {

        private int line;
        private int column;

        public Position() {
        }

        public Position(int line, int column) {
            this.line = line;
            this.column = column;
        }

        public int getLine() {
            return line;
        }

        public void setLine(int line) {
            this.line = line;
        }

        public int getColumn() {
            return column;
        }

        public void setColumn(int column) {
            this.column = column;
        }
    }
}
