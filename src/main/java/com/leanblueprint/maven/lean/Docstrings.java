package com.leanblueprint.maven.lean;

import com.fasterxml.jackson.core.io.JsonStringEncoder;

/**
 * Lean docstring and string literal rendering.
 */
public final class Docstrings {

    /** Double-quoted string literal with JSON escaping; non-ASCII text is kept as is. */
    public static String quote(String s) {
        return "\"" + new String(JsonStringEncoder.getInstance().quoteAsString(s)) + "\"";
    }

    public static String makeDocstring(String text) {
        return makeDocstring(text, 0);
    }

    /**
     * Renders {@code /-- text -/}, or a multi-line docstring with every line indented
     * when the text spans more than one line.
     */
    public static String makeDocstring(String text, int indent) {
        String pad = " ".repeat(indent);
        String body = text.strip().replace("\n", "\n" + pad);
        if (body.contains("\n")) {
            return "/--\n" + pad + body + "\n" + pad + "-/";
        }
        return "/-- " + body + " -/";
    }

    private Docstrings() {
    }
}
