package com.leanblueprint.maven.lean;

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.leanblueprint.maven.Diagnostics;
import com.leanblueprint.maven.graph.DeclarationLocation.DeclarationRange;
import com.leanblueprint.maven.graph.Node;

/**
 * Adds a docstring and a {@code blueprint} attribute to a single Lean declaration,
 * merging them with the docstring and attribute list it already has.
 * <p>
 * The declaration is assumed to be written in a conventional style. Command
 * modifiers ({@code open ... in}, {@code omit ... in}) are recognized only one per
 * line, each line ending in {@code in} with no trailing comment; anything more
 * unusual needs fixing by hand after conversion.
 */
public class SourceSplicer {

    private static final Pattern COMMAND_MODIFIERS = Pattern.compile("(?:[a-zA-Z_]+.*?in\\n)+");
    private static final Pattern DOCSTRING = Pattern.compile("\\s*/--(.*?)-/\\s*", Pattern.DOTALL);
    private static final String TO_ADDITIVE = "to_additive";

    private final Diagnostics diagnostics;

    public SourceSplicer(Diagnostics diagnostics) {
        this.diagnostics = diagnostics;
    }

    /**
     * Rewrites the declaration of {@code node} inside {@code source}.
     *
     * @param prepend whole declarations to insert before it, each followed by a blank line
     * @return the new file content
     */
    public String spliceDeclaration(String source, DeclarationRange range, Node node,
            boolean forceUses, List<String> prepend) {
        DeclarationSlice slice = DeclarationSlice.split(source, range);
        String declaration = slice.getDeclaration();

        AttributeOptions options = AnnotationSynthesizer.forDeclaration(node, declaration, forceUses);
        String attribute = AnnotationSynthesizer.render(node, options);
        String rewritten = insertDocstringAndAttribute(declaration, node.getStatement().getText(), attribute);

        StringBuilder sb = new StringBuilder();
        if (prepend != null) {
            for (String extra : prepend) {
                sb.append(extra).append("\n\n");
            }
        }
        sb.append(rewritten);
        return slice.with(sb.toString());
    }

    public String insertDocstringAndAttribute(String declaration, String newDocstring, String newAttribute) {
        String decl = declaration;

        String modifiers = "";
        Matcher modifierMatcher = COMMAND_MODIFIERS.matcher(decl);
        if (modifierMatcher.lookingAt()) {
            modifiers = modifierMatcher.group();
            decl = decl.substring(modifierMatcher.end());
        }

        String docstring = newDocstring == null ? "" : newDocstring;
        Matcher docMatcher = DOCSTRING.matcher(decl);
        if (docMatcher.lookingAt()) {
            docstring = docstring + "\n\n" + docMatcher.group(1).strip();
            decl = decl.substring(docMatcher.end());
        }

        String attributes = newAttribute;
        AttributeList existing = AttributeList.find(decl);
        if (existing != null) {
            attributes = existing.content + ", " + newAttribute;
            decl = decl.substring(existing.end);
        }

        docstring = docstring.isBlank() ? "" : Docstrings.makeDocstring(docstring);

        if (decl.startsWith(TO_ADDITIVE)) {
            diagnostics.warnOnce(TO_ADDITIVE,
                    "Encountered additive declaration(s) generated from @[to_additive]. "
                            + "A placeholder is added, which is likely incorrect. You may decide to:\n"
                            + "- Add only the additive declaration in the blueprint by `attribute [blueprint] additive_name`\n"
                            + "- Add only the multiplicative declaration in the blueprint by `@[to_additive, blueprint]`\n"
                            + "- (Current) add both in the blueprint by `@[to_additive (attr := blueprint)]`");
            String rest = decl.substring(TO_ADDITIVE.length()).strip();
            StringBuilder sb = new StringBuilder(modifiers)
                    .append(TO_ADDITIVE).append(" (attr := ").append(attributes).append(")");
            if (!rest.isEmpty()) {
                sb.append(' ').append(rest);
            }
            if (!docstring.isEmpty()) {
                sb.append(' ').append(docstring);
            }
            return sb.toString();
        }

        StringBuilder sb = new StringBuilder(modifiers);
        if (!docstring.isEmpty()) {
            sb.append(docstring).append('\n');
        }
        sb.append("@[").append(attributes).append("]\n").append(decl);
        return sb.toString();
    }

    /**
     * A leading {@code @[...]} with balanced brackets, so nested lists such as
     * {@code (uses := [a])} stay inside the attribute.
     */
    private static final class AttributeList {
        final String content;
        final int end;

        private AttributeList(String content, int end) {
            this.content = content;
            this.end = end;
        }

        static AttributeList find(String decl) {
            int i = skipWhitespace(decl, 0);
            if (!decl.startsWith("@[", i)) {
                return null;
            }
            int depth = 0;
            for (int j = i + 1; j < decl.length(); j++) {
                char c = decl.charAt(j);
                if (c == '[') {
                    depth++;
                } else if (c == ']') {
                    depth--;
                    if (depth == 0) {
                        return new AttributeList(decl.substring(i + 2, j), skipWhitespace(decl, j + 1));
                    }
                }
            }
            return null;
        }

        private static int skipWhitespace(String s, int from) {
            int i = from;
            while (i < s.length() && Character.isWhitespace(s.charAt(i))) {
                i++;
            }
            return i;
        }
    }
}
