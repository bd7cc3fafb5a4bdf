package com.leanblueprint.maven.latex;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.leanblueprint.maven.Diagnostics;

/**
 * Finds and strips blueprint directives from the body of a LaTeX environment.
 * <p>
 * This is a narrow regex scanner, not a LaTeX parser. Arguments may not contain
 * braces, and the label lookup ignores nested environments only approximately:
 * nested environments with the same name are not matched correctly.
 */
public class DirectiveExtractor {

    // A nested \begin{x} ... \end{x}; non-reentrant
    private static final Pattern NESTED_ENVIRONMENT = Pattern.compile(
            "\\\\begin\\s*\\{(.*?)\\}.*?\\\\end\\s*\\{\\1\\}", Pattern.DOTALL);

    private static final Pattern NON_BREAKING_SPACE = Pattern.compile("(?<!\\\\)~");

    private final Diagnostics diagnostics;

    public DirectiveExtractor(Diagnostics diagnostics) {
        this.diagnostics = diagnostics;
    }

    /**
     * Extracts all directives from an environment body.
     *
     * @param content the text between {@code \begin{env}[title]} and {@code \end{env}}
     * @return the directives and the remaining prose, trimmed
     */
    public Extracted<DirectiveRecord> extract(String content) {
        String source = removeNonBreakingSpaces(content);

        // Only the outermost environment's \label counts; inner environments may carry their own
        String label = findAndRemoveArgument("label", removeNestedEnvironments(source)).getValue();
        if (label != null) {
            source = source.replace("\\label{" + label + "}", "");
        }

        Extracted<List<String>> uses = findAndRemoveArguments("uses", source, false);
        source = uses.getRemaining();
        Extracted<List<String>> alsoIn = findAndRemoveArguments("alsoIn", source, false);
        source = alsoIn.getRemaining();
        Extracted<String> proves = findAndRemoveArgument("proves", source);
        source = proves.getRemaining();

        Extracted<Boolean> leanOk = findAndRemoveCommand("leanok", source);
        source = leanOk.getRemaining();
        Extracted<Boolean> notReady = findAndRemoveCommand("notready", source);
        source = notReady.getRemaining();
        Extracted<Boolean> mathlibOk = findAndRemoveCommand("mathlibok", source);
        source = mathlibOk.getRemaining();
        Extracted<String> lean = findAndRemoveArgument("lean", source);
        source = lean.getRemaining();
        Extracted<String> discussion = findAndRemoveArgument("discussion", source);
        source = discussion.getRemaining();

        DirectiveRecord record = new DirectiveRecord(
                label,
                uses.getValue(),
                alsoIn.getValue(),
                proves.getValue(),
                leanOk.getValue(),
                notReady.getValue(),
                mathlibOk.getValue(),
                lean.getValue(),
                parseDiscussion(discussion.getValue()));
        return new Extracted<>(record, source.strip());
    }

    /**
     * Removes a boolean marker such as {@code \leanok} wherever it occurs.
     */
    public Extracted<Boolean> findAndRemoveCommand(String command, String source) {
        Pattern pattern = Pattern.compile("\\\\" + Pattern.quote(command) + "\\b");
        Matcher matcher = pattern.matcher(source);
        boolean found = matcher.find();
        return new Extracted<>(found, matcher.replaceAll(""));
    }

    /**
     * Collects the comma-separated arguments of every occurrence of the command and
     * removes either all occurrences or only the first one.
     */
    public Extracted<List<String>> findAndRemoveArguments(String command, String source, boolean firstOnly) {
        Matcher matcher = argumentPattern(command).matcher(source);
        List<String> values = new ArrayList<>();
        while (matcher.find()) {
            values.addAll(splitArguments(matcher.group(1)));
        }
        matcher.reset();
        String remaining = firstOnly ? matcher.replaceFirst("") : matcher.replaceAll("");
        return new Extracted<>(values, remaining);
    }

    /**
     * Single-valued variant: keeps the first argument, removes the first occurrence
     * and warns if more than one argument was given.
     */
    public Extracted<String> findAndRemoveArgument(String command, String source) {
        Extracted<List<String>> all = findAndRemoveArguments(command, source, true);
        List<String> values = all.getValue();
        if (values.size() > 1) {
            diagnostics.warn("Multiple \\" + command + " arguments found: "
                    + String.join(", ", values) + "; only using the first one.");
        }
        return new Extracted<>(values.isEmpty() ? null : values.get(0), all.getRemaining());
    }

    /** Arguments of every occurrence of the command, without modifying the source. */
    public static List<String> findArguments(String command, String source) {
        Matcher matcher = argumentPattern(command).matcher(source);
        List<String> values = new ArrayList<>();
        while (matcher.find()) {
            values.addAll(splitArguments(matcher.group(1)));
        }
        return values;
    }

    /** Replaces unescaped {@code ~} with a plain space and trims. */
    public static String removeNonBreakingSpaces(String source) {
        return NON_BREAKING_SPACE.matcher(source).replaceAll(" ").strip();
    }

    static String removeNestedEnvironments(String source) {
        return NESTED_ENVIRONMENT.matcher(source).replaceAll("");
    }

    private static Pattern argumentPattern(String command) {
        return Pattern.compile("\\\\" + Pattern.quote(command) + "\\s*\\{([^}]*)\\}");
    }

    private static List<String> splitArguments(String argument) {
        List<String> values = new ArrayList<>();
        for (String item : argument.split(",")) {
            String value = item.strip();
            if (!value.isEmpty()) {
                values.add(value);
            }
        }
        return values;
    }

    private Integer parseDiscussion(String value) {
        if (value == null) {
            return null;
        }
        try {
            return Integer.valueOf(value);
        } catch (NumberFormatException e) {
            diagnostics.warn("Ignoring non-numeric \\discussion{" + value + "}");
            return null;
        }
    }

    /**
     * A value extracted from a source fragment together with the fragment after removal.
     */
    public static final class Extracted<T> {
        private final T value;
        private final String remaining;

        public Extracted(T value, String remaining) {
            this.value = value;
            this.remaining = remaining;
        }

        public T getValue() {
            return value;
        }

        public String getRemaining() {
            return remaining;
        }
    }
}
