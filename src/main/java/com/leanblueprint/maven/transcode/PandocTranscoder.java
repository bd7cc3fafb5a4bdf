package com.leanblueprint.maven.transcode;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.leanblueprint.maven.ExternalCommand;

/**
 * LaTeX to Markdown conversion through pandoc, with fix-ups before and after the call.
 * <p>
 * Before: every citation command variant becomes {@code \cite}. After: paragraph
 * breaks before {@code \end} are removed (pandoc issue 11257), links pandoc made
 * from unresolved {@code \ref} go back to {@code \ref{label}}, and citations
 * {@code [@a; @b text]} become {@code [a] [b], text}.
 */
public class PandocTranscoder implements ProseTranscoder {

    // Pandoc's Markdown without raw HTML and attribute syntax
    static final String MARKDOWN_FORMAT =
            "markdown-raw_html-raw_attribute-bracketed_spans-native_divs-native_spans-link_attributes";

    // Citation commands recognized by pandoc's LaTeX reader
    private static final List<String> CITE_COMMANDS = List.of(
            "cite", "Cite", "citep", "citep*", "citeal", "citealp", "citealp*", "autocite", "smartcite",
            "footcite", "parencite", "supercite", "footcitetext", "citeyearpar", "citeyear", "autocite*",
            "cite*", "parencite*", "textcite", "citet", "citet*", "citealt", "citealt*", "textcites", "cites",
            "autocites", "footcites", "parencites", "supercites", "footcitetexts", "Autocite", "Smartcite",
            "Footcite", "Parencite", "Supercite", "Footcitetext", "Citeyearpar", "Citeyear", "Autocite*",
            "Cite*", "Parencite*", "Textcite", "Textcites", "Cites", "Autocites", "Footcites", "Parencites",
            "Supercites", "Footcitetexts", "citetext", "citeauthor", "nocite");

    private static final Pattern CITE_PATTERN = citePattern();
    private static final Pattern BREAK_BEFORE_END = Pattern.compile("\\s*\\n\\s*\\\\end\\s*\\{(.*?)\\}");
    private static final Pattern REF_LINK = Pattern.compile("\\[\\\\\\[(.*?)\\\\\\]\\]\\(#\\1\\)");
    private static final Pattern CITATION = Pattern.compile("\\[((?:@[^\\s;]+)(?:;\\s*@[^\\s;]+)*)(.*?)\\]");

    private final List<String> command;
    private final int columns;
    private final Path workingDir;

    public PandocTranscoder(List<String> command, int columns, Path workingDir) {
        this.command = List.copyOf(command);
        this.columns = columns;
        this.workingDir = workingDir;
    }

    @Override
    public String convert(String latex) throws IOException {
        List<String> fullCommand = new ArrayList<>(command);
        fullCommand.add("-f");
        fullCommand.add("latex");
        fullCommand.add("-t");
        fullCommand.add(MARKDOWN_FORMAT);
        fullCommand.add("--columns=" + columns);
        String converted = ExternalCommand.run(fullCommand, workingDir, preprocess(latex));
        return postprocess(converted);
    }

    public static String preprocess(String latex) {
        Matcher matcher = CITE_PATTERN.matcher(latex);
        StringBuilder sb = new StringBuilder();
        while (matcher.find()) {
            String options = matcher.group(1) == null ? "" : matcher.group(1);
            matcher.appendReplacement(sb, Matcher.quoteReplacement("\\cite" + options + "{" + matcher.group(2) + "}"));
        }
        matcher.appendTail(sb);
        return sb.toString();
    }

    public static String postprocess(String markdown) {
        String converted = BREAK_BEFORE_END.matcher(markdown).replaceAll("\n\\\\end{$1}");
        converted = REF_LINK.matcher(converted).replaceAll("\\\\ref{$1}");

        Matcher matcher = CITATION.matcher(converted);
        StringBuilder sb = new StringBuilder();
        while (matcher.find()) {
            List<String> tags = new ArrayList<>();
            for (String part : matcher.group(1).split(";")) {
                String key = part.strip();
                tags.add("[" + (key.startsWith("@") ? key.substring(1) : key) + "]");
            }
            String rest = matcher.group(2).strip();
            String replacement = String.join(" ", tags) + (rest.isEmpty() ? "" : ", " + rest);
            matcher.appendReplacement(sb, Matcher.quoteReplacement(replacement));
        }
        matcher.appendTail(sb);
        return sb.toString().strip();
    }

    private static Pattern citePattern() {
        List<String> alternatives = new ArrayList<>();
        for (String cite : CITE_COMMANDS) {
            alternatives.add(Pattern.quote(cite));
        }
        return Pattern.compile("\\\\(?:" + String.join("|", alternatives) + ")\\s*(\\[.*?\\])?\\s*\\{(.*?)\\}");
    }
}
