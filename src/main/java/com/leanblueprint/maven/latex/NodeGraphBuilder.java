package com.leanblueprint.maven.latex;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.function.Supplier;
import java.util.regex.MatchResult;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

import com.leanblueprint.maven.Diagnostics;
import com.leanblueprint.maven.graph.Node;
import com.leanblueprint.maven.graph.NodeGraph;
import com.leanblueprint.maven.graph.NodePart;
import com.leanblueprint.maven.graph.SourceSpan;

/**
 * Scans a flattened blueprint for statement and proof environments and builds
 * the node graph.
 * <p>
 * Statements are parsed first, in document order. Proofs are then attached to
 * the statement named by {@code \proves}, or else to the environment that
 * immediately precedes them. Environments on a line commented out with
 * {@code %} are ignored.
 */
public class NodeGraphBuilder {

    public static final List<String> DEFAULT_STATEMENT_KINDS =
            List.of("definition", "lemma", "proposition", "theorem", "corollary");

    public static final String PROOF_KIND = "proof";

    // usepackage option [thms=definition+lemma+...]{blueprint}
    private static final Pattern THMS_OPTION = Pattern.compile(
            "\\\\usepackage\\s*\\[[^\\]]*\\bthms\\s*=\\s*([^,\\]}]*)");

    private final Diagnostics diagnostics;
    private final DirectiveExtractor extractor;
    private final boolean convertInformal;
    private final Supplier<String> randomSuffix;

    public NodeGraphBuilder(Diagnostics diagnostics, boolean convertInformal) {
        this(diagnostics, convertInformal, () -> UUID.randomUUID().toString().replace("-", ""));
    }

    public NodeGraphBuilder(Diagnostics diagnostics, boolean convertInformal, Supplier<String> randomSuffix) {
        this.diagnostics = diagnostics;
        this.extractor = new DirectiveExtractor(diagnostics);
        this.convertInformal = convertInformal;
        this.randomSuffix = randomSuffix;
    }

    public NodeGraph build(String source) {
        List<String> statementKinds = statementKinds(source);
        List<MatchResult> matches = environmentPattern(statementKinds).matcher(source).results()
                .collect(Collectors.toList());

        NodeGraph graph = new NodeGraph();
        Map<Integer, Node> nodeAtMatch = new HashMap<>();
        // Statements without a Lean name while informal conversion is off
        Set<Integer> skippedMatches = new HashSet<>();

        for (int i = 0; i < matches.size(); i++) {
            MatchResult match = matches.get(i);
            String env = match.group(1);
            if (!statementKinds.contains(env) || isCommentedOut(source, match.start())) {
                continue;
            }

            DirectiveExtractor.Extracted<DirectiveRecord> extracted = extractor.extract(match.group(3));
            DirectiveRecord directives = extracted.getValue();

            String name;
            if (directives.getLean() != null) {
                name = directives.getLean();
                if (directives.getLabel() == null) {
                    diagnostics.warn("Did not find a LaTeX label for " + name);
                }
            } else if (!convertInformal) {
                skippedMatches.add(i);
                continue;
            } else {
                name = generateName(graph, directives.getLabel());
            }
            graph.addRawSource(name, span(match));

            Node node;
            if (graph.containsName(name)) {
                diagnostics.warn("Lean name \"" + name + "\" occurs in blueprint multiple times; only keeping the first.");
                node = graph.getByName(name);
            } else {
                NodePart statement = new NodePart(
                        directives.isLeanOk(), extracted.getRemaining(), directives.getUses(), env);
                node = graph.addIfAbsent(new Node(
                        name, statement, directives.isNotReady(), directives.getDiscussion(), match.group(2)));
            }

            nodeAtMatch.put(i, node);
            if (directives.getLabel() != null) {
                graph.putLabel(directives.getLabel(), node);
            }
        }

        for (int i = 0; i < matches.size(); i++) {
            MatchResult match = matches.get(i);
            if (!PROOF_KIND.equals(match.group(1)) || isCommentedOut(source, match.start())) {
                continue;
            }

            DirectiveExtractor.Extracted<DirectiveRecord> extracted = extractor.extract(match.group(3));
            DirectiveRecord directives = extracted.getValue();

            Node proved;
            if (directives.getProves() != null) {
                proved = graph.getByLabel(directives.getProves());
                if (proved == null) {
                    diagnostics.warn("\\proves{" + directives.getProves() + "} does not name a known statement; "
                            + "dropping proof: " + abbreviate(extracted.getRemaining()));
                    continue;
                }
            } else if (nodeAtMatch.containsKey(i - 1)) {
                proved = nodeAtMatch.get(i - 1);
            } else if (skippedMatches.contains(i - 1)) {
                continue;
            } else {
                diagnostics.warn("Cannot determine the statement proved by: " + abbreviate(extracted.getRemaining()));
                continue;
            }

            proved.setProof(new NodePart(
                    directives.isLeanOk(), extracted.getRemaining(), directives.getUses(), PROOF_KIND));
            graph.addRawSource(proved.getName(), span(match));
        }

        return graph;
    }

    /**
     * Statement environment kinds from the {@code thms=} package option, or the default five.
     */
    public static List<String> statementKinds(String source) {
        Matcher matcher = THMS_OPTION.matcher(source);
        if (!matcher.find()) {
            return DEFAULT_STATEMENT_KINDS;
        }
        return Arrays.stream(matcher.group(1).strip().split("\\+"))
                .map(String::strip)
                .filter(kind -> !kind.isEmpty())
                .collect(Collectors.toList());
    }

    static Pattern environmentPattern(List<String> statementKinds) {
        List<String> kinds = new ArrayList<>();
        for (String kind : statementKinds) {
            kinds.add(Pattern.quote(kind));
        }
        kinds.add(PROOF_KIND);
        return Pattern.compile(
                "\\\\begin\\s*\\{(" + String.join("|", kinds) + ")\\}\\s*(?:\\[(.*?)\\])?(.*?)\\\\end\\s*\\{\\1\\}",
                Pattern.DOTALL);
    }

    private static SourceSpan span(MatchResult match) {
        return new SourceSpan(match.start(), match.end(), match.group(0));
    }

    private static boolean isCommentedOut(String source, int start) {
        int lineStart = source.lastIndexOf('\n', start - 1) + 1;
        return source.substring(lineStart, start).contains("%");
    }

    /**
     * Derives a fresh Lean identifier from a LaTeX label such as {@code thm:main-result}.
     * Falls back to a random name when there is no label and appends a random suffix
     * when the derived name is empty or taken.
     */
    String generateName(NodeGraph graph, String label) {
        String base;
        if (label == null) {
            base = "node_" + randomSuffix.get();
        } else {
            base = label.substring(label.lastIndexOf(':') + 1).replace('-', '_').replace(' ', '_');
            if (!base.isEmpty() && Character.isDigit(base.charAt(0))) {
                base = "_" + base;
            }
        }
        if (!base.isEmpty() && !graph.containsName(base)) {
            return base;
        }
        return generateName(graph, base + "_" + randomSuffix.get());
    }

    private static String abbreviate(String text) {
        return text.length() > 200 ? text.substring(0, 200) + "..." : text;
    }
}
