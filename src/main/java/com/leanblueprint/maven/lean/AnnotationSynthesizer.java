package com.leanblueprint.maven.lean;

import java.util.ArrayList;
import java.util.List;
import java.util.function.BiFunction;
import java.util.function.BiPredicate;

import com.leanblueprint.maven.graph.Node;
import com.leanblueprint.maven.graph.NodePart;

/**
 * Renders the {@code blueprint} attribute of a node.
 * <p>
 * The attribute is {@code blueprint} followed by one {@code (option := value)}
 * line per included field. Fields are evaluated in a fixed order: title,
 * statement, uses, proof, proofUses, notReady, discussion, latexEnv.
 */
public final class AnnotationSynthesizer {

    public static final String ATTRIBUTE_NAME = "blueprint";
    private static final String DEFINITION_ENV = "definition";
    private static final String THEOREM_ENV = "theorem";
    private static final String SORRY = "sorry";

    private static final List<Field> FIELDS = List.of(
            new Field((node, options) -> node.getTitle() != null && !node.getTitle().isEmpty(),
                    (node, options) -> Docstrings.quote(node.getTitle())),
            new Field((node, options) -> options.isStatementText() && !node.getStatement().getText().isBlank(),
                    (node, options) -> "(statement := "
                            + Docstrings.makeDocstring(node.getStatement().getText(), 2) + ")"),
            new Field((node, options) -> !usesList(node.getStatement(), options.isUses(), options.isUsesRaw()).isEmpty(),
                    (node, options) -> "(uses := ["
                            + String.join(", ", usesList(node.getStatement(), options.isUses(), options.isUsesRaw())) + "])"),
            new Field((node, options) -> node.hasProof() && options.isProofText() && !node.getProof().getText().isBlank(),
                    (node, options) -> "(proof := " + Docstrings.makeDocstring(node.getProof().getText(), 2) + ")"),
            new Field((node, options) -> node.hasProof()
                            && !usesList(node.getProof(), options.isProofUses(), options.isProofUsesRaw()).isEmpty(),
                    (node, options) -> "(proofUses := ["
                            + String.join(", ", usesList(node.getProof(), options.isProofUses(), options.isProofUsesRaw())) + "])"),
            new Field((node, options) -> node.isNotReady(),
                    (node, options) -> "(notReady := true)"),
            new Field((node, options) -> node.getDiscussion() != null && node.getDiscussion() > 0,
                    (node, options) -> "(discussion := " + node.getDiscussion() + ")"),
            new Field((node, options) -> !defaultEnv(node).equals(node.getStatement().getLatexEnv()),
                    (node, options) -> "(latexEnv := " + Docstrings.quote(node.getStatement().getLatexEnv()) + ")"));

    public static String render(Node node) {
        return render(node, AttributeOptions.ALL);
    }

    public static String render(Node node, AttributeOptions options) {
        StringBuilder sb = new StringBuilder(ATTRIBUTE_NAME);
        for (String config : renderFields(node, options)) {
            sb.append("\n  ").append(config);
        }
        return sb.toString();
    }

    /** The included configuration lines, in field order. */
    public static List<String> renderFields(Node node, AttributeOptions options) {
        List<String> configs = new ArrayList<>();
        for (Field field : FIELDS) {
            if (field.include.test(node, options)) {
                configs.add(field.render.apply(node, options));
            }
        }
        return configs;
    }

    /**
     * Options for a node whose Lean declaration text is {@code declaration}.
     * <p>
     * The statement text is left out since it becomes the docstring. A {@code sorry}
     * in the declaration means Lean cannot infer the dependencies, so uses are
     * written explicitly; raw uses are always written when present.
     */
    public static AttributeOptions forDeclaration(Node node, String declaration, boolean forceUses) {
        boolean hasSorry = declaration.contains(SORRY);
        boolean uses = forceUses || (!node.hasProof() && hasSorry);
        boolean usesRaw = uses || !node.getStatement().getUsesRaw().isEmpty();
        boolean proofUses = uses || (node.hasProof() && hasSorry);
        boolean proofUsesRaw = uses || (node.hasProof() && !node.getProof().getUsesRaw().isEmpty());
        return new AttributeOptions(false, uses, usesRaw, true, proofUses, proofUsesRaw);
    }

    private static String defaultEnv(Node node) {
        return node.hasProof() ? THEOREM_ENV : DEFINITION_ENV;
    }

    private static List<String> usesList(NodePart part, boolean resolved, boolean raw) {
        List<String> values = new ArrayList<>();
        if (resolved) {
            values.addAll(part.getUses());
        }
        if (raw) {
            for (String use : part.getUsesRaw()) {
                values.add(Docstrings.quote(use));
            }
        }
        return values;
    }

    private static final class Field {
        final BiPredicate<Node, AttributeOptions> include;
        final BiFunction<Node, AttributeOptions, String> render;

        Field(BiPredicate<Node, AttributeOptions> include, BiFunction<Node, AttributeOptions, String> render) {
            this.include = include;
            this.render = render;
        }
    }

    private AnnotationSynthesizer() {
    }
}
