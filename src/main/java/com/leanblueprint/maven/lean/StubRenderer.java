package com.leanblueprint.maven.lean;

import java.io.IOException;
import java.util.HashMap;
import java.util.Map;

import com.leanblueprint.maven.graph.NodeWithPosition;
import com.leanblueprint.maven.template.TemplateEngine;

/**
 * Renders stand-in Lean source for nodes that have no declaration in the target modules.
 * <p>
 * A node declared elsewhere (upstream) becomes {@code attribute [blueprint ...] name}.
 * A node with no Lean declaration at all becomes a {@code def} or {@code theorem}
 * placeholder whose body is {@code sorry_using [...]} over its dependencies.
 */
public class StubRenderer {

    static final String UPSTREAM_TEMPLATE = "upstream.lean.mustache";
    static final String INFORMAL_DEFINITION_TEMPLATE = "informal-definition.lean.mustache";
    static final String INFORMAL_THEOREM_TEMPLATE = "informal-theorem.lean.mustache";

    // Dependencies go into sorry_using, so only the raw ones need to be in the attribute
    private static final AttributeOptions INFORMAL_OPTIONS =
            new AttributeOptions(false, false, true, false, false, true);

    private final TemplateEngine templateEngine;

    public StubRenderer(TemplateEngine templateEngine) {
        this.templateEngine = templateEngine;
    }

    public String render(NodeWithPosition node) throws IOException {
        Map<String, Object> context = new HashMap<>();
        context.put("name", node.getName());

        if (node.getLocation() != null) {
            context.put("attribute", AnnotationSynthesizer.render(node));
            return templateEngine.render(UPSTREAM_TEMPLATE, context);
        }

        String statementText = node.getStatement().getText();
        context.put("docstring", statementText.isBlank() ? "" : Docstrings.makeDocstring(statementText) + "\n");
        context.put("attribute", AnnotationSynthesizer.render(node, INFORMAL_OPTIONS));
        context.put("uses", String.join(", ", node.getStatement().allUses()));

        if (!node.hasProof()) {
            return templateEngine.render(INFORMAL_DEFINITION_TEMPLATE, context);
        }
        String proofText = node.getProof().getText();
        context.put("proofDocstring", proofText.isBlank() ? "" : "  " + Docstrings.makeDocstring(proofText, 2) + "\n");
        context.put("proofUses", String.join(", ", node.getProof().allUses()));
        return templateEngine.render(INFORMAL_THEOREM_TEMPLATE, context);
    }
}
