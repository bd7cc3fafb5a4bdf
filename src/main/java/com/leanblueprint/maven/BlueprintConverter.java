package com.leanblueprint.maven;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import org.apache.maven.plugin.logging.Log;

import com.leanblueprint.maven.config.ConversionConfig;
import com.leanblueprint.maven.graph.Node;
import com.leanblueprint.maven.graph.NodeGraph;
import com.leanblueprint.maven.graph.NodeWithPosition;
import com.leanblueprint.maven.latex.FlattenedDocument;
import com.leanblueprint.maven.latex.IncludeResolver;
import com.leanblueprint.maven.latex.LabelResolver;
import com.leanblueprint.maven.latex.LatexSourceWriter;
import com.leanblueprint.maven.latex.NodeGraphBuilder;
import com.leanblueprint.maven.lean.LeanSourceWriter;
import com.leanblueprint.maven.lean.PlacementPlanner;
import com.leanblueprint.maven.lean.StubRenderer;
import com.leanblueprint.maven.position.NodeJson;
import com.leanblueprint.maven.position.PositionLookup;
import com.leanblueprint.maven.transcode.ProseTranscoder;

/**
 * The conversion pipeline: read the blueprint, build and resolve the node graph,
 * look up Lean positions, transcode prose, write Lean attributes and replace the
 * converted LaTeX environments. Runs sequentially; the first I/O failure aborts.
 */
public class BlueprintConverter {

    private final Diagnostics diagnostics;
    private final ConversionConfig config;
    private final PositionLookup positionLookup;
    private final ProseTranscoder transcoder;
    private final StubRenderer stubRenderer;

    public BlueprintConverter(Diagnostics diagnostics, ConversionConfig config, PositionLookup positionLookup,
            ProseTranscoder transcoder, StubRenderer stubRenderer) {
        this.diagnostics = diagnostics;
        this.config = config;
        this.positionLookup = positionLookup;
        this.transcoder = transcoder;
        this.stubRenderer = stubRenderer;
    }

    /**
     * Reads the blueprint starting at {@code rootFile} and returns its resolved node graph.
     */
    public NodeGraph parse(Path rootFile, boolean convertInformal) throws IOException {
        return parse(read(rootFile), convertInformal);
    }

    FlattenedDocument read(Path rootFile) throws IOException {
        Log log = diagnostics.getLog();
        log.info("Blueprint: Reading LaTeX file " + rootFile);
        FlattenedDocument document = new IncludeResolver(diagnostics).resolve(rootFile);

        List<String> bibliography = IncludeResolver.bibliographyFiles(document.getText());
        if (!bibliography.isEmpty()) {
            log.debug("Bibliography files: " + String.join(", ", bibliography));
        }
        return document;
    }

    NodeGraph parse(FlattenedDocument document, boolean convertInformal) {
        Log log = diagnostics.getLog();
        log.info("Blueprint: Parsing nodes");
        NodeGraph graph = new NodeGraphBuilder(diagnostics, convertInformal).build(document.getText());
        new LabelResolver(graph.getLabelIndex()).resolve(graph);
        log.info("Blueprint: Found " + graph.getNodes().size() + " node(s)");
        return graph;
    }

    public ConversionResult convert(ConversionRequest request) throws IOException {
        Log log = diagnostics.getLog();
        Path rootFile = request.getBlueprintRoot().resolve(request.getRootFileName());
        FlattenedDocument document = read(rootFile);
        NodeGraph graph = parse(document, request.isConvertInformal());

        List<Node> nodes = new ArrayList<>();
        for (Node node : graph.getNodes()) {
            if (request.getNodeFilter().isEmpty() || request.getNodeFilter().contains(node.getName())) {
                nodes.add(node);
            }
        }

        log.info("Blueprint: Adding position information for modules " + String.join(", ", request.getModules()));
        String positionsJson = positionLookup.lookup(NodeJson.write(nodes), request.getModules());
        if (request.isExtractOnly()) {
            return new ConversionResult(nodes.size(), positionsJson, Set.of(), Set.of(), 0,
                    diagnostics.getWarnings());
        }
        List<NodeWithPosition> located = NodeJson.readWithPosition(positionsJson);

        log.info("Blueprint: Converting LaTeX to Markdown");
        for (NodeWithPosition node : located) {
            transcoder.convertNode(node);
        }

        log.info("Blueprint: Writing @[blueprint] attributes to Lean files");
        PlacementPlanner.Plan plan = new PlacementPlanner(request.getModules(), stubRenderer).plan(located);
        Set<Path> leanFiles = new LeanSourceWriter(diagnostics, config.getImportLine())
                .write(plan, request.getProjectDir(), request.getOverflowFile(), request.isAddUses());

        log.info("Blueprint: Replacing LaTeX environments with \\" + config.getNodeInputCommand());
        Set<Path> latexFiles = new LatexSourceWriter(diagnostics, config.getNodeInputCommand())
                .write(document, located, graph.getRawSources());

        return new ConversionResult(located.size(), null, leanFiles, latexFiles, plan.getOverflow().size(),
                diagnostics.getWarnings());
    }
}
