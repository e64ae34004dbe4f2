package com.gocam.analysis.export;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.gocam.analysis.core.model.Edge;
import com.gocam.analysis.core.model.GoCamGraph;
import com.gocam.analysis.core.model.Node;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.io.Writer;

/**
 * Cytoscape.js elements exporter.
 *
 * <p>Output format:</p>
 * <pre>
 * {
 *   "nodes" : [ { "data" : { "id" : "gomodel:1/a1", "label" : "protein kinase activity" } } ],
 *   "edges" : [ { "data" : { "id" : "f1", "label" : "directly positively regulates",
 *                            "source" : "gomodel:1/a1", "target" : "gomodel:1/a2" } } ]
 * }
 * </pre>
 */
public class CytoscapeExporter implements GraphExporter {
    private static final Logger log = LoggerFactory.getLogger(CytoscapeExporter.class);

    private final ObjectMapper objectMapper;

    public CytoscapeExporter() {
        this(new ObjectMapper()
                .enable(SerializationFeature.INDENT_OUTPUT)
                .configure(JsonGenerator.Feature.AUTO_CLOSE_TARGET, false));
    }

    public CytoscapeExporter(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public ExportResult export(GoCamGraph graph, Writer writer) {
        ObjectNode root = toElements(graph);
        try {
            objectMapper.writeValue(writer, root);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write Cytoscape elements for " + graph.getId(), e);
        }
        ExportResult result = new ExportResult(getFormat(), graph.nodeCount(), graph.edgeCount());
        log.debug("export.completed graphId={} result={}", graph.getId(), result);
        return result;
    }

    /**
     * Builds the element document as a Jackson tree.
     */
    public ObjectNode toElements(GoCamGraph graph) {
        ObjectNode root = objectMapper.createObjectNode();
        ArrayNode nodes = root.putArray("nodes");
        for (Node node : graph.nodes()) {
            ObjectNode data = nodes.addObject().putObject("data");
            data.put("id", GraphExporter.elementId(graph, node.getKey()));
            data.put("label", node.getLabel());
        }
        ArrayNode edges = root.putArray("edges");
        for (Edge edge : graph.getEdges()) {
            ObjectNode data = edges.addObject().putObject("data");
            data.put("id", GraphExporter.elementId(graph, edge));
            data.put("label", edge.relationLabel());
            data.put("source", GraphExporter.elementId(graph, edge.source()));
            data.put("target", GraphExporter.elementId(graph, edge.target()));
        }
        return root;
    }

    @Override
    public String getFormat() {
        return "cytoscape";
    }
}
