package com.gocam.analysis.export;

import com.gocam.analysis.core.model.Edge;
import com.gocam.analysis.core.model.GoCamGraph;
import com.gocam.analysis.core.model.NodeKey;

import java.io.StringWriter;
import java.io.Writer;

/**
 * Interface for graph exports. Implementations render a read-only projection of
 * a graph in a specific visualization format.
 */
public interface GraphExporter {

    /**
     * Writes the graph to a writer.
     *
     * @throws java.io.UncheckedIOException if the writer fails
     */
    ExportResult export(GoCamGraph graph, Writer writer);

    /**
     * Returns the format produced by this exporter (e.g., "cytoscape", "dot").
     */
    String getFormat();

    default String exportToString(GoCamGraph graph) {
        StringWriter writer = new StringWriter();
        export(graph, writer);
        return writer.toString();
    }

    /**
     * Element id of a node: the individual id, prefixed with the originating
     * model id in merged graphs.
     */
    static String elementId(GoCamGraph graph, NodeKey key) {
        return graph.isMerged() ? key.toString() : key.individualId();
    }

    /**
     * Element id of an edge: the fact id, prefixed with the originating model id
     * of its source in merged graphs.
     */
    static String elementId(GoCamGraph graph, Edge edge) {
        return graph.isMerged() ? edge.source().modelId() + "/" + edge.factId() : edge.factId();
    }
}
