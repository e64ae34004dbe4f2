package com.gocam.analysis.export;

import com.gocam.analysis.core.model.Edge;
import com.gocam.analysis.core.model.GoCamGraph;
import com.gocam.analysis.core.model.Node;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.io.Writer;

/**
 * GraphViz DOT exporter. Nodes are labeled by their enabler when they have one,
 * edges by their relation label.
 *
 * <p>Output format:</p>
 * <pre>
 * digraph "model title" {
 *   "gomodel:1/a1" [label="cdc2"];
 *   "gomodel:1/a1" -> "gomodel:1/a2" [label="directly positively regulates"];
 * }
 * </pre>
 */
public class DotExporter implements GraphExporter {
    private static final Logger log = LoggerFactory.getLogger(DotExporter.class);

    @Override
    public ExportResult export(GoCamGraph graph, Writer writer) {
        BufferedWriter out = new BufferedWriter(writer);
        try {
            out.write("digraph " + quote(graph.getTitle().isEmpty() ? graph.getId() : graph.getTitle()) + " {");
            out.newLine();
            for (Node node : graph.nodes()) {
                out.write("  " + quote(GraphExporter.elementId(graph, node.getKey()))
                        + " [label=" + quote(node.displayLabel()) + "];");
                out.newLine();
            }
            for (Edge edge : graph.getEdges()) {
                out.write("  " + quote(GraphExporter.elementId(graph, edge.source()))
                        + " -> " + quote(GraphExporter.elementId(graph, edge.target()))
                        + " [label=" + quote(edge.relationLabel()) + "];");
                out.newLine();
            }
            out.write("}");
            out.newLine();
            out.flush();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write DOT graph for " + graph.getId(), e);
        }
        ExportResult result = new ExportResult(getFormat(), graph.nodeCount(), graph.edgeCount());
        log.debug("export.completed graphId={} result={}", graph.getId(), result);
        return result;
    }

    @Override
    public String getFormat() {
        return "dot";
    }

    /**
     * Quotes a DOT id, escaping backslashes, quotes and line breaks.
     */
    static String quote(String value) {
        if (value == null) {
            return "\"\"";
        }
        StringBuilder sb = new StringBuilder(value.length() + 2);
        sb.append('"');
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            switch (c) {
                case '"' -> sb.append("\\\"");
                case '\\' -> sb.append("\\\\");
                case '\n' -> sb.append("\\n");
                case '\r' -> {
                    // dropped, \n already carries the line break
                }
                default -> sb.append(c);
            }
        }
        sb.append('"');
        return sb.toString();
    }
}
