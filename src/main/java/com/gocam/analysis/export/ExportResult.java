package com.gocam.analysis.export;

/**
 * Result of a graph export.
 *
 * @param format        format written, e.g. "cytoscape" or "dot"
 * @param nodesExported number of nodes written
 * @param edgesExported number of edges written
 */
public record ExportResult(String format, int nodesExported, int edgesExported) {
    @Override
    public String toString() {
        return "ExportResult{format=" + format +
                ", nodes=" + nodesExported +
                ", edges=" + edgesExported + '}';
    }
}
