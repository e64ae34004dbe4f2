package com.gocam.analysis.core.model;

/**
 * Variant tag of a graph node.
 */
public enum NodeKind {
    UNKNOWN("unknown"),
    CHEMICAL("chemical"),
    UNKNOWN_MRNA("unknown_mrna"),
    MRNA("mrna"),
    GENE("gene"),
    MODIFIED_PROTEIN("modified_protein"),
    ACTIVITY("activity");

    private final String label;

    NodeKind(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }
}
