package com.gocam.analysis.core.model;

/**
 * Kind of entity carrying out an activity.
 */
public enum EnablerKind {
    GENE("gene"),
    CHEMICAL("chemical"),
    MODIFIED_PROTEIN("modified_protein"),
    COMPLEX("complex");

    private final String label;

    EnablerKind(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }
}
