package com.gocam.analysis.core.model;

import java.util.Objects;

/**
 * Identifying metadata of a model that contributed to a graph.
 */
public record ModelRef(String id, String title, String taxon) {

    public ModelRef {
        Objects.requireNonNull(id, "id is required");
        title = title != null ? title : "";
        taxon = taxon != null ? taxon : "";
    }
}
