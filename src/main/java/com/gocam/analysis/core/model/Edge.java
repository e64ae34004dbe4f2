package com.gocam.analysis.core.model;

import java.util.Objects;

/**
 * Directed relation between two graph nodes, derived from one fact.
 */
public record Edge(String factId, String relationId, String relationLabel, NodeKey source, NodeKey target) {

    public Edge {
        Objects.requireNonNull(factId, "factId is required");
        Objects.requireNonNull(source, "source is required");
        Objects.requireNonNull(target, "target is required");
        relationId = relationId != null ? relationId : "";
        relationLabel = relationLabel != null ? relationLabel : "";
    }
}
