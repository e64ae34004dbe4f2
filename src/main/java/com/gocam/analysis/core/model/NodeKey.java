package com.gocam.analysis.core.model;

import java.util.Objects;

/**
 * Storage key of a graph node: the originating model id plus the individual id
 * within that model. Two keys being different says nothing about whether the
 * nodes denote the same biological entity; that is decided by overlap detection.
 */
public record NodeKey(String modelId, String individualId) {

    public NodeKey {
        Objects.requireNonNull(modelId, "modelId is required");
        Objects.requireNonNull(individualId, "individualId is required");
    }

    @Override
    public String toString() {
        return modelId + "/" + individualId;
    }
}
