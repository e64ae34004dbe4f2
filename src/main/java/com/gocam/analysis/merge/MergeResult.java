package com.gocam.analysis.merge;

import com.gocam.analysis.core.model.GoCamGraph;

import java.util.Optional;

/**
 * Result of a model merge: the merged graph, or the reason the merge failed.
 */
public record MergeResult(
        boolean success,
        GoCamGraph graph,
        String errorCode,
        String errorMessage
) {
    /**
     * Error code returned when no graphs were given.
     */
    public static final String EMPTY_MERGE_INPUT = "EMPTY_MERGE_INPUT";

    /**
     * Creates a successful merge result.
     */
    public static MergeResult success(GoCamGraph graph) {
        return new MergeResult(true, graph, null, null);
    }

    /**
     * Creates a failed merge result.
     */
    public static MergeResult failure(String errorCode, String errorMessage) {
        return new MergeResult(false, null, errorCode, errorMessage);
    }

    public boolean isSuccess() {
        return success;
    }

    public boolean isFailure() {
        return !success;
    }

    public Optional<GoCamGraph> getGraph() {
        return Optional.ofNullable(graph);
    }
}
