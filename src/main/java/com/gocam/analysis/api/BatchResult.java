package com.gocam.analysis.api;

import com.gocam.analysis.core.model.GoCamGraph;
import com.gocam.analysis.core.model.GoCamModel;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Result of loading a batch of model sources: the models that were built, in
 * source order, and the sources that failed.
 */
public record BatchResult(List<Loaded> loaded, List<Failure> failures) {

    public BatchResult {
        loaded = loaded != null ? List.copyOf(loaded) : List.of();
        failures = failures != null ? List.copyOf(failures) : List.of();
    }

    public List<GoCamModel> models() {
        return loaded.stream().map(Loaded::model).collect(Collectors.toList());
    }

    public List<GoCamGraph> graphs() {
        return loaded.stream().map(Loaded::graph).collect(Collectors.toList());
    }

    /**
     * Returns true if every source loaded.
     */
    public boolean isSuccess() {
        return failures.isEmpty();
    }

    public boolean hasErrors() {
        return !failures.isEmpty();
    }

    /**
     * A source that parsed and built.
     */
    public record Loaded(String sourceName, GoCamModel model, GoCamGraph graph) {}

    /**
     * A source that could not be read or parsed.
     */
    public record Failure(String sourceName, String message) {}

    @Override
    public String toString() {
        return "BatchResult{loaded=" + loaded.size() +
                ", failures=" + failures.size() + '}';
    }
}
