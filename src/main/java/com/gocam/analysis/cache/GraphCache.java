package com.gocam.analysis.cache;

import com.gocam.analysis.core.model.GoCamGraph;
import com.gocam.analysis.core.model.GoCamModel;

import java.util.function.Function;

/**
 * Cache of built graphs, keyed by model instance identity.
 */
public interface GraphCache {

    /**
     * Returns the cached graph for a model, building and caching it on a miss.
     *
     * @param model   the parsed model
     * @param builder function building the graph when it is not cached
     */
    GoCamGraph get(GoCamModel model, Function<GoCamModel, GoCamGraph> builder);

    /**
     * Drops the cached graph of one model.
     */
    void invalidate(GoCamModel model);

    /**
     * Drops all cached graphs.
     */
    void invalidateAll();

    /**
     * Returns cache statistics.
     */
    GraphCacheStats getStats();
}
