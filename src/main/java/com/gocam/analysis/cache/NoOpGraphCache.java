package com.gocam.analysis.cache;

import com.gocam.analysis.core.model.GoCamGraph;
import com.gocam.analysis.core.model.GoCamModel;

import java.util.function.Function;

/**
 * Cache that never stores anything; every lookup builds the graph.
 * Used when caching is disabled.
 */
public class NoOpGraphCache implements GraphCache {

    @Override
    public GoCamGraph get(GoCamModel model, Function<GoCamModel, GoCamGraph> builder) {
        return builder.apply(model);
    }

    @Override
    public void invalidate(GoCamModel model) {
        // no-op
    }

    @Override
    public void invalidateAll() {
        // no-op
    }

    @Override
    public GraphCacheStats getStats() {
        return GraphCacheStats.disabled();
    }
}
