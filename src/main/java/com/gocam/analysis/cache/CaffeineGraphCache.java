package com.gocam.analysis.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.stats.CacheStats;
import com.gocam.analysis.core.model.GoCamGraph;
import com.gocam.analysis.core.model.GoCamModel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.function.Function;

/**
 * Caffeine-backed graph cache. Keys are held weakly and compared by identity, so
 * two distinct model instances sharing an id never share a graph, and a model
 * that is no longer referenced drops out of the cache.
 */
public class CaffeineGraphCache implements GraphCache {
    private static final Logger log = LoggerFactory.getLogger(CaffeineGraphCache.class);

    private final Cache<GoCamModel, GoCamGraph> cache;

    public CaffeineGraphCache(CacheConfig config) {
        this.cache = Caffeine.newBuilder()
                .maximumSize(config.maxSize())
                .weakKeys()
                .recordStats()
                .build();
        log.info("CaffeineGraphCache initialized: maxSize={}", config.maxSize());
    }

    @Override
    public GoCamGraph get(GoCamModel model, Function<GoCamModel, GoCamGraph> builder) {
        return cache.get(model, builder);
    }

    @Override
    public void invalidate(GoCamModel model) {
        cache.invalidate(model);
        log.debug("Invalidated cached graph for model {}", model.getId());
    }

    @Override
    public void invalidateAll() {
        cache.invalidateAll();
        log.debug("Invalidated all cached graphs");
    }

    @Override
    public GraphCacheStats getStats() {
        CacheStats stats = cache.stats();
        return new GraphCacheStats(
                stats.hitCount(),
                stats.loadSuccessCount(),
                stats.loadFailureCount(),
                stats.evictionCount(),
                cache.estimatedSize(),
                stats.totalLoadTime()
        );
    }
}
