package com.gocam.analysis.cache;

/**
 * Configuration for the built-graph cache.
 *
 * @param maxSize maximum number of cached graphs
 * @param enabled whether caching is enabled
 */
public record CacheConfig(int maxSize, boolean enabled) {

    public CacheConfig {
        if (maxSize <= 0) {
            throw new IllegalArgumentException("maxSize must be > 0");
        }
    }

    /**
     * Default cache configuration: 1,000 graphs, enabled.
     */
    public static CacheConfig defaults() {
        return new CacheConfig(1_000, true);
    }

    /**
     * Disabled cache configuration.
     */
    public static CacheConfig disabled() {
        return new CacheConfig(1, false);
    }
}
