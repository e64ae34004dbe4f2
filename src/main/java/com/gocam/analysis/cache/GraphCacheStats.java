package com.gocam.analysis.cache;

/**
 * Counters of a {@link GraphCache}. A miss triggers a graph build, which either
 * yields a graph or fails; failed builds are not cached.
 *
 * @param hitCount       lookups answered with an already built graph
 * @param graphsBuilt    graphs built on a miss
 * @param failedBuilds   builds that threw
 * @param evictionCount  graphs dropped for size or because their model was collected
 * @param cachedGraphs   approximate number of graphs currently held
 * @param totalBuildNanos time spent building graphs, successful or not
 */
public record GraphCacheStats(long hitCount, long graphsBuilt, long failedBuilds, long evictionCount,
                              long cachedGraphs, long totalBuildNanos) {

    /**
     * Stats of a cache that never holds anything.
     */
    public static GraphCacheStats disabled() {
        return new GraphCacheStats(0, 0, 0, 0, 0, 0);
    }

    public long missCount() {
        return graphsBuilt + failedBuilds;
    }

    /**
     * Share of lookups served without building, 0.0 when nothing was looked up.
     */
    public double hitRate() {
        long lookups = hitCount + missCount();
        return lookups == 0 ? 0.0 : (double) hitCount / lookups;
    }

    public double averageBuildNanos() {
        long builds = missCount();
        return builds == 0 ? 0.0 : (double) totalBuildNanos / builds;
    }
}
