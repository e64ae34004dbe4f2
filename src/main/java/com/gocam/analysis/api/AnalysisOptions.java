package com.gocam.analysis.api;

import com.gocam.analysis.cache.CacheConfig;
import com.gocam.analysis.classify.EnablerPrefixTable;
import com.gocam.analysis.graph.ConflictPolicy;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Options for graph construction and batch analysis.
 */
public class AnalysisOptions {

    private static final int DEFAULT_PARALLELISM = 1;

    private final ConflictPolicy conflictPolicy;
    private final List<String> extraGenePrefixes;
    private final boolean includeParticipants;
    private final int parallelism;
    private final CacheConfig cacheConfig;

    private AnalysisOptions(Builder builder) {
        this.conflictPolicy = builder.conflictPolicy;
        this.extraGenePrefixes = List.copyOf(builder.extraGenePrefixes);
        this.includeParticipants = builder.includeParticipants;
        this.parallelism = builder.parallelism;
        this.cacheConfig = builder.cacheConfig;
    }

    public ConflictPolicy getConflictPolicy() {
        return conflictPolicy;
    }

    public List<String> getExtraGenePrefixes() {
        return extraGenePrefixes;
    }

    public boolean isIncludeParticipants() {
        return includeParticipants;
    }

    public int getParallelism() {
        return parallelism;
    }

    public CacheConfig getCacheConfig() {
        return cacheConfig;
    }

    /**
     * Builds the enabler prefix table: the default rows plus any extra gene namespaces.
     */
    public EnablerPrefixTable prefixTable() {
        return EnablerPrefixTable.builder()
                .genePrefixes(extraGenePrefixes)
                .build();
    }

    /**
     * Creates default options.
     */
    public static AnalysisOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private ConflictPolicy conflictPolicy = ConflictPolicy.FIRST_WINS;
        private final List<String> extraGenePrefixes = new ArrayList<>();
        private boolean includeParticipants = false;
        private int parallelism = DEFAULT_PARALLELISM;
        private CacheConfig cacheConfig = CacheConfig.defaults();

        public Builder conflictPolicy(ConflictPolicy conflictPolicy) {
            this.conflictPolicy = Objects.requireNonNull(conflictPolicy, "conflictPolicy is required");
            return this;
        }

        public Builder genePrefix(String prefix) {
            this.extraGenePrefixes.add(Objects.requireNonNull(prefix, "prefix is required"));
            return this;
        }

        public Builder includeParticipants(boolean includeParticipants) {
            this.includeParticipants = includeParticipants;
            return this;
        }

        public Builder parallelism(int parallelism) {
            this.parallelism = parallelism;
            return this;
        }

        public Builder cacheConfig(CacheConfig cacheConfig) {
            this.cacheConfig = Objects.requireNonNull(cacheConfig, "cacheConfig is required");
            return this;
        }

        public AnalysisOptions build() {
            if (parallelism <= 0) {
                throw new IllegalArgumentException("parallelism must be > 0");
            }
            return new AnalysisOptions(this);
        }
    }
}
