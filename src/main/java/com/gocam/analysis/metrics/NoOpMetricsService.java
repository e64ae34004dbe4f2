package com.gocam.analysis.metrics;

import java.time.Duration;

/**
 * No-op implementation of {@link MetricsService}.
 */
public class NoOpMetricsService implements MetricsService {

    @Override
    public void recordGraphBuild(Duration duration, int nodeCount, int edgeCount) {
    }

    @Override
    public void incrementUnrecognizedEnabler() {
    }

    @Override
    public void recordHolesFound(int count) {
    }

    @Override
    public void recordMerge(int modelCount) {
    }

    @Override
    public void recordBatchFailure() {
    }
}
