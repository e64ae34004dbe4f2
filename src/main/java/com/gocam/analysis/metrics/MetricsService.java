package com.gocam.analysis.metrics;

import java.time.Duration;

/**
 * Interface for recording analysis metrics.
 * The default {@link NoOpMetricsService} does nothing; {@link MicrometerMetricsService}
 * publishes to a Micrometer registry.
 */
public interface MetricsService {

    void recordGraphBuild(Duration duration, int nodeCount, int edgeCount);

    void incrementUnrecognizedEnabler();

    void recordHolesFound(int count);

    void recordMerge(int modelCount);

    void recordBatchFailure();
}
