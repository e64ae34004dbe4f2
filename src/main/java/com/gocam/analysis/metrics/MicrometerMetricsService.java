package com.gocam.analysis.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;

/**
 * Micrometer-based implementation of {@link MetricsService}.
 *
 * <p>Recorded metrics:</p>
 * <ul>
 *   <li>{@code gocam.graph.build.duration} - Timer</li>
 *   <li>{@code gocam.graph.nodes} - DistributionSummary</li>
 *   <li>{@code gocam.graph.edges} - DistributionSummary</li>
 *   <li>{@code gocam.enabler.unrecognized} - Counter</li>
 *   <li>{@code gocam.holes} - DistributionSummary</li>
 *   <li>{@code gocam.merge.models} - DistributionSummary</li>
 *   <li>{@code gocam.batch.failures} - Counter</li>
 * </ul>
 */
public class MicrometerMetricsService implements MetricsService {

    private final Timer buildTimer;
    private final DistributionSummary nodeSummary;
    private final DistributionSummary edgeSummary;
    private final Counter unrecognizedEnablerCounter;
    private final DistributionSummary holeSummary;
    private final DistributionSummary mergeSummary;
    private final Counter batchFailureCounter;

    public MicrometerMetricsService(MeterRegistry registry) {
        this.buildTimer = Timer.builder("gocam.graph.build.duration")
                .description("Duration of graph construction per model")
                .register(registry);
        this.nodeSummary = DistributionSummary.builder("gocam.graph.nodes")
                .description("Number of nodes per built graph")
                .register(registry);
        this.edgeSummary = DistributionSummary.builder("gocam.graph.edges")
                .description("Number of edges per built graph")
                .register(registry);
        this.unrecognizedEnablerCounter = Counter.builder("gocam.enabler.unrecognized")
                .description("Enabled-by objects with an unrecognized id namespace")
                .register(registry);
        this.holeSummary = DistributionSummary.builder("gocam.holes")
                .description("Number of holes found per hole scan")
                .register(registry);
        this.mergeSummary = DistributionSummary.builder("gocam.merge.models")
                .description("Number of models per merge")
                .register(registry);
        this.batchFailureCounter = Counter.builder("gocam.batch.failures")
                .description("Model sources that failed to load")
                .register(registry);
    }

    @Override
    public void recordGraphBuild(Duration duration, int nodeCount, int edgeCount) {
        buildTimer.record(duration);
        nodeSummary.record(nodeCount);
        edgeSummary.record(edgeCount);
    }

    @Override
    public void incrementUnrecognizedEnabler() {
        unrecognizedEnablerCounter.increment();
    }

    @Override
    public void recordHolesFound(int count) {
        holeSummary.record(count);
    }

    @Override
    public void recordMerge(int modelCount) {
        mergeSummary.record(modelCount);
    }

    @Override
    public void recordBatchFailure() {
        batchFailureCounter.increment();
    }
}
