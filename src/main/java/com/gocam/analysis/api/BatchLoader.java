package com.gocam.analysis.api;

import com.gocam.analysis.core.model.GoCamGraph;
import com.gocam.analysis.core.model.GoCamModel;
import com.gocam.analysis.logging.LogContext;
import com.gocam.analysis.metrics.MetricsService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.function.Function;

/**
 * Parses and builds a batch of model sources. A source that fails to read,
 * parse or build, with any runtime exception, is recorded as a
 * {@link BatchResult.Failure}; the rest of the batch carries on. With a parallelism above one, sources are processed on a fixed
 * thread pool; results keep source order either way.
 */
public class BatchLoader {
    private static final Logger log = LoggerFactory.getLogger(BatchLoader.class);

    private final Function<GoCamModel, GoCamGraph> graphFunction;
    private final int parallelism;
    private final MetricsService metricsService;

    public BatchLoader(Function<GoCamModel, GoCamGraph> graphFunction, int parallelism,
                       MetricsService metricsService) {
        if (parallelism <= 0) {
            throw new IllegalArgumentException("parallelism must be > 0");
        }
        this.graphFunction = graphFunction;
        this.parallelism = parallelism;
        this.metricsService = metricsService;
    }

    public BatchResult load(List<ModelSource> sources) {
        try (LogContext logCtx = LogContext.forBatch(LogContext.generateCorrelationId())) {
            log.info("batch.starting sources={} parallelism={}", sources.size(), parallelism);

            List<Outcome> outcomes = parallelism == 1 || sources.size() <= 1
                    ? loadSequentially(sources)
                    : loadInParallel(sources);

            List<BatchResult.Loaded> loaded = new ArrayList<>();
            List<BatchResult.Failure> failures = new ArrayList<>();
            for (Outcome outcome : outcomes) {
                if (outcome.loaded() != null) {
                    loaded.add(outcome.loaded());
                } else {
                    failures.add(outcome.failure());
                }
            }

            BatchResult result = new BatchResult(loaded, failures);
            log.info("batch.completed result={}", result);
            return result;
        }
    }

    private List<Outcome> loadSequentially(List<ModelSource> sources) {
        List<Outcome> outcomes = new ArrayList<>(sources.size());
        for (ModelSource source : sources) {
            outcomes.add(loadOne(source));
        }
        return outcomes;
    }

    private List<Outcome> loadInParallel(List<ModelSource> sources) {
        ExecutorService executor = Executors.newFixedThreadPool(Math.min(parallelism, sources.size()));
        try {
            List<CompletableFuture<Outcome>> futures = sources.stream()
                    .map(source -> CompletableFuture.supplyAsync(() -> loadOne(source), executor))
                    .toList();
            List<Outcome> outcomes = new ArrayList<>(futures.size());
            for (CompletableFuture<Outcome> future : futures) {
                outcomes.add(join(future));
            }
            return outcomes;
        } finally {
            executor.shutdown();
        }
    }

    private static Outcome join(CompletableFuture<Outcome> future) {
        try {
            return future.join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException cause) {
                throw cause;
            }
            throw e;
        }
    }

    private Outcome loadOne(ModelSource source) {
        GoCamModel model;
        try {
            model = source.load();
        } catch (RuntimeException e) {
            return failed(source, "load", e);
        }
        GoCamGraph graph;
        try {
            graph = graphFunction.apply(model);
        } catch (RuntimeException e) {
            return failed(source, "build", e);
        }
        return Outcome.ok(new BatchResult.Loaded(source.name(), model, graph));
    }

    private Outcome failed(ModelSource source, String stage, RuntimeException e) {
        String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
        metricsService.recordBatchFailure();
        if (e instanceof ModelParseException || e instanceof UncheckedIOException) {
            log.warn("batch.source.failed source={} stage={} error={}", source.name(), stage, message);
        } else {
            log.warn("batch.source.failed source={} stage={} error={}", source.name(), stage, message, e);
        }
        return Outcome.failed(new BatchResult.Failure(source.name(), message));
    }

    private record Outcome(BatchResult.Loaded loaded, BatchResult.Failure failure) {
        static Outcome ok(BatchResult.Loaded loaded) {
            return new Outcome(loaded, null);
        }

        static Outcome failed(BatchResult.Failure failure) {
            return new Outcome(null, failure);
        }
    }
}
