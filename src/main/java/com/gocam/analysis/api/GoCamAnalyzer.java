package com.gocam.analysis.api;

import com.gocam.analysis.cache.CaffeineGraphCache;
import com.gocam.analysis.cache.GraphCache;
import com.gocam.analysis.cache.GraphCacheStats;
import com.gocam.analysis.cache.NoOpGraphCache;
import com.gocam.analysis.classify.Classifier;
import com.gocam.analysis.connectivity.ConnectivityAnalyzer;
import com.gocam.analysis.connectivity.ModelStats;
import com.gocam.analysis.core.model.GoCamGraph;
import com.gocam.analysis.core.model.GoCamModel;
import com.gocam.analysis.core.model.Node;
import com.gocam.analysis.core.model.OverlapRecord;
import com.gocam.analysis.export.CytoscapeExporter;
import com.gocam.analysis.export.DotExporter;
import com.gocam.analysis.export.ExportResult;
import com.gocam.analysis.graph.GraphBuilder;
import com.gocam.analysis.holes.Hole;
import com.gocam.analysis.holes.HoleDetector;
import com.gocam.analysis.merge.MergeResult;
import com.gocam.analysis.merge.ModelMerger;
import com.gocam.analysis.merge.OverlapDetector;
import com.gocam.analysis.metrics.MetricsService;
import com.gocam.analysis.metrics.NoOpMetricsService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Writer;
import java.util.List;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Main entry point for GO-CAM model analysis.
 * Every operation works on already parsed models and performs no file I/O.
 *
 * <h2>Example usage:</h2>
 * <pre>
 * GoCamAnalyzer analyzer = GoCamAnalyzer.builder()
 *     .options(AnalysisOptions.defaults())
 *     .build();
 *
 * GoCamGraph graph = analyzer.buildGraph(model);
 * List&lt;Node&gt; holes = analyzer.findHoles(model).toList();
 * ModelStats stats = analyzer.getStats(model);
 *
 * MergeResult merged = analyzer.mergeModels("merged", "All models", List.of(a, b));
 * String dot = analyzer.exportDot(merged.graph());
 * </pre>
 */
public class GoCamAnalyzer {
    private static final Logger log = LoggerFactory.getLogger(GoCamAnalyzer.class);

    private final AnalysisOptions options;
    private final MetricsService metricsService;
    private final GraphCache graphCache;
    private final GraphBuilder graphBuilder;
    private final HoleDetector holeDetector;
    private final ConnectivityAnalyzer connectivityAnalyzer;
    private final OverlapDetector overlapDetector;
    private final ModelMerger modelMerger;
    private final CytoscapeExporter cytoscapeExporter;
    private final DotExporter dotExporter;

    private GoCamAnalyzer(Builder builder) {
        this.options = builder.options;
        this.metricsService = builder.metricsService != null
                ? builder.metricsService : new NoOpMetricsService();

        if (builder.graphCache != null) {
            this.graphCache = builder.graphCache;
        } else if (options.getCacheConfig().enabled()) {
            this.graphCache = new CaffeineGraphCache(options.getCacheConfig());
        } else {
            this.graphCache = new NoOpGraphCache();
        }

        this.graphBuilder = new GraphBuilder(new Classifier(), options.prefixTable(),
                options.getConflictPolicy(), options.isIncludeParticipants(), metricsService);
        this.holeDetector = new HoleDetector();
        this.connectivityAnalyzer = new ConnectivityAnalyzer(holeDetector);
        this.overlapDetector = new OverlapDetector();
        this.modelMerger = new ModelMerger(metricsService);
        this.cytoscapeExporter = new CytoscapeExporter();
        this.dotExporter = new DotExporter();

        log.info("GoCamAnalyzer initialized: conflictPolicy={} includeParticipants={} parallelism={}",
                options.getConflictPolicy(), options.isIncludeParticipants(), options.getParallelism());
    }

    // ========== Graph construction ==========

    /**
     * Builds (or returns the cached) graph of a model.
     */
    public GoCamGraph buildGraph(GoCamModel model) {
        return graphCache.get(model, graphBuilder::build);
    }

    /**
     * Parses and builds every source. Failing sources are reported in the result
     * and do not stop the batch.
     */
    public BatchResult loadBatch(List<ModelSource> sources) {
        return new BatchLoader(this::buildGraph, options.getParallelism(), metricsService).load(sources);
    }

    // ========== Analyses ==========

    /**
     * Returns the holes of a model lazily, in node order.
     */
    public Stream<Node> findHoles(GoCamModel model) {
        return holeDetector.findHoles(buildGraph(model));
    }

    public List<Hole> findHoleReports(GoCamModel model) {
        List<Hole> holes = holeDetector.findHoleReports(buildGraph(model));
        metricsService.recordHolesFound(holes.size());
        return holes;
    }

    public ModelStats getStats(GoCamModel model) {
        return connectivityAnalyzer.getStats(buildGraph(model));
    }

    public SortedMap<Integer, SortedSet<String>> getConnectedGenes(GoCamModel model) {
        return connectivityAnalyzer.getConnectedGenes(buildGraph(model));
    }

    public List<OverlapRecord> findOverlaps(List<GoCamModel> models) {
        return overlapDetector.findOverlaps(graphsOf(models));
    }

    /**
     * Merges the graphs of the given models.
     *
     * @return the merged graph, or a failure when {@code models} is empty
     */
    public MergeResult mergeModels(String newId, String newTitle, List<GoCamModel> models) {
        return modelMerger.mergeModels(newId, newTitle, graphsOf(models));
    }

    // ========== Export ==========

    public String exportCytoscape(GoCamGraph graph) {
        return cytoscapeExporter.exportToString(graph);
    }

    public ExportResult exportCytoscape(GoCamGraph graph, Writer writer) {
        return cytoscapeExporter.export(graph, writer);
    }

    public String exportDot(GoCamGraph graph) {
        return dotExporter.exportToString(graph);
    }

    public ExportResult exportDot(GoCamGraph graph, Writer writer) {
        return dotExporter.export(graph, writer);
    }

    // ========== Accessors ==========

    public AnalysisOptions getOptions() {
        return options;
    }

    public GraphCacheStats getCacheStats() {
        return graphCache.getStats();
    }

    public HoleDetector getHoleDetector() {
        return holeDetector;
    }

    public ConnectivityAnalyzer getConnectivityAnalyzer() {
        return connectivityAnalyzer;
    }

    public OverlapDetector getOverlapDetector() {
        return overlapDetector;
    }

    public ModelMerger getModelMerger() {
        return modelMerger;
    }

    private List<GoCamGraph> graphsOf(List<GoCamModel> models) {
        return models.stream().map(this::buildGraph).collect(Collectors.toList());
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private AnalysisOptions options = AnalysisOptions.defaults();
        private MetricsService metricsService;
        private GraphCache graphCache;

        public Builder options(AnalysisOptions options) {
            this.options = options;
            return this;
        }

        public Builder metricsService(MetricsService metricsService) {
            this.metricsService = metricsService;
            return this;
        }

        /**
         * Overrides the cache chosen from {@link AnalysisOptions#getCacheConfig()}.
         */
        public Builder graphCache(GraphCache graphCache) {
            this.graphCache = graphCache;
            return this;
        }

        public GoCamAnalyzer build() {
            if (options == null) {
                throw new IllegalStateException("AnalysisOptions are required");
            }
            return new GoCamAnalyzer(this);
        }
    }
}
