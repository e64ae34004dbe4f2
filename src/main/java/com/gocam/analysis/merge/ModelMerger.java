package com.gocam.analysis.merge;

import com.gocam.analysis.core.model.BuildWarning;
import com.gocam.analysis.core.model.Edge;
import com.gocam.analysis.core.model.GoCamGraph;
import com.gocam.analysis.core.model.ModelRef;
import com.gocam.analysis.core.model.Node;
import com.gocam.analysis.logging.LogContext;
import com.gocam.analysis.metrics.MetricsService;
import com.gocam.analysis.metrics.NoOpMetricsService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Unions several graphs into a new one.
 *
 * <p>Nodes keep their {@link com.gocam.analysis.core.model.NodeKey}, which already
 * carries the originating model id, so nodes from different models never collide.
 * Edges are keyed by source model id and fact id. A node or edge that is already
 * present is kept once, so merging overlapping inputs, or a merged graph with its
 * own parts, yields the plain union. Whether two nodes denote the same entity is
 * left to {@link OverlapDetector}.</p>
 */
public class ModelMerger {
    private static final Logger log = LoggerFactory.getLogger(ModelMerger.class);

    private final MetricsService metricsService;

    public ModelMerger() {
        this(new NoOpMetricsService());
    }

    public ModelMerger(MetricsService metricsService) {
        this.metricsService = metricsService;
    }

    /**
     * Merges the graphs into a new graph with the given id and title. Input graphs
     * are not modified.
     *
     * @return a successful result carrying the merged graph, or a failure with
     *         {@link MergeResult#EMPTY_MERGE_INPUT} when {@code graphs} is empty
     */
    public MergeResult mergeModels(String newId, String newTitle, List<GoCamGraph> graphs) {
        if (graphs == null || graphs.isEmpty()) {
            log.warn("merge.rejected mergedModelId={} reason=no-input-models", newId);
            return MergeResult.failure(MergeResult.EMPTY_MERGE_INPUT, "No models given to merge");
        }

        try (LogContext logCtx = LogContext.forMerge(LogContext.generateCorrelationId(), newId, graphs.size())) {
            GoCamGraph.Builder merged = GoCamGraph.builder()
                    .id(newId)
                    .title(newTitle)
                    .merged(true);

            Set<String> seenModels = new HashSet<>();
            Set<String> seenEdges = new HashSet<>();
            Set<String> taxa = new LinkedHashSet<>();
            Set<BuildWarning> warnings = new LinkedHashSet<>();
            int duplicateNodes = 0;
            int duplicateEdges = 0;

            for (GoCamGraph graph : graphs) {
                for (ModelRef model : graph.getModels()) {
                    if (seenModels.add(model.id())) {
                        merged.model(model);
                        if (!model.taxon().isEmpty()) {
                            taxa.add(model.taxon());
                        }
                    }
                }
                for (Node node : graph.nodes()) {
                    if (!merged.addNode(node)) {
                        duplicateNodes++;
                    }
                }
                for (Edge edge : graph.getEdges()) {
                    if (seenEdges.add(edgeKey(edge))) {
                        merged.addEdge(edge);
                    } else {
                        duplicateEdges++;
                    }
                }
                warnings.addAll(graph.getWarnings());
            }

            merged.warnings(List.copyOf(warnings));
            GoCamGraph result = merged.taxon(taxa.stream().collect(Collectors.joining(","))).build();
            metricsService.recordMerge(graphs.size());
            log.info("merge.completed mergedModelId={} models={} nodes={} edges={} duplicateNodes={} duplicateEdges={}",
                    newId, result.getModels().size(), result.nodeCount(), result.edgeCount(),
                    duplicateNodes, duplicateEdges);
            return MergeResult.success(result);
        }
    }

    private static String edgeKey(Edge edge) {
        return edge.source().modelId() + "/" + edge.factId();
    }
}
