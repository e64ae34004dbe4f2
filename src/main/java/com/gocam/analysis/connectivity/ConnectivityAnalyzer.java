package com.gocam.analysis.connectivity;

import com.gocam.analysis.core.model.Edge;
import com.gocam.analysis.core.model.Enabler;
import com.gocam.analysis.core.model.EnablerKind;
import com.gocam.analysis.core.model.GoCamGraph;
import com.gocam.analysis.core.model.Node;
import com.gocam.analysis.core.model.NodeKey;
import com.gocam.analysis.holes.HoleDetector;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Per-gene connectivity and aggregate statistics of a graph.
 *
 * <p>Connectivity is taken over the undirected view of all edges, so two
 * activities joined through a shared chemical participant are connected.
 * An activity counts as connected when its component holds at least one
 * other activity node.</p>
 */
public class ConnectivityAnalyzer {

    private final HoleDetector holeDetector;

    public ConnectivityAnalyzer() {
        this(new HoleDetector());
    }

    public ConnectivityAnalyzer(HoleDetector holeDetector) {
        this.holeDetector = holeDetector;
    }

    /**
     * Groups enabling gene ids by the number of connected activities each one
     * enables. Every gene enabling at least one activity appears in exactly one
     * bucket; genes whose activities are all isolated land in bucket 0.
     */
    public SortedMap<Integer, SortedSet<String>> getConnectedGenes(GoCamGraph graph) {
        return bucketGenes(graph, connectedActivities(graph));
    }

    private static SortedMap<Integer, SortedSet<String>> bucketGenes(GoCamGraph graph, Set<NodeKey> connected) {
        Map<String, Set<NodeKey>> activitiesByGene = new HashMap<>();
        for (Node node : graph.nodes()) {
            geneEnablerId(node).ifPresent(geneId -> {
                Set<NodeKey> activities = activitiesByGene.computeIfAbsent(geneId, k -> new HashSet<>());
                if (connected.contains(node.getKey())) {
                    activities.add(node.getKey());
                }
            });
        }

        SortedMap<Integer, SortedSet<String>> buckets = new TreeMap<>();
        for (Map.Entry<String, Set<NodeKey>> entry : activitiesByGene.entrySet()) {
            buckets.computeIfAbsent(entry.getValue().size(), k -> new TreeSet<>()).add(entry.getKey());
        }
        return Collections.unmodifiableSortedMap(buckets);
    }

    /**
     * Genes enabling two or more connected activities.
     */
    public SortedSet<String> wellConnectedGenes(GoCamGraph graph) {
        SortedSet<String> genes = new TreeSet<>();
        getConnectedGenes(graph).tailMap(2).values().forEach(genes::addAll);
        return genes;
    }

    public ModelStats getStats(GoCamGraph graph) {
        Set<String> genes = new HashSet<>();
        Set<String> complexes = new HashSet<>();
        for (Node node : graph.nodes()) {
            node.getEnabler().ifPresent(enabler -> {
                if (enabler.kind() == EnablerKind.GENE) {
                    genes.add(enablerKey(enabler));
                } else if (enabler.kind() == EnablerKind.COMPLEX) {
                    complexes.add(enablerKey(enabler));
                }
            });
        }

        Set<NodeKey> connected = connectedActivities(graph);
        SortedMap<Integer, SortedSet<String>> buckets = bucketGenes(graph, connected);
        int maxConnected = buckets.isEmpty() ? 0 : buckets.lastKey();

        return new ModelStats(
                graph.getId(),
                graph.getTitle(),
                graph.getTaxon(),
                genes.size(),
                complexes.size(),
                maxConnected,
                connected.size(),
                holeDetector.countHoles(graph));
    }

    /**
     * Keys of activity nodes whose connected component contains another activity.
     */
    public Set<NodeKey> connectedActivities(GoCamGraph graph) {
        Map<NodeKey, List<NodeKey>> adjacency = new HashMap<>();
        for (Edge edge : graph.getEdges()) {
            adjacency.computeIfAbsent(edge.source(), k -> new ArrayList<>()).add(edge.target());
            adjacency.computeIfAbsent(edge.target(), k -> new ArrayList<>()).add(edge.source());
        }

        Set<NodeKey> visited = new HashSet<>();
        Set<NodeKey> connected = new HashSet<>();
        for (Node start : graph.nodes()) {
            if (visited.contains(start.getKey())) {
                continue;
            }
            List<NodeKey> componentActivities = new ArrayList<>();
            Deque<NodeKey> queue = new ArrayDeque<>();
            queue.add(start.getKey());
            visited.add(start.getKey());
            while (!queue.isEmpty()) {
                NodeKey current = queue.poll();
                graph.getNode(current)
                        .filter(Node::isActivity)
                        .ifPresent(n -> componentActivities.add(current));
                for (NodeKey next : adjacency.getOrDefault(current, List.of())) {
                    if (visited.add(next)) {
                        queue.add(next);
                    }
                }
            }
            if (componentActivities.size() >= 2) {
                connected.addAll(componentActivities);
            }
        }
        return connected;
    }

    private static Optional<String> geneEnablerId(Node node) {
        return node.getEnabler()
                .filter(enabler -> enabler.kind() == EnablerKind.GENE)
                .map(ConnectivityAnalyzer::enablerKey);
    }

    private static String enablerKey(Enabler enabler) {
        return enabler.id() != null ? enabler.id() : enabler.type().typeString();
    }
}
