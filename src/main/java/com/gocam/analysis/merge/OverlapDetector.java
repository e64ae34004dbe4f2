package com.gocam.analysis.merge;

import com.gocam.analysis.core.model.GoCamGraph;
import com.gocam.analysis.core.model.IndividualType;
import com.gocam.analysis.core.model.ModelRef;
import com.gocam.analysis.core.model.Node;
import com.gocam.analysis.core.model.NodeKind;
import com.gocam.analysis.core.model.OverlapRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Finds nodes shared between independently authored models.
 * Nodes are grouped by (node id, node label); a group found in two or more
 * models is an overlap.
 */
public class OverlapDetector {
    private static final Logger log = LoggerFactory.getLogger(OverlapDetector.class);

    /**
     * Returns the overlaps across the given graphs, sorted by node id then label.
     * The result does not depend on the order of {@code graphs}.
     */
    public List<OverlapRecord> findOverlaps(List<GoCamGraph> graphs) {
        List<OverlapRecord> overlaps = groupNodes(graphs).stream()
                .filter(OverlapRecord::isShared)
                .collect(Collectors.toList());
        log.info("overlaps.found graphs={} overlaps={}", graphs.size(), overlaps.size());
        return overlaps;
    }

    /**
     * Groups every node of every graph by (node id, node label), whether or not the
     * group spans several models. Groups come back sorted by id then label.
     */
    public List<OverlapRecord> groupNodes(List<GoCamGraph> graphs) {
        Map<GroupKey, Group> groups = new TreeMap<>();
        for (GoCamGraph graph : graphs) {
            for (Node node : graph.nodes()) {
                Group group = groups.computeIfAbsent(new GroupKey(node.getId(), node.getLabel()), Group::new);
                group.add(graph, node);
            }
        }

        List<OverlapRecord> records = new ArrayList<>(groups.size());
        for (Group group : groups.values()) {
            records.add(group.toRecord());
        }
        return records;
    }

    private record GroupKey(String nodeId, String nodeLabel) implements Comparable<GroupKey> {
        @Override
        public int compareTo(GroupKey other) {
            int byId = nodeId.compareTo(other.nodeId);
            return byId != 0 ? byId : nodeLabel.compareTo(other.nodeLabel);
        }
    }

    private static final class Group {
        private final GroupKey key;
        private final Map<String, ModelRef> models = new TreeMap<>();
        private final SortedSet<NodeKind> kinds = new TreeSet<>();
        private final SortedSet<String> processes = new TreeSet<>();
        private final SortedSet<String> occursIn = new TreeSet<>();
        private final SortedSet<String> locatedIn = new TreeSet<>();

        Group(GroupKey key) {
            this.key = key;
        }

        void add(GoCamGraph graph, Node node) {
            String modelId = node.getOriginatingModelId();
            models.computeIfAbsent(modelId, id -> graph.getModels().stream()
                    .filter(m -> m.id().equals(id))
                    .findFirst()
                    .orElse(new ModelRef(id, graph.modelTitle(id), "")));
            kinds.add(node.getKind());
            node.getPartOfProcess().map(IndividualType::labelOrId).ifPresent(processes::add);
            node.getOccursIn().forEach(t -> occursIn.add(t.labelOrId()));
            node.getLocatedIn().map(IndividualType::labelOrId).ifPresent(locatedIn::add);
        }

        OverlapRecord toRecord() {
            // lowest kind in declaration order, so reordering inputs never changes it
            return new OverlapRecord(key.nodeId(), key.nodeLabel(), kinds.first(),
                    List.copyOf(models.values()), processes, occursIn, locatedIn);
        }
    }
}
