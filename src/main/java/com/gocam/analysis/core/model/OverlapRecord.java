package com.gocam.analysis.core.model;

import java.util.Collections;
import java.util.List;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * A node id/label pair found in one or more models, with the models that contain
 * it and the process and location context it appears in.
 *
 * @param nodeId          primary type id shared by the grouped nodes
 * @param nodeLabel       label shared by the grouped nodes
 * @param nodeKind        lowest kind, in declaration order, among the grouped nodes
 * @param models          contributing models as (id, title) pairs, sorted by id
 * @param partOfProcesses distinct part-of process labels of the grouped nodes
 * @param occursIn        distinct occurs-in labels
 * @param locatedIn       distinct located-in labels
 */
public record OverlapRecord(
        String nodeId,
        String nodeLabel,
        NodeKind nodeKind,
        List<ModelRef> models,
        SortedSet<String> partOfProcesses,
        SortedSet<String> occursIn,
        SortedSet<String> locatedIn
) {
    public OverlapRecord {
        models = models != null ? List.copyOf(models) : List.of();
        partOfProcesses = sortedCopy(partOfProcesses);
        occursIn = sortedCopy(occursIn);
        locatedIn = sortedCopy(locatedIn);
    }

    private static SortedSet<String> sortedCopy(SortedSet<String> values) {
        return Collections.unmodifiableSortedSet(values != null ? new TreeSet<>(values) : new TreeSet<>());
    }

    public int modelCount() {
        return models.size();
    }

    /**
     * True when the node appears in at least two distinct models.
     */
    public boolean isShared() {
        return models.size() >= 2;
    }
}
