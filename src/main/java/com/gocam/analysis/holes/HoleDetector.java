package com.gocam.analysis.holes;

import com.gocam.analysis.core.model.GoCamGraph;
import com.gocam.analysis.core.model.Node;

import java.util.EnumSet;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Flags activity nodes that are missing an enabler, a part-of process, an input,
 * an output or a location. Graphs are only read.
 */
public class HoleDetector {

    /**
     * Returns the holes of a graph lazily, in graph node order. Each call returns
     * a fresh stream.
     */
    public Stream<Node> findHoles(GoCamGraph graph) {
        return graph.nodes().stream().filter(this::isHole);
    }

    /**
     * Returns every hole together with its missing annotations.
     */
    public List<Hole> findHoleReports(GoCamGraph graph) {
        return findHoles(graph)
                .map(node -> new Hole(node, missingAspects(node)))
                .collect(Collectors.toList());
    }

    public long countHoles(GoCamGraph graph) {
        return findHoles(graph).count();
    }

    public boolean isHole(Node node) {
        return !missingAspects(node).isEmpty();
    }

    /**
     * Returns the annotations a node lacks. Nodes that are not built from
     * activity individuals never lack anything.
     */
    public EnumSet<MissingAspect> missingAspects(Node node) {
        EnumSet<MissingAspect> missing = EnumSet.noneOf(MissingAspect.class);
        if (!node.isActivityIndividual()) {
            return missing;
        }
        if (node.getEnabler().isEmpty()) {
            missing.add(MissingAspect.ENABLER);
        }
        if (node.getPartOfProcess().isEmpty()) {
            missing.add(MissingAspect.PROCESS);
        }
        if (node.getInputs().isEmpty()) {
            missing.add(MissingAspect.INPUT);
        }
        if (node.getOutputs().isEmpty()) {
            missing.add(MissingAspect.OUTPUT);
        }
        if (node.getOccursIn().isEmpty() && node.getLocatedIn().isEmpty()) {
            missing.add(MissingAspect.LOCATION);
        }
        return missing;
    }
}
