package com.gocam.analysis.holes;

import com.gocam.analysis.core.model.Node;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * An under-specified activity and the annotations it lacks.
 */
public record Hole(Node node, Set<MissingAspect> missing) {

    public Hole {
        missing = missing.isEmpty()
                ? Collections.emptySet()
                : Collections.unmodifiableSet(EnumSet.copyOf(missing));
    }
}
