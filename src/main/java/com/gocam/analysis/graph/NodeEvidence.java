package com.gocam.analysis.graph;

import com.gocam.analysis.core.model.Enabler;
import com.gocam.analysis.core.model.IndividualType;

import java.util.ArrayList;
import java.util.List;

/**
 * Attributes collected for one individual during the fact pass, before its node
 * is constructed. Single-valued attributes are settled by the {@link ConflictPolicy}.
 */
class NodeEvidence {

    private final ConflictPolicy policy;

    private Enabler enabler;
    private IndividualType partOfProcess;
    private IndividualType locatedIn;
    private IndividualType happensDuring;
    private final List<IndividualType> inputs = new ArrayList<>();
    private final List<IndividualType> outputs = new ArrayList<>();
    private final List<IndividualType> occursIn = new ArrayList<>();

    NodeEvidence(ConflictPolicy policy) {
        this.policy = policy;
    }

    void offerEnabler(Enabler candidate) {
        if (accepts(enabler)) {
            enabler = candidate;
        }
    }

    void offerPartOf(IndividualType candidate) {
        if (accepts(partOfProcess)) {
            partOfProcess = candidate;
        }
    }

    void offerLocatedIn(IndividualType candidate) {
        if (accepts(locatedIn)) {
            locatedIn = candidate;
        }
    }

    void offerHappensDuring(IndividualType candidate) {
        if (accepts(happensDuring)) {
            happensDuring = candidate;
        }
    }

    void addInput(IndividualType input) {
        inputs.add(input);
    }

    void addOutput(IndividualType output) {
        outputs.add(output);
    }

    void addOccursIn(IndividualType location) {
        occursIn.add(location);
    }

    private boolean accepts(Object current) {
        return current == null || policy == ConflictPolicy.LAST_WINS;
    }

    Enabler enabler() {
        return enabler;
    }

    IndividualType partOfProcess() {
        return partOfProcess;
    }

    IndividualType locatedIn() {
        return locatedIn;
    }

    IndividualType happensDuring() {
        return happensDuring;
    }

    List<IndividualType> inputs() {
        return inputs;
    }

    List<IndividualType> outputs() {
        return outputs;
    }

    List<IndividualType> occursIn() {
        return occursIn;
    }
}
