package com.gocam.analysis.core.model;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A graph node derived from one qualifying individual.
 * All attributes are collected before construction; nodes are never modified.
 */
public final class Node {

    public static final String NO_ID = "NO_ID";
    public static final String NO_LABEL = "NO_LABEL";

    private final NodeKey key;
    private final String id;
    private final String label;
    private final NodeType type;
    private final IndividualType partOfProcess;
    private final List<IndividualType> occursIn;
    private final IndividualType locatedIn;
    private final IndividualType happensDuring;
    private final List<IndividualType> inputs;
    private final List<IndividualType> outputs;

    private Node(Builder builder) {
        this.key = Objects.requireNonNull(builder.key, "key is required");
        this.id = builder.id != null ? builder.id : NO_ID;
        this.label = builder.label != null ? builder.label : NO_LABEL;
        this.type = builder.type != null ? builder.type : NodeType.unknown();
        this.partOfProcess = builder.partOfProcess;
        this.occursIn = builder.occursIn != null ? List.copyOf(builder.occursIn) : List.of();
        this.locatedIn = builder.locatedIn;
        this.happensDuring = builder.happensDuring;
        this.inputs = builder.inputs != null ? List.copyOf(builder.inputs) : List.of();
        this.outputs = builder.outputs != null ? List.copyOf(builder.outputs) : List.of();
    }

    public NodeKey getKey() {
        return key;
    }

    public String getIndividualId() {
        return key.individualId();
    }

    public String getOriginatingModelId() {
        return key.modelId();
    }

    /**
     * Returns the primary type id of the individual, or {@link #NO_ID}.
     */
    public String getId() {
        return id;
    }

    public String getLabel() {
        return label;
    }

    public NodeType getType() {
        return type;
    }

    public NodeKind getKind() {
        return type.getKind();
    }

    public Optional<Enabler> getEnabler() {
        return type.getEnabler();
    }

    public Optional<IndividualType> getPartOfProcess() {
        return Optional.ofNullable(partOfProcess);
    }

    public List<IndividualType> getOccursIn() {
        return occursIn;
    }

    public Optional<IndividualType> getLocatedIn() {
        return Optional.ofNullable(locatedIn);
    }

    public Optional<IndividualType> getHappensDuring() {
        return Optional.ofNullable(happensDuring);
    }

    public List<IndividualType> getInputs() {
        return inputs;
    }

    public List<IndividualType> getOutputs() {
        return outputs;
    }

    /**
     * True for nodes built from molecular-function individuals, whether or not an
     * enabler was resolved for them.
     */
    public boolean isActivityIndividual() {
        return type.getKind() == NodeKind.ACTIVITY || type.getKind() == NodeKind.UNKNOWN;
    }

    public boolean isActivity() {
        return type.isActivity();
    }

    /**
     * Label used for display: the enabler label when there is one, else the node label.
     */
    public String displayLabel() {
        return type.getEnabler().map(Enabler::label).orElse(label);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Node node = (Node) o;
        return Objects.equals(key, node.key);
    }

    @Override
    public int hashCode() {
        return Objects.hash(key);
    }

    @Override
    public String toString() {
        return "Node{" +
                "key=" + key +
                ", id='" + id + '\'' +
                ", label='" + label + '\'' +
                ", type=" + type +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private NodeKey key;
        private String id;
        private String label;
        private NodeType type;
        private IndividualType partOfProcess;
        private List<IndividualType> occursIn;
        private IndividualType locatedIn;
        private IndividualType happensDuring;
        private List<IndividualType> inputs;
        private List<IndividualType> outputs;

        public Builder key(NodeKey key) {
            this.key = key;
            return this;
        }

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder label(String label) {
            this.label = label;
            return this;
        }

        public Builder type(NodeType type) {
            this.type = type;
            return this;
        }

        public Builder partOfProcess(IndividualType partOfProcess) {
            this.partOfProcess = partOfProcess;
            return this;
        }

        public Builder occursIn(List<IndividualType> occursIn) {
            this.occursIn = occursIn;
            return this;
        }

        public Builder locatedIn(IndividualType locatedIn) {
            this.locatedIn = locatedIn;
            return this;
        }

        public Builder happensDuring(IndividualType happensDuring) {
            this.happensDuring = happensDuring;
            return this;
        }

        public Builder inputs(List<IndividualType> inputs) {
            this.inputs = inputs;
            return this;
        }

        public Builder outputs(List<IndividualType> outputs) {
            this.outputs = outputs;
            return this;
        }

        public Node build() {
            return new Node(this);
        }
    }
}
