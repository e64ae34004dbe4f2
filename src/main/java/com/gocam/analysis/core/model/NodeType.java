package com.gocam.analysis.core.model;

import java.util.Objects;
import java.util.Optional;

/**
 * Tagged node variant. Only {@link NodeKind#ACTIVITY} carries an enabler.
 */
public final class NodeType {

    private static final NodeType UNKNOWN = new NodeType(NodeKind.UNKNOWN, null);
    private static final NodeType CHEMICAL = new NodeType(NodeKind.CHEMICAL, null);
    private static final NodeType UNKNOWN_MRNA = new NodeType(NodeKind.UNKNOWN_MRNA, null);
    private static final NodeType MRNA = new NodeType(NodeKind.MRNA, null);
    private static final NodeType GENE = new NodeType(NodeKind.GENE, null);
    private static final NodeType MODIFIED_PROTEIN = new NodeType(NodeKind.MODIFIED_PROTEIN, null);

    private final NodeKind kind;
    private final Enabler enabler;

    private NodeType(NodeKind kind, Enabler enabler) {
        this.kind = kind;
        this.enabler = enabler;
    }

    public static NodeType unknown() {
        return UNKNOWN;
    }

    public static NodeType chemical() {
        return CHEMICAL;
    }

    public static NodeType unknownMrna() {
        return UNKNOWN_MRNA;
    }

    public static NodeType mrna() {
        return MRNA;
    }

    public static NodeType gene() {
        return GENE;
    }

    public static NodeType modifiedProtein() {
        return MODIFIED_PROTEIN;
    }

    public static NodeType activity(Enabler enabler) {
        return new NodeType(NodeKind.ACTIVITY, Objects.requireNonNull(enabler, "enabler is required"));
    }

    /**
     * Returns the shared instance for a kind that carries no payload.
     */
    public static NodeType of(NodeKind kind) {
        return switch (kind) {
            case UNKNOWN -> UNKNOWN;
            case CHEMICAL -> CHEMICAL;
            case UNKNOWN_MRNA -> UNKNOWN_MRNA;
            case MRNA -> MRNA;
            case GENE -> GENE;
            case MODIFIED_PROTEIN -> MODIFIED_PROTEIN;
            case ACTIVITY -> throw new IllegalArgumentException("activity node type requires an enabler");
        };
    }

    public NodeKind getKind() {
        return kind;
    }

    public Optional<Enabler> getEnabler() {
        return Optional.ofNullable(enabler);
    }

    public boolean isActivity() {
        return kind == NodeKind.ACTIVITY;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        NodeType nodeType = (NodeType) o;
        return kind == nodeType.kind && Objects.equals(enabler, nodeType.enabler);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, enabler);
    }

    @Override
    public String toString() {
        return enabler == null ? kind.getLabel() : kind.getLabel() + "(" + enabler.kind().getLabel() + ")";
    }
}
