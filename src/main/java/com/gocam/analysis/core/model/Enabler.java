package com.gocam.analysis.core.model;

import java.util.List;
import java.util.Objects;

/**
 * The gene, gene product, complex or chemical enabling an activity.
 *
 * @param kind         enabler variant, decided by the type id namespace
 * @param type         primary type of the enabling individual
 * @param constituents for complexes, type ids of the complex's parts; empty otherwise
 */
public record Enabler(EnablerKind kind, IndividualType type, List<String> constituents) {

    public Enabler {
        Objects.requireNonNull(kind, "kind is required");
        Objects.requireNonNull(type, "type is required");
        constituents = constituents != null ? List.copyOf(constituents) : List.of();
    }

    public static Enabler of(EnablerKind kind, IndividualType type) {
        return new Enabler(kind, type, List.of());
    }

    public String id() {
        return type.id();
    }

    public String label() {
        return type.label() != null ? type.label() : "UNKNOWN";
    }
}
