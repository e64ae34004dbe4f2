package com.gocam.analysis.core.model;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A typed entity instance within a causal model.
 * Types are ordered; the first one is the primary type. Root types are the
 * pre-computed ancestor categories of the individual's types.
 */
public record Individual(String id, List<IndividualType> types, List<IndividualType> rootTypes) {

    public Individual {
        Objects.requireNonNull(id, "id is required");
        types = types != null ? List.copyOf(types) : List.of();
        rootTypes = rootTypes != null ? List.copyOf(rootTypes) : List.of();
    }

    /**
     * Returns the primary (first) type, or empty when the individual carries no types.
     */
    public Optional<IndividualType> primaryType() {
        return types.isEmpty() ? Optional.empty() : Optional.of(types.get(0));
    }

    /**
     * Returns the primary type id, or null.
     */
    public String primaryTypeId() {
        return primaryType().map(IndividualType::id).orElse(null);
    }

    public boolean hasRootType(String termId) {
        for (IndividualType rootType : rootTypes) {
            if (rootType.hasId(termId)) {
                return true;
            }
        }
        return false;
    }
}
