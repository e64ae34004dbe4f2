package com.gocam.analysis.core.model;

import java.util.Objects;

/**
 * A directed semantic relation between two individuals: subject, property, object.
 */
public record Fact(String id, String subject, String object, String propertyId, String propertyLabel) {

    public Fact {
        Objects.requireNonNull(subject, "subject is required");
        Objects.requireNonNull(object, "object is required");
        propertyLabel = propertyLabel != null ? propertyLabel : "";
        propertyId = propertyId != null ? propertyId : "";
        id = id != null ? id : subject + "-" + propertyId + "-" + object;
    }
}
