package com.gocam.analysis.core.model;

import java.util.Objects;

/**
 * One type assertion on an individual: an ontology term id and label, plus the
 * raw type string the model carried for it.
 *
 * @param id         ontology id such as {@code GO:0003674}, may be null
 * @param label      term label, may be null
 * @param typeString raw type string as found in the model
 */
public record IndividualType(String id, String label, String typeString) {

    public IndividualType {
        typeString = typeString != null ? typeString : "";
    }

    public static IndividualType of(String id, String label) {
        return new IndividualType(id, label, id != null ? id : "");
    }

    /**
     * Returns the label if present, otherwise the id, otherwise the raw type string.
     */
    public String labelOrId() {
        if (label != null) {
            return label;
        }
        if (id != null) {
            return id;
        }
        return typeString;
    }

    public boolean hasIdPrefix(String prefix) {
        return id != null && id.startsWith(prefix);
    }

    public boolean hasId(String termId) {
        return Objects.equals(id, termId);
    }
}
