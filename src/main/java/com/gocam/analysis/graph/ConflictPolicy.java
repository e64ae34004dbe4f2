package com.gocam.analysis.graph;

/**
 * Which fact wins when several facts set the same single-valued node attribute
 * (enabler, part-of process, located-in, happens-during).
 */
public enum ConflictPolicy {
    /**
     * Keep the value from the fact with the lowest ordinal.
     */
    FIRST_WINS,

    /**
     * Keep the value from the fact with the highest ordinal.
     */
    LAST_WINS
}
