package com.gocam.analysis.graph;

/**
 * Property labels the graph builder dispatches on.
 */
public final class Relations {

    public static final String ENABLED_BY = "enabled by";
    public static final String HAS_INPUT = "has input";
    public static final String HAS_OUTPUT = "has output";
    public static final String LOCATED_IN = "located in";
    public static final String OCCURS_IN = "occurs in";
    public static final String PART_OF = "part of";
    public static final String HAPPENS_DURING = "happens during";
    public static final String HAS_PART = "has part";

    private Relations() {
        // Constants
    }
}
