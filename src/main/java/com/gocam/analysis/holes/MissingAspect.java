package com.gocam.analysis.holes;

/**
 * Annotation an activity is expected to carry.
 */
public enum MissingAspect {
    ENABLER("enabler"),
    PROCESS("process"),
    INPUT("input"),
    OUTPUT("output"),
    LOCATION("location");

    private final String label;

    MissingAspect(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }
}
