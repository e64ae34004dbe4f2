package com.gocam.analysis.classify;

/**
 * Semantic categories an individual can fall into. Categories are not exclusive.
 */
public enum Category {
    ACTIVITY,
    COMPONENT,
    PROCESS,
    COMPLEX,
    CHEMICAL,
    UNKNOWN_PROTEIN,
    OTHER
}
