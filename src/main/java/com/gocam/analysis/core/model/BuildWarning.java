package com.gocam.analysis.core.model;

/**
 * A non-fatal problem met while building a graph, such as an {@code enabled by}
 * object whose id namespace is not recognized.
 *
 * @param individualId individual the warning is about
 * @param factId       fact that triggered it, may be null
 * @param message      human readable description
 */
public record BuildWarning(String individualId, String factId, String message) {
}
