package com.gocam.analysis.classify;

import com.gocam.analysis.core.model.EnablerKind;

import java.util.Optional;

/**
 * Outcome of looking up an enabler type id in the {@link EnablerPrefixTable}:
 * either a resolved kind or an explicit unrecognized result.
 */
public record EnablerResolution(String typeId, EnablerKind kind) {

    public static EnablerResolution resolved(String typeId, EnablerKind kind) {
        return new EnablerResolution(typeId, kind);
    }

    public static EnablerResolution unrecognized(String typeId) {
        return new EnablerResolution(typeId, null);
    }

    public boolean isRecognized() {
        return kind != null;
    }

    public Optional<EnablerKind> getKind() {
        return Optional.ofNullable(kind);
    }
}
