package com.gocam.analysis.api;

/**
 * Runtime exception thrown by a {@link ModelSource} whose content cannot be
 * parsed into a model. Fatal to that one source only.
 */
public class ModelParseException extends RuntimeException {

    public ModelParseException(String message) {
        super(message);
    }

    public ModelParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
