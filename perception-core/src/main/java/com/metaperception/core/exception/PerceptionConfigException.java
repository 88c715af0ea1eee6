package com.metaperception.core.exception;

/**
 * Raised when a {@link com.metaperception.core.config.PerceptionConfig} is malformed
 * (negative weights, non-positive thresholds or windows). Configuration is validated
 * once at construction so the pipeline never sees an invalid object.
 */
public class PerceptionConfigException extends RuntimeException {
    private final String field;

    public PerceptionConfigException(String field, String message) {
        super("[" + field + "] " + message);
        this.field = field;
    }

    public String getField() {
        return field;
    }
}
