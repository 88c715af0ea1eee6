package com.metaperception.core.exception;

/**
 * Raised by input validation when a {@code MetaPerceptionInput} cannot enter the pipeline:
 * missing timestamp, blank feature names, non-finite values, decisions without an action.
 */
public class InvalidPerceptionInputException extends RuntimeException {
    private final String field;

    public InvalidPerceptionInputException(String field, String message) {
        super("[" + field + "] " + message);
        this.field = field;
    }

    public String getField() {
        return field;
    }
}
