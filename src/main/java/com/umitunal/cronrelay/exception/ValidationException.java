package com.umitunal.cronrelay.exception;

/**
 * Malformed or out-of-range input that the caller can correct.
 */
public class ValidationException extends CronRelayException {
    private final String field;

    public ValidationException(String field, String message) {
        super(message);
        this.field = field;
    }

    public ValidationException(String field, String message, Throwable cause) {
        super(message, cause);
        this.field = field;
    }

    /**
     * Name of the offending field, or null when the error is not tied to one field.
     */
    public String getField() {
        return field;
    }
}
