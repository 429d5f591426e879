package com.umitunal.cronrelay.exception;

/**
 * Raised when an update tries to change a field that is fixed at creation.
 */
public class ImmutableFieldException extends CronRelayException {
    private final String field;

    public ImmutableFieldException(String field, String message) {
        super(message);
        this.field = field;
    }

    public String getField() {
        return field;
    }
}
