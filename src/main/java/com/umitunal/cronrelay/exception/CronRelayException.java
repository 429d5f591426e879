package com.umitunal.cronrelay.exception;

/**
 * Base type for errors reported synchronously to callers of the scheduler and codecs.
 */
public class CronRelayException extends RuntimeException {

    public CronRelayException(String message) {
        super(message);
    }

    public CronRelayException(String message, Throwable cause) {
        super(message, cause);
    }
}
