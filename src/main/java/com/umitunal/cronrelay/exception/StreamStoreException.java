package com.umitunal.cronrelay.exception;

/**
 * Failure reported by the underlying stream store.
 */
public class StreamStoreException extends Exception {

    public StreamStoreException(String message) {
        super(message);
    }

    public StreamStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
