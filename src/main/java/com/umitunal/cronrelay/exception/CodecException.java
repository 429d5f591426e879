package com.umitunal.cronrelay.exception;

/**
 * A value could not be encoded or decoded.
 */
public class CodecException extends CronRelayException {

    public CodecException(String message, Throwable cause) {
        super(message, cause);
    }
}
