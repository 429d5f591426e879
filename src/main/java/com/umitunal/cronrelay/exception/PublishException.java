package com.umitunal.cronrelay.exception;

/**
 * An event could not be appended to its stream.
 */
public class PublishException extends Exception {
    private final String streamName;

    public PublishException(String streamName, String message, Throwable cause) {
        super(message, cause);
        this.streamName = streamName;
    }

    public String getStreamName() {
        return streamName;
    }
}
