package com.umitunal.cronrelay.exception;

/**
 * A relative duration that parses but is not usable, such as a zero duration.
 */
public class DurationException extends FormatException {

    public DurationException(String input, String expectedFormat, String message) {
        super(input, expectedFormat, message);
    }
}
