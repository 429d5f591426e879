package com.umitunal.cronrelay.exception;

/**
 * Time text that does not match its expected notation.
 */
public class FormatException extends CronRelayException {
    private final String input;
    private final String expectedFormat;

    public FormatException(String input, String expectedFormat, String message) {
        super(message);
        this.input = input;
        this.expectedFormat = expectedFormat;
    }

    public String getInput() { return input; }
    public String getExpectedFormat() { return expectedFormat; }
}
