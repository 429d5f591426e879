package com.umitunal.cronrelay.model;

import com.umitunal.cronrelay.exception.ValidationException;

/**
 * Whether a job repeats on a cron schedule or fires once at a fixed instant.
 */
public enum JobKind {
    RECURRING("recurring"),
    ONE_TIME("one-time");

    private final String value;

    JobKind(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    /**
     * @throws ValidationException for anything other than {@code recurring} or {@code one-time}
     */
    public static JobKind fromValue(String value) {
        for (JobKind kind : values()) {
            if (kind.value.equalsIgnoreCase(value) || kind.name().equalsIgnoreCase(value)) {
                return kind;
            }
        }
        throw new ValidationException("kind",
                "Invalid job type: " + value + ". Must be either \"recurring\" or \"one-time\"");
    }

    @Override
    public String toString() {
        return value;
    }
}
