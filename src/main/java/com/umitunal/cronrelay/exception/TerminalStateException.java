package com.umitunal.cronrelay.exception;

/**
 * Raised when a job has reached a state that no longer accepts the requested transition.
 */
public class TerminalStateException extends CronRelayException {
    private final String jobId;

    public TerminalStateException(String jobId, String message) {
        super(message);
        this.jobId = jobId;
    }

    public String getJobId() {
        return jobId;
    }
}
