package com.umitunal.cronrelay.exception;

public class JobNotFoundException extends CronRelayException {
    private final String jobId;

    public JobNotFoundException(String jobId) {
        super("Job not found: " + jobId);
        this.jobId = jobId;
    }

    public String getJobId() {
        return jobId;
    }
}
