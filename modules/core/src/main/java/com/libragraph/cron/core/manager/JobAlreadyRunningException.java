package com.libragraph.cron.core.manager;

/**
 * A firing was skipped because another firing of the same job is still in flight.
 */
public class JobAlreadyRunningException extends RuntimeException {

    private final String jobId;

    public JobAlreadyRunningException(String jobId) {
        super("Job is already running: " + jobId);
        this.jobId = jobId;
    }

    public String jobId() {
        return jobId;
    }
}
