package com.libragraph.cron.core.manager;

import com.libragraph.cron.types.RunStatus;

/**
 * The execution engine failed a manually triggered run. The failure is already recorded in the run log.
 */
public class JobExecutionException extends RuntimeException {

    private final String jobId;
    private final RunStatus status;

    public JobExecutionException(String jobId, RunStatus status, String message, Throwable cause) {
        super("Job " + jobId + " " + status.label() + ": " + message, cause);
        this.jobId = jobId;
        this.status = status;
    }

    public String jobId() {
        return jobId;
    }

    public RunStatus status() {
        return status;
    }
}
