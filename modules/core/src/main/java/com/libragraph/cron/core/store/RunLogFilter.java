package com.libragraph.cron.core.store;

import com.libragraph.cron.types.RunStatus;

/**
 * Run-log query. Null fields are not filtered on; a null or non-positive limit
 * returns every matching row.
 */
public record RunLogFilter(String jobId, RunStatus status, Integer limit, Integer offset) {

    public static RunLogFilter all() {
        return new RunLogFilter(null, null, null, null);
    }

    public static RunLogFilter forJob(String jobId) {
        return new RunLogFilter(jobId, null, null, null);
    }

    public RunLogFilter withStatus(RunStatus status) {
        return new RunLogFilter(jobId, status, limit, offset);
    }

    public RunLogFilter page(int limit, int offset) {
        return new RunLogFilter(jobId, status, limit, offset);
    }
}
