package com.libragraph.cron.core.event;

import com.libragraph.cron.types.RunStatus;

public record CronJobExecutedEvent(String scope, String jobId, String sessionId, RunStatus status, long durationMs)
        implements CronEvent {

    @Override
    public String name() {
        return "cron:job.executed";
    }
}
