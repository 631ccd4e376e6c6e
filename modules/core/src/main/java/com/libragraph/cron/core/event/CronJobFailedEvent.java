package com.libragraph.cron.core.event;

import com.libragraph.cron.types.RunStatus;

public record CronJobFailedEvent(String scope, String jobId, RunStatus status, String error) implements CronEvent {

    @Override
    public String name() {
        return "cron:job.failed";
    }
}
