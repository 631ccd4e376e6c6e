package com.libragraph.cron.core.event;

public record CronJobCreatedEvent(String scope, String jobId, String jobName, String schedule) implements CronEvent {

    @Override
    public String name() {
        return "cron:job.created";
    }
}
