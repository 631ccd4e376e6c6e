package com.libragraph.cron.core.event;

/**
 * Announcement about a cron job's lifecycle, delivered best-effort.
 */
public sealed interface CronEvent permits CronJobCreatedEvent, CronJobExecutedEvent, CronJobFailedEvent {

    /** Channel name, e.g. {@code cron:job.created}. */
    String name();

    String scope();

    String jobId();
}
