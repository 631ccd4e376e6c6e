package com.libragraph.cron.core.store;

import com.libragraph.cron.types.RunStatus;
import org.jdbi.v3.core.mapper.reflect.ColumnName;

import java.time.Instant;

public record CronRunLogRecord(
        @ColumnName("id") String id,
        @ColumnName("job_id") String jobId,
        @ColumnName("session_id") String sessionId,
        @ColumnName("status") RunStatus status,
        @ColumnName("started_at") Instant startedAt,
        @ColumnName("finished_at") Instant finishedAt,
        @ColumnName("error") String error,
        @ColumnName("duration_ms") Long durationMs
) {}
