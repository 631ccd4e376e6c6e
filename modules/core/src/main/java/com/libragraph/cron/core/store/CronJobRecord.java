package com.libragraph.cron.core.store;

import com.libragraph.cron.types.CronJobStatus;
import com.libragraph.cron.types.ExecutionMode;
import com.libragraph.cron.types.RunStatus;
import com.libragraph.cron.util.JobSchedule;
import org.jdbi.v3.core.mapper.reflect.ColumnName;

import java.time.Instant;

public record CronJobRecord(
        @ColumnName("id") String id,
        @ColumnName("name") String name,
        @ColumnName("description") String description,
        @ColumnName("scope") String scope,
        @ColumnName("schedule") String schedule,
        @ColumnName("timezone") String timezone,
        @ColumnName("task_prompt") String taskPrompt,
        @ColumnName("task_context") String taskContext,
        @ColumnName("execution_mode") ExecutionMode executionMode,
        @ColumnName("model") String model,
        @ColumnName("timeout_ms") Long timeoutMs,
        @ColumnName("max_retries") int maxRetries,
        @ColumnName("linked_schedule_id") String linkedScheduleId,
        @ColumnName("status") CronJobStatus status,
        @ColumnName("last_run_at") Instant lastRunAt,
        @ColumnName("last_run_status") RunStatus lastRunStatus,
        @ColumnName("next_run_at") Instant nextRunAt,
        @ColumnName("run_count") int runCount,
        @ColumnName("created_at") Instant createdAt,
        @ColumnName("updated_at") Instant updatedAt
) {

    public boolean isOnce() {
        return JobSchedule.isOnce(schedule);
    }
}
