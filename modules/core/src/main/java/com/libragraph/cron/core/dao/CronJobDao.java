package com.libragraph.cron.core.dao;

import com.libragraph.cron.core.store.CronJobRecord;
import com.libragraph.cron.core.store.UpdateCronJobInput;
import com.libragraph.cron.types.CronJobStatus;
import com.libragraph.cron.types.ExecutionMode;
import com.libragraph.cron.types.RunStatus;
import org.jdbi.v3.core.Handle;
import org.jdbi.v3.core.statement.Query;
import org.jdbi.v3.core.statement.Update;
import org.jdbi.v3.sqlobject.config.RegisterArgumentFactory;
import org.jdbi.v3.sqlobject.config.RegisterColumnMapper;
import org.jdbi.v3.sqlobject.config.RegisterConstructorMapper;
import org.jdbi.v3.sqlobject.customizer.Bind;
import org.jdbi.v3.sqlobject.statement.SqlQuery;
import org.jdbi.v3.sqlobject.statement.SqlUpdate;

import java.sql.Types;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@RegisterColumnMapper(CronJobStatusColumnMapper.class)
@RegisterColumnMapper(ExecutionModeColumnMapper.class)
@RegisterColumnMapper(RunStatusColumnMapper.class)
@RegisterArgumentFactory(CronJobStatusArgumentFactory.class)
@RegisterArgumentFactory(ExecutionModeArgumentFactory.class)
@RegisterArgumentFactory(RunStatusArgumentFactory.class)
@RegisterConstructorMapper(CronJobRecord.class)
public interface CronJobDao {

    @SqlUpdate("INSERT INTO cron_jobs (id, name, description, scope, schedule, timezone, task_prompt, " +
            "task_context, execution_mode, model, timeout_ms, max_retries, linked_schedule_id, status, " +
            "run_count, created_at, updated_at) " +
            "VALUES (:id, :name, :description, :scope, :schedule, :timezone, :taskPrompt, " +
            ":taskContext, :executionMode, :model, :timeoutMs, :maxRetries, :linkedScheduleId, :status, " +
            "0, :now, :now)")
    void insert(@Bind("id") String id,
                @Bind("name") String name,
                @Bind("description") String description,
                @Bind("scope") String scope,
                @Bind("schedule") String schedule,
                @Bind("timezone") String timezone,
                @Bind("taskPrompt") String taskPrompt,
                @Bind("taskContext") String taskContext,
                @Bind("executionMode") ExecutionMode executionMode,
                @Bind("model") String model,
                @Bind("timeoutMs") Long timeoutMs,
                @Bind("maxRetries") int maxRetries,
                @Bind("linkedScheduleId") String linkedScheduleId,
                @Bind("status") CronJobStatus status,
                @Bind("now") Instant now);

    @SqlQuery("SELECT * FROM cron_jobs WHERE id = :id")
    Optional<CronJobRecord> findById(@Bind("id") String id);

    @SqlQuery("SELECT * FROM cron_jobs WHERE status = :status ORDER BY created_at")
    List<CronJobRecord> findByStatus(@Bind("status") CronJobStatus status);

    @SqlUpdate("UPDATE cron_jobs SET status = :status, updated_at = :now WHERE id = :id")
    int updateStatus(@Bind("id") String id, @Bind("status") CronJobStatus status, @Bind("now") Instant now);

    @SqlUpdate("UPDATE cron_jobs SET last_run_at = :now, last_run_status = :runStatus, " +
            "run_count = run_count + 1, next_run_at = :nextRunAt, updated_at = :now WHERE id = :id")
    int recordRun(@Bind("id") String id,
                  @Bind("runStatus") RunStatus runStatus,
                  @Bind("nextRunAt") Instant nextRunAt,
                  @Bind("now") Instant now);

    @SqlUpdate("UPDATE cron_jobs SET next_run_at = :nextRunAt, updated_at = :now WHERE id = :id")
    int updateNextRunAt(@Bind("id") String id, @Bind("nextRunAt") Instant nextRunAt, @Bind("now") Instant now);

    @SqlUpdate("DELETE FROM cron_jobs WHERE id = :id")
    int delete(@Bind("id") String id);

    @SqlQuery("SELECT COUNT(*) FROM cron_jobs")
    int count();

    /**
     * Lists jobs newest first, optionally narrowed to one scope and/or status.
     */
    default List<CronJobRecord> list(Handle handle, String scope, CronJobStatus status) {
        StringBuilder sql = new StringBuilder("SELECT * FROM cron_jobs WHERE 1=1");
        if (scope != null) sql.append(" AND scope = :scope");
        if (status != null) sql.append(" AND status = :status");
        sql.append(" ORDER BY created_at DESC, id");

        Query query = handle.createQuery(sql.toString());
        if (scope != null) query.bind("scope", scope);
        if (status != null) query.bind("status", status.label());
        return query
                .registerColumnMapper(new CronJobStatusColumnMapper())
                .registerColumnMapper(new ExecutionModeColumnMapper())
                .registerColumnMapper(new RunStatusColumnMapper())
                .mapTo(CronJobRecord.class)
                .list();
    }

    /**
     * Applies a partial update in a single statement. Returns the number of rows touched,
     * which is 1 even when the patch is empty so callers can tell a missing job apart.
     */
    default int patch(Handle handle, String id, UpdateCronJobInput patch, Instant now) {
        Map<String, Object> columns = new LinkedHashMap<>();
        if (patch.name() != null) columns.put("name", patch.name());
        if (patch.description() != null) {
            columns.put("description", patch.description().isEmpty() ? null : patch.description());
        }
        if (patch.schedule() != null) columns.put("schedule", patch.schedule());
        if (patch.timezone() != null) {
            columns.put("timezone", patch.timezone().isEmpty() ? null : patch.timezone());
        }
        if (patch.taskPrompt() != null) columns.put("task_prompt", patch.taskPrompt());
        if (patch.taskContext() != null) {
            columns.put("task_context", patch.taskContext().isEmpty() ? null : patch.taskContext());
        }
        if (patch.executionMode() != null) columns.put("execution_mode", patch.executionMode().label());
        if (patch.model() != null) {
            columns.put("model", patch.model().isEmpty() ? null : patch.model());
        }
        if (patch.timeoutMs() != null) columns.put("timeout_ms", patch.timeoutMs() == 0 ? null : patch.timeoutMs());
        if (patch.maxRetries() != null) columns.put("max_retries", patch.maxRetries());
        if (patch.linkedScheduleId() != null) {
            columns.put("linked_schedule_id", patch.linkedScheduleId().isEmpty() ? null : patch.linkedScheduleId());
        }

        List<String> sets = new ArrayList<>();
        for (String column : columns.keySet()) {
            sets.add(column + " = :" + column);
        }
        sets.add("updated_at = :updatedAt");

        String sql = "UPDATE cron_jobs SET " + String.join(", ", sets) + " WHERE id = :id";
        Update update = handle.createUpdate(sql)
                .bind("id", id)
                .bind("updatedAt", now);
        columns.forEach((column, value) -> {
            if (value == null) {
                update.bindNull(column, column.equals("timeout_ms") ? Types.BIGINT : Types.VARCHAR);
            } else {
                update.bind(column, value);
            }
        });
        return update.execute();
    }
}
