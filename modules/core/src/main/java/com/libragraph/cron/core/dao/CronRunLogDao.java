package com.libragraph.cron.core.dao;

import com.libragraph.cron.core.store.CronRunLogRecord;
import com.libragraph.cron.core.store.RunLogFilter;
import com.libragraph.cron.types.RunStatus;
import org.jdbi.v3.core.Handle;
import org.jdbi.v3.core.statement.Query;
import org.jdbi.v3.sqlobject.config.RegisterArgumentFactory;
import org.jdbi.v3.sqlobject.config.RegisterColumnMapper;
import org.jdbi.v3.sqlobject.config.RegisterConstructorMapper;
import org.jdbi.v3.sqlobject.customizer.Bind;
import org.jdbi.v3.sqlobject.statement.SqlQuery;
import org.jdbi.v3.sqlobject.statement.SqlUpdate;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

@RegisterColumnMapper(RunStatusColumnMapper.class)
@RegisterArgumentFactory(RunStatusArgumentFactory.class)
@RegisterConstructorMapper(CronRunLogRecord.class)
public interface CronRunLogDao {

    @SqlUpdate("INSERT INTO cron_run_log (id, job_id, session_id, status, started_at) " +
            "VALUES (:id, :jobId, :sessionId, :status, :startedAt)")
    void insert(@Bind("id") String id,
                @Bind("jobId") String jobId,
                @Bind("sessionId") String sessionId,
                @Bind("status") RunStatus status,
                @Bind("startedAt") Instant startedAt);

    @SqlQuery("SELECT * FROM cron_run_log WHERE id = :id")
    Optional<CronRunLogRecord> findById(@Bind("id") String id);

    @SqlQuery("SELECT started_at FROM cron_run_log WHERE id = :id")
    Optional<Instant> findStartedAt(@Bind("id") String id);

    @SqlUpdate("UPDATE cron_run_log SET status = :status, finished_at = :finishedAt, error = :error, " +
            "duration_ms = :durationMs, session_id = COALESCE(:sessionId, session_id) WHERE id = :id")
    int complete(@Bind("id") String id,
                 @Bind("sessionId") String sessionId,
                 @Bind("status") RunStatus status,
                 @Bind("finishedAt") Instant finishedAt,
                 @Bind("error") String error,
                 @Bind("durationMs") long durationMs);

    @SqlUpdate("DELETE FROM cron_run_log WHERE started_at < :cutoff")
    int deleteStartedBefore(@Bind("cutoff") Instant cutoff);

    /**
     * Runs a filtered run-log query, newest first.
     */
    default List<CronRunLogRecord> query(Handle handle, RunLogFilter filter) {
        StringBuilder sql = new StringBuilder("SELECT * FROM cron_run_log WHERE 1=1");
        if (filter.jobId() != null) sql.append(" AND job_id = :jobId");
        if (filter.status() != null) sql.append(" AND status = :status");
        sql.append(" ORDER BY started_at DESC, id DESC");
        boolean limited = filter.limit() != null && filter.limit() > 0;
        if (filter.offset() != null && filter.offset() > 0) sql.append(" OFFSET :offset ROWS");
        if (limited) sql.append(" FETCH FIRST :limit ROWS ONLY");

        Query query = handle.createQuery(sql.toString());
        if (filter.jobId() != null) query.bind("jobId", filter.jobId());
        if (filter.status() != null) query.bind("status", filter.status().label());
        if (limited) query.bind("limit", filter.limit().intValue());
        if (filter.offset() != null && filter.offset() > 0) query.bind("offset", filter.offset().intValue());
        return query
                .registerColumnMapper(new RunStatusColumnMapper())
                .mapTo(CronRunLogRecord.class)
                .list();
    }
}
