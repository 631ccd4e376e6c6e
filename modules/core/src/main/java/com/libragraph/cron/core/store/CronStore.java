package com.libragraph.cron.core.store;

import com.libragraph.cron.core.dao.CronJobDao;
import com.libragraph.cron.core.dao.CronRunLogDao;
import com.libragraph.cron.core.dao.SchemaDao;
import com.libragraph.cron.types.CronJobStatus;
import com.libragraph.cron.types.ExecutionMode;
import com.libragraph.cron.types.RunStatus;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;
import org.jdbi.v3.core.Jdbi;
import org.jdbi.v3.core.JdbiException;

import java.sql.SQLException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Durable storage for cron jobs and their run logs.
 *
 * <p>Every mutation is a single statement, or a single transaction where a read must precede
 * the write. Transient write contention is retried here for up to {@code cron.store.busy-timeout}
 * so callers never see it.
 */
@ApplicationScoped
public class CronStore {

    private static final Logger log = Logger.getLogger(CronStore.class);

    static final Duration DEFAULT_BUSY_TIMEOUT = Duration.ofSeconds(5);
    private static final long MAX_BACKOFF_MS = 200;

    private final Jdbi jdbi;
    private final Duration busyTimeout;
    private final Clock clock;

    private volatile boolean open;

    @Inject
    public CronStore(Jdbi jdbi,
                     @ConfigProperty(name = "cron.store.busy-timeout", defaultValue = "PT5S") Duration busyTimeout) {
        this(jdbi, busyTimeout, Clock.systemUTC());
    }

    public CronStore(Jdbi jdbi) {
        this(jdbi, DEFAULT_BUSY_TIMEOUT, Clock.systemUTC());
    }

    public CronStore(Jdbi jdbi, Duration busyTimeout, Clock clock) {
        this.jdbi = jdbi;
        this.busyTimeout = busyTimeout;
        this.clock = clock;
    }

    /** Verifies connectivity and creates the schema if missing. Safe to call repeatedly. */
    public synchronized void open() {
        if (open) return;
        try {
            jdbi.useHandle(handle -> {
                SchemaDao schema = handle.attach(SchemaDao.class);
                schema.ping();
                schema.createSchema(handle);
            });
        } catch (JdbiException e) {
            throw new CronStoreException("Failed to open cron store: " + e.getMessage(), e);
        }
        open = true;
        log.info("Cron store opened");
    }

    public synchronized void close() {
        if (!open) return;
        open = false;
        log.info("Cron store closed");
    }

    public boolean isOpen() {
        return open;
    }

    /** Round-trips a trivial query. Used by the readiness check. */
    public boolean ping() {
        try {
            return jdbi.withExtension(SchemaDao.class, SchemaDao::ping) == 1;
        } catch (JdbiException e) {
            log.debugf("Cron store ping failed: %s", e.getMessage());
            return false;
        }
    }

    // -- jobs --

    public CronJobRecord createJob(CreateCronJobInput input) {
        requireOpen();
        String id = UUID.randomUUID().toString();
        Instant now = now();
        ExecutionMode mode = input.executionMode() != null ? input.executionMode() : ExecutionMode.ISOLATED;
        int maxRetries = input.maxRetries() != null ? input.maxRetries() : 0;

        return withRetry("createJob", () -> jdbi.inTransaction(handle -> {
            CronJobDao dao = handle.attach(CronJobDao.class);
            dao.insert(id, input.name(), input.description(), input.scope(), input.schedule(),
                    input.timezone(), input.taskPrompt(), input.taskContext(), mode, input.model(),
                    input.timeoutMs(), maxRetries, input.linkedScheduleId(), CronJobStatus.ACTIVE, now);
            return dao.findById(id).orElseThrow(
                    () -> new CronStoreException("Inserted job " + id + " could not be read back"));
        }));
    }

    public Optional<CronJobRecord> getJobById(String id) {
        requireOpen();
        return jdbi.withExtension(CronJobDao.class, dao -> dao.findById(id));
    }

    /** Jobs newest first; null arguments are not filtered on. */
    public List<CronJobRecord> listJobs(String scope, CronJobStatus status) {
        requireOpen();
        return jdbi.withHandle(handle -> handle.attach(CronJobDao.class).list(handle, scope, status));
    }

    public List<CronJobRecord> listActiveJobs() {
        requireOpen();
        return jdbi.withExtension(CronJobDao.class, dao -> dao.findByStatus(CronJobStatus.ACTIVE));
    }

    public int countJobs() {
        requireOpen();
        return jdbi.withExtension(CronJobDao.class, CronJobDao::count);
    }

    /** Applies a partial update. Returns the updated job, or empty if no job has this id. */
    public Optional<CronJobRecord> updateJob(String id, UpdateCronJobInput patch) {
        requireOpen();
        Instant now = now();
        return withRetry("updateJob", () -> jdbi.inTransaction(handle -> {
            CronJobDao dao = handle.attach(CronJobDao.class);
            if (dao.patch(handle, id, patch, now) == 0) {
                return Optional.<CronJobRecord>empty();
            }
            return dao.findById(id);
        }));
    }

    public void setJobStatus(String id, CronJobStatus status) {
        requireOpen();
        Instant now = now();
        withRetry("setJobStatus", () -> jdbi.withExtension(CronJobDao.class,
                dao -> dao.updateStatus(id, status, now)));
    }

    /**
     * Records a settled firing: last run time and status, run count, next run time.
     * The session id is only traced; the run log carries it durably.
     */
    public void recordJobRun(String id, String sessionId, RunStatus status, Instant nextRunAt) {
        requireOpen();
        Instant now = now();
        int updated = withRetry("recordJobRun", () -> jdbi.withExtension(CronJobDao.class,
                dao -> dao.recordRun(id, status, nextRunAt, now)));
        if (updated == 0) {
            log.debugf("Job %s vanished before its run (session=%s) could be recorded", id, sessionId);
        }
    }

    public void setNextRunAt(String id, Instant nextRunAt) {
        requireOpen();
        Instant now = now();
        withRetry("setNextRunAt", () -> jdbi.withExtension(CronJobDao.class,
                dao -> dao.updateNextRunAt(id, nextRunAt, now)));
    }

    /** Deletes the job and, through the foreign key, its run logs. */
    public boolean deleteJob(String id) {
        requireOpen();
        return withRetry("deleteJob", () -> jdbi.withExtension(CronJobDao.class, dao -> dao.delete(id))) > 0;
    }

    // -- run logs --

    public String insertRunLog(String jobId, String sessionId) {
        requireOpen();
        String id = UUID.randomUUID().toString();
        Instant now = now();
        withRetry("insertRunLog", () -> {
            jdbi.useExtension(CronRunLogDao.class,
                    dao -> dao.insert(id, jobId, sessionId, RunStatus.RUNNING, now));
            return null;
        });
        return id;
    }

    public void completeRunLog(String logId, RunStatus status, String error) {
        completeRunLog(logId, null, status, error);
    }

    /**
     * Settles a run log, deriving the duration from its stored start time.
     * A non-null session id overwrites the one recorded at insert.
     */
    public void completeRunLog(String logId, String sessionId, RunStatus status, String error) {
        requireOpen();
        Instant now = now();
        withRetry("completeRunLog", () -> jdbi.inTransaction(handle -> {
            CronRunLogDao dao = handle.attach(CronRunLogDao.class);
            long durationMs = dao.findStartedAt(logId)
                    .map(startedAt -> Math.max(0, Duration.between(startedAt, now).toMillis()))
                    .orElse(0L);
            return dao.complete(logId, sessionId, status, now, error, durationMs);
        }));
    }

    public Optional<CronRunLogRecord> getRunLog(String logId) {
        requireOpen();
        return jdbi.withExtension(CronRunLogDao.class, dao -> dao.findById(logId));
    }

    public List<CronRunLogRecord> getRunLogs(RunLogFilter filter) {
        requireOpen();
        return jdbi.withHandle(handle -> handle.attach(CronRunLogDao.class).query(handle, filter));
    }

    /** Deletes run logs started more than {@code retentionDays} days ago. */
    public int pruneRunLogs(int retentionDays) {
        requireOpen();
        Instant cutoff = now().minus(retentionDays, ChronoUnit.DAYS);
        int deleted = withRetry("pruneRunLogs", () -> jdbi.withExtension(CronRunLogDao.class,
                dao -> dao.deleteStartedBefore(cutoff)));
        if (deleted > 0) {
            log.infof("Pruned %d run log(s) older than %d day(s)", deleted, retentionDays);
        }
        return deleted;
    }

    Instant now() {
        return clock.instant();
    }

    private void requireOpen() {
        if (!open) {
            throw new IllegalStateException("Cron store is not open");
        }
    }

    <T> T withRetry(String operation, Supplier<T> work) {
        long deadline = System.nanoTime() + busyTimeout.toNanos();
        long backoffMs = 5;
        int attempt = 0;
        while (true) {
            try {
                return work.get();
            } catch (JdbiException e) {
                attempt++;
                if (!isTransient(e) || System.nanoTime() >= deadline) {
                    throw e;
                }
                log.debugf("%s hit transient contention (attempt %d), retrying in %dms: %s",
                        operation, attempt, backoffMs, e.getMessage());
                try {
                    Thread.sleep(backoffMs);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    throw new CronStoreException(operation + " interrupted while retrying", e);
                }
                backoffMs = Math.min(backoffMs * 2, MAX_BACKOFF_MS);
            }
        }
    }

    /** Serialization failure, deadlock and lock timeout are worth retrying; nothing else is. */
    static boolean isTransient(Throwable e) {
        for (Throwable t = e; t != null; t = t.getCause()) {
            if (t instanceof SQLException sql) {
                String state = sql.getSQLState();
                if (state != null && (state.startsWith("40") || state.equals("55P03") || state.equals("HYT00"))) {
                    return true;
                }
            }
        }
        return false;
    }
}
