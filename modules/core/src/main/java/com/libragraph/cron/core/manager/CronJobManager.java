package com.libragraph.cron.core.manager;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.libragraph.cron.core.event.CronEventSink;
import com.libragraph.cron.core.event.CronJobCreatedEvent;
import com.libragraph.cron.core.event.CronJobExecutedEvent;
import com.libragraph.cron.core.event.CronJobFailedEvent;
import com.libragraph.cron.core.execution.ExecutionContext;
import com.libragraph.cron.core.execution.ExecutionEngine;
import com.libragraph.cron.core.execution.ExecutionResult;
import com.libragraph.cron.core.recovery.RecoveryClassifier;
import com.libragraph.cron.core.schedule.CronEngine;
import com.libragraph.cron.core.schedule.ScheduleRegistry;
import com.libragraph.cron.core.store.CreateCronJobInput;
import com.libragraph.cron.core.store.CronJobRecord;
import com.libragraph.cron.core.store.CronRunLogRecord;
import com.libragraph.cron.core.store.CronStore;
import com.libragraph.cron.core.store.RunLogFilter;
import com.libragraph.cron.core.store.UpdateCronJobInput;
import com.libragraph.cron.types.CronJobStatus;
import com.libragraph.cron.types.RunStatus;
import com.libragraph.cron.util.JobSchedule;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import java.time.Clock;
import java.time.DateTimeException;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Owns the runtime schedule of every job and the pipeline that fires them.
 *
 * <p>A job is either scheduled (status {@code active}, timer registered), paused (status
 * {@code paused}, no timer) or {@code completed}, which only one-shot jobs reach. Every firing,
 * whether from a timer, startup recovery or {@link #triggerManually}, runs the same pipeline:
 * take the job's in-flight guard, open a run log, delegate to the {@link ExecutionEngine},
 * record the settlement, release the guard, then announce the outcome.
 *
 * <p>At most one firing per job is in flight; a fire that finds the guard held is skipped.
 */
@ApplicationScoped
public class CronJobManager {

    private static final Logger log = Logger.getLogger(CronJobManager.class);

    public enum State { NEW, STARTING, RUNNING, STOPPED }

    private final CronStore store;
    private final CronEngine cronEngine;
    private final CronEventSink eventSink;
    private final ObjectMapper objectMapper;
    private final RecoveryClassifier classifier;
    private final Clock clock;

    private final ScheduleRegistry registry = new ScheduleRegistry();
    private final Set<String> inFlight = ConcurrentHashMap.newKeySet();
    private final AtomicReference<State> state = new AtomicReference<>(State.NEW);
    private volatile ExecutionEngine executionEngine;

    @Inject
    public CronJobManager(CronStore store,
                          CronEngine cronEngine,
                          CronEventSink eventSink,
                          ObjectMapper objectMapper,
                          @ConfigProperty(name = "cron.recovery.grace-period", defaultValue = "PT10M")
                          Duration gracePeriod) {
        this(store, cronEngine, eventSink, objectMapper, new RecoveryClassifier(gracePeriod), Clock.systemUTC());
    }

    public CronJobManager(CronStore store,
                          CronEngine cronEngine,
                          CronEventSink eventSink,
                          ObjectMapper objectMapper,
                          RecoveryClassifier classifier,
                          Clock clock) {
        this.store = store;
        this.cronEngine = cronEngine;
        this.eventSink = eventSink;
        this.objectMapper = objectMapper;
        this.classifier = classifier;
        this.clock = clock;
    }

    // -- lifecycle --

    /**
     * Opens the store and schedules every active job. One-shot jobs go through recovery
     * classification; recurring jobs with an invalid expression are logged and skipped.
     * Calling it again while running is a no-op.
     *
     * @throws com.libragraph.cron.core.store.CronStoreException if the store cannot be opened
     */
    public void init(ExecutionEngine engine) {
        Objects.requireNonNull(engine, "engine cannot be null");
        if (!state.compareAndSet(State.NEW, State.STARTING)) {
            State current = state.get();
            if (current == State.STOPPED) {
                throw new IllegalStateException("Cron job manager has been shut down");
            }
            log.debugf("Cron job manager already %s, ignoring init", current);
            return;
        }

        try {
            store.open();
        } catch (RuntimeException e) {
            state.set(State.NEW);
            log.errorf(e, "Cron job manager failed to open its store");
            throw e;
        }
        executionEngine = engine;
        state.set(State.RUNNING);

        List<CronJobRecord> activeJobs = store.listActiveJobs();
        for (CronJobRecord job : activeJobs) {
            try {
                scheduleJob(job);
            } catch (RuntimeException e) {
                log.errorf(e, "Failed to schedule job %s (%s), skipping", job.id(), job.name());
            }
        }
        log.infof("Cron job manager initialized with %d active job(s), %d timer(s) registered",
                activeJobs.size(), registry.size());
    }

    /** Stops every timer and the engine threads, then closes the store. Idempotent. */
    public void shutdown() {
        State previous = state.getAndSet(State.STOPPED);
        if (previous == State.STOPPED) return;

        registry.stopAll();
        cronEngine.close();
        store.close();
        executionEngine = null;
        log.info("Cron job manager shut down");
    }

    public State state() {
        return state.get();
    }

    public boolean isRunning() {
        return state.get() == State.RUNNING;
    }

    /** Number of jobs with a live timer. */
    public int registeredJobCount() {
        return registry.size();
    }

    public boolean isRegistered(String jobId) {
        return registry.isRegistered(jobId);
    }

    // -- job management --

    /**
     * Validates, persists and schedules a new job, then announces it.
     *
     * @throws JobValidationException if the schedule, timezone or a required field is invalid
     */
    public CronJobRecord createJob(CreateCronJobInput input) {
        requireRunning();
        requireText(input.name(), "name");
        requireText(input.scope(), "scope");
        requireText(input.taskPrompt(), "taskPrompt");
        validateSchedule(input.schedule(), input.timezone());

        CronJobRecord job = store.createJob(input);
        scheduleJob(job);
        log.infof("Cron job created: %s (%s) schedule=%s", job.id(), job.name(), job.schedule());
        eventSink.emit(new CronJobCreatedEvent(job.scope(), job.id(), job.name(), job.schedule()));
        return store.getJobById(job.id()).orElse(job);
    }

    /**
     * Patches a job and re-registers its timer if it is active.
     * Returns empty for an unknown id.
     *
     * @throws JobValidationException if the resulting schedule or timezone is invalid
     */
    public Optional<CronJobRecord> updateJob(String id, UpdateCronJobInput patch) {
        requireRunning();
        Optional<CronJobRecord> existing = store.getJobById(id);
        if (existing.isEmpty()) return Optional.empty();

        if (patch.name() != null) requireText(patch.name(), "name");
        if (patch.taskPrompt() != null) requireText(patch.taskPrompt(), "taskPrompt");
        if (patch.schedule() != null || patch.timezone() != null) {
            String schedule = patch.schedule() != null ? patch.schedule() : existing.get().schedule();
            String timezone = patch.timezone() != null ? patch.timezone() : existing.get().timezone();
            validateSchedule(schedule, timezone);
        }

        Optional<CronJobRecord> updated = store.updateJob(id, patch);
        if (updated.isEmpty()) return Optional.empty();

        registry.unregister(id);
        if (updated.get().status() == CronJobStatus.ACTIVE) {
            scheduleJob(updated.get());
        }
        log.infof("Cron job updated: %s", id);
        return store.getJobById(id);
    }

    /**
     * Stops the job's timer and marks it paused. Pausing a paused or completed job returns
     * it unchanged. Returns empty for an unknown id.
     */
    public Optional<CronJobRecord> pauseJob(String id) {
        requireRunning();
        Optional<CronJobRecord> job = store.getJobById(id);
        if (job.isEmpty() || job.get().status() != CronJobStatus.ACTIVE) return job;

        registry.unregister(id);
        store.setJobStatus(id, CronJobStatus.PAUSED);
        log.infof("Cron job paused: %s", id);
        return store.getJobById(id);
    }

    /**
     * Marks a paused job active and registers its timer. Resuming an active or completed job
     * returns it unchanged. Returns empty for an unknown id.
     */
    public Optional<CronJobRecord> resumeJob(String id) {
        requireRunning();
        Optional<CronJobRecord> job = store.getJobById(id);
        if (job.isEmpty() || job.get().status() != CronJobStatus.PAUSED) return job;

        store.setJobStatus(id, CronJobStatus.ACTIVE);
        store.getJobById(id).ifPresent(this::scheduleJob);
        log.infof("Cron job resumed: %s", id);
        return store.getJobById(id);
    }

    /** Stops the job's timer and deletes it with its run logs. Returns whether a row was removed. */
    public boolean deleteJob(String id) {
        requireRunning();
        registry.unregister(id);
        boolean removed = store.deleteJob(id);
        if (removed) log.infof("Cron job deleted: %s", id);
        return removed;
    }

    /**
     * Fires the job now through the regular pipeline. The future completes with the session id,
     * with {@code null} for an unknown or completed job, or exceptionally with
     * {@link JobAlreadyRunningException} or {@link JobExecutionException}.
     */
    public CompletableFuture<String> triggerManually(String id) {
        requireRunning();
        Optional<CronJobRecord> job = store.getJobById(id);
        if (job.isEmpty()) {
            return CompletableFuture.completedFuture(null);
        }
        if (job.get().status() == CronJobStatus.COMPLETED) {
            log.infof("Job %s (%s) is completed, ignoring manual trigger", id, job.get().name());
            return CompletableFuture.completedFuture(null);
        }
        log.infof("Manually triggering job %s (%s)", id, job.get().name());
        return execute(job.get());
    }

    public Optional<CronJobRecord> getJob(String id) {
        requireRunning();
        return store.getJobById(id);
    }

    public List<CronJobRecord> listJobs(String scope, CronJobStatus status) {
        requireRunning();
        return store.listJobs(scope, status);
    }

    public List<CronRunLogRecord> getRunLogs(RunLogFilter filter) {
        requireRunning();
        return store.getRunLogs(filter);
    }

    public int pruneRunLogs(int retentionDays) {
        requireRunning();
        return store.pruneRunLogs(retentionDays);
    }

    // -- scheduling --

    private void scheduleJob(CronJobRecord job) {
        if (job.isOnce()) {
            scheduleOnce(job);
        } else {
            scheduleRecurring(job);
        }
    }

    private void scheduleRecurring(CronJobRecord job) {
        if (!cronEngine.validate(job.schedule())) {
            log.warnf("Job %s (%s) has an invalid cron expression '%s', not scheduling it",
                    job.id(), job.name(), job.schedule());
            return;
        }
        ZoneId zone;
        try {
            zone = zoneOf(job.timezone());
        } catch (DateTimeException e) {
            log.warnf("Job %s (%s) has an invalid timezone '%s', not scheduling it",
                    job.id(), job.name(), job.timezone());
            return;
        }

        String jobId = job.id();
        registry.register(jobId, cronEngine.schedule(job.schedule(), zone, () -> fire(jobId)));
        store.setNextRunAt(jobId, cronEngine.nextFireTime(job.schedule(), zone, clock.instant()).orElse(null));
    }

    private void scheduleOnce(CronJobRecord job) {
        Instant fireAt;
        try {
            fireAt = JobSchedule.parse(job.schedule(), zoneOf(job.timezone())).fireAt();
        } catch (IllegalArgumentException | DateTimeException e) {
            log.warnf("Job %s (%s) has an unparsable one-shot time '%s', marking it completed",
                    job.id(), job.name(), job.schedule());
            store.setJobStatus(job.id(), CronJobStatus.COMPLETED);
            return;
        }

        String jobId = job.id();
        Instant now = clock.instant();
        switch (classifier.classify(fireAt, now)) {
            case FUTURE -> {
                registry.register(jobId, cronEngine.scheduleOnce(Duration.between(now, fireAt), () -> fire(jobId)));
                store.setNextRunAt(jobId, fireAt);
            }
            case RECOVER -> {
                log.infof("Recovering missed one-shot job %s (%s), overdue by %ds",
                        jobId, job.name(), Duration.between(fireAt, now).toSeconds());
                fire(jobId);
            }
            case STALE -> {
                log.infof("One-shot job %s (%s) missed its time by %d min, marking it completed without running",
                        jobId, job.name(), Duration.between(fireAt, now).toMinutes());
                store.setJobStatus(jobId, CronJobStatus.COMPLETED);
            }
        }
    }

    /** Timer callback. Reloads the job so a fire always sees its latest definition. */
    private void fire(String jobId) {
        if (!isRunning()) return;
        Optional<CronJobRecord> job;
        try {
            job = store.getJobById(jobId);
        } catch (RuntimeException e) {
            log.errorf(e, "Could not load job %s for firing", jobId);
            return;
        }
        if (job.isEmpty() || job.get().status() != CronJobStatus.ACTIVE) {
            log.debugf("Job %s is gone or no longer active, dropping fire", jobId);
            return;
        }

        execute(job.get()).exceptionally(e -> {
            Throwable cause = unwrap(e);
            if (cause instanceof JobAlreadyRunningException) {
                log.warnf("Job %s (%s) is still running, skipping this fire", jobId, job.get().name());
            } else if (!(cause instanceof JobExecutionException)) {
                log.errorf(cause, "Firing of job %s failed", jobId);
            }
            return null;
        });
    }

    // -- firing pipeline --

    private CompletableFuture<String> execute(CronJobRecord job) {
        String jobId = job.id();
        if (!inFlight.add(jobId)) {
            return CompletableFuture.failedFuture(new JobAlreadyRunningException(jobId));
        }

        Instant startedAt = clock.instant();
        String runLogId;
        try {
            runLogId = store.insertRunLog(jobId, null);
        } catch (RuntimeException e) {
            inFlight.remove(jobId);
            return CompletableFuture.failedFuture(e);
        }

        CompletionStage<ExecutionResult> stage;
        try {
            ExecutionEngine engine = executionEngine;
            if (engine == null) {
                throw new IllegalStateException("No execution engine available");
            }
            stage = engine.trigger(ExecutionContext.forJob(job, objectMapper));
            if (stage == null) {
                throw new IllegalStateException("Execution engine returned no result");
            }
        } catch (RuntimeException e) {
            stage = CompletableFuture.failedFuture(e);
        }

        CompletableFuture<String> result = new CompletableFuture<>();
        stage.whenComplete((executionResult, error) -> {
            Throwable cause = error == null ? null : unwrap(error);
            RunStatus status = cause == null ? RunStatus.SUCCEEDED
                    : cause instanceof TimeoutException ? RunStatus.TIMEOUT : RunStatus.FAILED;
            String sessionId = executionResult != null ? executionResult.sessionId() : null;
            String errorMessage = cause == null ? null : describe(cause);

            try {
                recordSettlement(job, runLogId, sessionId, status, errorMessage);
            } catch (RuntimeException e) {
                log.errorf(e, "Could not record run %s of job %s", runLogId, jobId);
            } finally {
                inFlight.remove(jobId);
            }

            long durationMs = Math.max(0, Duration.between(startedAt, clock.instant()).toMillis());
            if (cause == null) {
                log.infof("Cron job executed: %s (%s) session=%s in %dms", jobId, job.name(), sessionId, durationMs);
                eventSink.emit(new CronJobExecutedEvent(job.scope(), jobId, sessionId, status, durationMs));
                result.complete(sessionId);
            } else {
                log.errorf("Cron job %s (%s) %s: %s", jobId, job.name(), status.label(), errorMessage);
                eventSink.emit(new CronJobFailedEvent(job.scope(), jobId, status, errorMessage));
                result.completeExceptionally(new JobExecutionException(jobId, status, errorMessage, cause));
            }
        });
        return result;
    }

    /**
     * Settles against the job as it is now, not as it was when fired: a schedule changed while
     * the run was in flight keeps its new timer, and only the one-shot time that actually fired
     * completes the job.
     */
    private void recordSettlement(CronJobRecord fired, String runLogId, String sessionId,
                                  RunStatus status, String errorMessage) {
        store.completeRunLog(runLogId, sessionId, status, errorMessage);
        Optional<CronJobRecord> current = store.getJobById(fired.id());
        if (current.isEmpty()) {
            log.debugf("Job %s was deleted while running", fired.id());
            return;
        }
        CronJobRecord job = current.get();
        if (job.isOnce() && job.schedule().equals(fired.schedule())) {
            store.recordJobRun(job.id(), sessionId, status, null);
            store.setJobStatus(job.id(), CronJobStatus.COMPLETED);
            registry.unregister(job.id());
        } else {
            store.recordJobRun(job.id(), sessionId, status, nextFireTime(job));
        }
    }

    private Instant nextFireTime(CronJobRecord job) {
        try {
            ZoneId zone = zoneOf(job.timezone());
            if (job.isOnce()) {
                return JobSchedule.parse(job.schedule(), zone).fireAt();
            }
            return cronEngine.nextFireTime(job.schedule(), zone, clock.instant()).orElse(null);
        } catch (IllegalArgumentException | DateTimeException e) {
            log.debugf("No next fire time for job %s: %s", job.id(), e.getMessage());
            return null;
        }
    }

    // -- validation --

    private void validateSchedule(String schedule, String timezone) {
        if (schedule == null || schedule.isBlank()) {
            throw new JobValidationException("Schedule cannot be blank");
        }
        ZoneId zone;
        try {
            zone = zoneOf(timezone);
        } catch (DateTimeException e) {
            throw new JobValidationException("Invalid timezone: " + timezone, e);
        }
        if (JobSchedule.isOnce(schedule)) {
            try {
                JobSchedule.parse(schedule, zone);
            } catch (IllegalArgumentException e) {
                throw new JobValidationException(e.getMessage(), e);
            }
        } else if (!cronEngine.validate(schedule)) {
            throw new JobValidationException("Invalid cron expression: " + schedule);
        }
    }

    private static void requireText(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new JobValidationException(field + " cannot be blank");
        }
    }

    private static ZoneId zoneOf(String timezone) {
        return timezone == null || timezone.isBlank() ? ZoneId.systemDefault() : ZoneId.of(timezone);
    }

    private void requireRunning() {
        if (!isRunning()) {
            throw new IllegalStateException("Cron job manager is not running (state=" + state.get() + ")");
        }
    }

    private static Throwable unwrap(Throwable e) {
        Throwable current = e;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    private static String describe(Throwable e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }
}
