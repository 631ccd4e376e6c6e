package com.libragraph.cron.core.store;

import com.libragraph.cron.core.support.MutableClock;
import com.libragraph.cron.core.support.TestDatabase;
import com.libragraph.cron.types.CronJobStatus;
import com.libragraph.cron.types.ExecutionMode;
import com.libragraph.cron.types.RunStatus;
import org.jdbi.v3.core.ConnectionException;
import org.jdbi.v3.core.Jdbi;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.sql.SQLException;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CronStoreTest {

    private static final Instant START = Instant.parse("2025-03-01T12:00:00Z");

    MutableClock clock;
    Jdbi jdbi;
    CronStore store;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(START);
        jdbi = TestDatabase.create();
        store = new CronStore(jdbi, Duration.ofMillis(200), clock);
        store.open();
    }

    private CronJobRecord newJob(String name, String scope) {
        return store.createJob(CreateCronJobInput.builder(name, scope, "0 9 * * *", "Do " + name).build());
    }

    @Test
    void createJob_appliesDefaults() {
        CronJobRecord job = newJob("Daily Report", "default");

        assertThat(job.id()).isNotBlank();
        assertThat(job.status()).isEqualTo(CronJobStatus.ACTIVE);
        assertThat(job.executionMode()).isEqualTo(ExecutionMode.ISOLATED);
        assertThat(job.maxRetries()).isZero();
        assertThat(job.runCount()).isZero();
        assertThat(job.lastRunAt()).isNull();
        assertThat(job.createdAt()).isEqualTo(START);
        assertThat(job.updatedAt()).isEqualTo(START);
    }

    @Test
    void createJob_keepsOptionalFields() {
        CronJobRecord job = store.createJob(CreateCronJobInput
                .builder("Digest", "team-a", "*/15 * * * *", "Summarize inbox")
                .description("inbox digest")
                .timezone("Europe/Berlin")
                .taskContext("{\"folder\":\"inbox\"}")
                .executionMode(ExecutionMode.MAIN)
                .model("large")
                .timeoutMs(30_000L)
                .maxRetries(3)
                .linkedScheduleId("sched-1")
                .build());

        CronJobRecord read = store.getJobById(job.id()).orElseThrow();
        assertThat(read.description()).isEqualTo("inbox digest");
        assertThat(read.timezone()).isEqualTo("Europe/Berlin");
        assertThat(read.taskContext()).isEqualTo("{\"folder\":\"inbox\"}");
        assertThat(read.executionMode()).isEqualTo(ExecutionMode.MAIN);
        assertThat(read.model()).isEqualTo("large");
        assertThat(read.timeoutMs()).isEqualTo(30_000L);
        assertThat(read.maxRetries()).isEqualTo(3);
        assertThat(read.linkedScheduleId()).isEqualTo("sched-1");
    }

    @Test
    void getJobById_unknownIsEmpty() {
        assertThat(store.getJobById("missing")).isEmpty();
    }

    @Test
    void listJobs_filtersAndOrdersNewestFirst() {
        CronJobRecord a = newJob("a", "alpha");
        clock.advance(Duration.ofSeconds(1));
        CronJobRecord b = newJob("b", "alpha");
        clock.advance(Duration.ofSeconds(1));
        CronJobRecord c = newJob("c", "beta");
        store.setJobStatus(b.id(), CronJobStatus.PAUSED);

        assertThat(store.listJobs(null, null)).extracting(CronJobRecord::id)
                .containsExactly(c.id(), b.id(), a.id());
        assertThat(store.listJobs("alpha", null)).extracting(CronJobRecord::id)
                .containsExactly(b.id(), a.id());
        assertThat(store.listJobs("alpha", CronJobStatus.ACTIVE)).extracting(CronJobRecord::id)
                .containsExactly(a.id());
        assertThat(store.listActiveJobs()).extracting(CronJobRecord::id)
                .containsExactlyInAnyOrder(a.id(), c.id());
    }

    @Test
    void updateJob_patchesOnlyGivenFields() {
        CronJobRecord job = store.createJob(CreateCronJobInput
                .builder("Digest", "default", "0 9 * * *", "Summarize")
                .description("old")
                .model("small")
                .timeoutMs(1000L)
                .build());
        clock.advance(Duration.ofMinutes(1));

        CronJobRecord updated = store.updateJob(job.id(), UpdateCronJobInput.empty()
                .withSchedule("30 8 * * 1-5")
                .withDescription("")
                .withTimeoutMs(0L)).orElseThrow();

        assertThat(updated.schedule()).isEqualTo("30 8 * * 1-5");
        assertThat(updated.description()).isNull();
        assertThat(updated.timeoutMs()).isNull();
        assertThat(updated.model()).isEqualTo("small");
        assertThat(updated.name()).isEqualTo("Digest");
        assertThat(updated.updatedAt()).isEqualTo(START.plus(Duration.ofMinutes(1)));
        assertThat(updated.createdAt()).isEqualTo(START);
    }

    @Test
    void updateJob_unknownIsEmpty() {
        assertThat(store.updateJob("missing", UpdateCronJobInput.empty().withName("x"))).isEmpty();
        assertThat(store.updateJob("missing", UpdateCronJobInput.empty())).isEmpty();
    }

    @Test
    void recordJobRun_updatesRunFieldsTogether() {
        CronJobRecord job = newJob("a", "default");
        Instant next = START.plus(Duration.ofDays(1));
        clock.advance(Duration.ofSeconds(30));

        store.recordJobRun(job.id(), "session-1", RunStatus.SUCCEEDED, next);
        store.recordJobRun(job.id(), null, RunStatus.FAILED, next);

        CronJobRecord read = store.getJobById(job.id()).orElseThrow();
        assertThat(read.runCount()).isEqualTo(2);
        assertThat(read.lastRunStatus()).isEqualTo(RunStatus.FAILED);
        assertThat(read.lastRunAt()).isEqualTo(START.plusSeconds(30));
        assertThat(read.nextRunAt()).isEqualTo(next);
    }

    @Test
    void completeRunLog_derivesDuration() {
        CronJobRecord job = newJob("a", "default");
        String logId = store.insertRunLog(job.id(), null);
        assertThat(store.getRunLog(logId).orElseThrow().status()).isEqualTo(RunStatus.RUNNING);

        clock.advance(Duration.ofMillis(1500));
        store.completeRunLog(logId, "session-9", RunStatus.FAILED, "boom");

        CronRunLogRecord entry = store.getRunLog(logId).orElseThrow();
        assertThat(entry.status()).isEqualTo(RunStatus.FAILED);
        assertThat(entry.error()).isEqualTo("boom");
        assertThat(entry.sessionId()).isEqualTo("session-9");
        assertThat(entry.startedAt()).isEqualTo(START);
        assertThat(entry.finishedAt()).isEqualTo(START.plusMillis(1500));
        assertThat(entry.durationMs()).isEqualTo(1500L);
    }

    @Test
    void getRunLogs_filtersAndPages() {
        CronJobRecord a = newJob("a", "default");
        CronJobRecord b = newJob("b", "default");
        String first = store.insertRunLog(a.id(), null);
        clock.advance(Duration.ofSeconds(1));
        String second = store.insertRunLog(a.id(), null);
        clock.advance(Duration.ofSeconds(1));
        String third = store.insertRunLog(a.id(), null);
        clock.advance(Duration.ofSeconds(1));
        store.insertRunLog(b.id(), null);
        store.completeRunLog(first, RunStatus.SUCCEEDED, null);
        store.completeRunLog(third, RunStatus.SUCCEEDED, null);

        assertThat(store.getRunLogs(RunLogFilter.forJob(a.id()))).extracting(CronRunLogRecord::id)
                .containsExactly(third, second, first);
        assertThat(store.getRunLogs(RunLogFilter.forJob(a.id()).withStatus(RunStatus.SUCCEEDED)))
                .extracting(CronRunLogRecord::id)
                .containsExactly(third, first);
        assertThat(store.getRunLogs(RunLogFilter.forJob(a.id()).page(1, 1)))
                .extracting(CronRunLogRecord::id)
                .containsExactly(second);
        assertThat(store.getRunLogs(RunLogFilter.all())).hasSize(4);
        assertThat(store.getRunLogs(RunLogFilter.forJob(a.id()).page(0, 0))).hasSize(3);
        assertThat(store.getRunLogs(RunLogFilter.forJob(a.id()).page(0, 1)))
                .extracting(CronRunLogRecord::id)
                .containsExactly(second, first);
    }

    @Test
    void deleteJob_cascadesRunLogs() {
        CronJobRecord job = newJob("a", "default");
        store.insertRunLog(job.id(), null);
        store.insertRunLog(job.id(), null);

        assertThat(store.deleteJob(job.id())).isTrue();
        assertThat(store.deleteJob(job.id())).isFalse();
        assertThat(store.getJobById(job.id())).isEmpty();

        int orphans = jdbi.withHandle(h -> h.createQuery("SELECT COUNT(*) FROM cron_run_log WHERE job_id = :id")
                .bind("id", job.id())
                .mapTo(Integer.class)
                .one());
        assertThat(orphans).isZero();
    }

    @Test
    void pruneRunLogs_removesOnlyOlderThanRetention() {
        CronJobRecord job = newJob("a", "default");
        store.insertRunLog(job.id(), null);
        clock.advance(Duration.ofDays(20));
        String recent = store.insertRunLog(job.id(), null);
        clock.advance(Duration.ofDays(15));

        int deleted = store.pruneRunLogs(30);

        assertThat(deleted).isEqualTo(1);
        List<CronRunLogRecord> remaining = store.getRunLogs(RunLogFilter.forJob(job.id()));
        assertThat(remaining).extracting(CronRunLogRecord::id).containsExactly(recent);
    }

    @Test
    void open_isIdempotentAndKeepsData() {
        CronJobRecord job = newJob("a", "default");
        store.close();
        store.open();
        store.open();

        assertThat(store.getJobById(job.id())).isPresent();
    }

    @Test
    void operationsRequireOpenStore() {
        CronStore closed = new CronStore(TestDatabase.create());

        assertThatThrownBy(() -> closed.listJobs(null, null))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("not open");
    }

    @Test
    void withRetry_retriesTransientFailureUntilItSucceeds() {
        AtomicInteger attempts = new AtomicInteger();

        String result = store.withRetry("test", () -> {
            if (attempts.incrementAndGet() <= 3) {
                throw new ConnectionException(new SQLException("could not serialize access", "40001"));
            }
            return "done";
        });

        assertThat(result).isEqualTo("done");
        assertThat(attempts).hasValue(4);
    }

    @Test
    void withRetry_givesUpAfterBusyTimeout() {
        AtomicInteger attempts = new AtomicInteger();
        long started = System.nanoTime();

        assertThatThrownBy(() -> store.withRetry("test", () -> {
            attempts.incrementAndGet();
            throw new ConnectionException(new SQLException("could not serialize access", "40001"));
        })).isInstanceOf(ConnectionException.class);

        assertThat(Duration.ofNanos(System.nanoTime() - started)).isGreaterThanOrEqualTo(Duration.ofMillis(200));
        assertThat(attempts.get()).isGreaterThan(1);
    }

    @Test
    void withRetry_doesNotRetryPermanentFailure() {
        AtomicInteger attempts = new AtomicInteger();

        assertThatThrownBy(() -> store.withRetry("test", () -> {
            attempts.incrementAndGet();
            throw new ConnectionException(new SQLException("duplicate key", "23505"));
        })).isInstanceOf(ConnectionException.class);

        assertThat(attempts).hasValue(1);
    }

    @Test
    void transientSqlStates() {
        assertThat(CronStore.isTransient(new SQLException("serialization", "40001"))).isTrue();
        assertThat(CronStore.isTransient(new SQLException("deadlock", "40P01"))).isTrue();
        assertThat(CronStore.isTransient(new SQLException("lock", "55P03"))).isTrue();
        assertThat(CronStore.isTransient(new RuntimeException(new SQLException("lock timeout", "HYT00")))).isTrue();
        assertThat(CronStore.isTransient(new SQLException("unique", "23505"))).isFalse();
        assertThat(CronStore.isTransient(new RuntimeException("no sql"))).isFalse();
    }
}
