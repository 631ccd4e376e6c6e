package com.libragraph.cron.core.schedule;

import com.cronutils.model.Cron;
import com.cronutils.model.CronType;
import com.cronutils.model.definition.CronDefinitionBuilder;
import com.cronutils.model.time.ExecutionTime;
import com.cronutils.parser.CronParser;
import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.Optional;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * {@link CronEngine} backed by cron-utils (UNIX definition) and a scheduled thread pool.
 * Recurring timers re-arm themselves from the tick that just fired.
 */
@ApplicationScoped
public class CronUtilsEngine implements CronEngine {

    private static final Logger log = Logger.getLogger(CronUtilsEngine.class);

    private final CronParser parser = new CronParser(CronDefinitionBuilder.instanceDefinitionFor(CronType.UNIX));
    private final ScheduledThreadPoolExecutor executor;
    private final Clock clock;

    @Inject
    public CronUtilsEngine(@ConfigProperty(name = "cron.engine.threads", defaultValue = "2") int threads) {
        this(threads, Clock.systemUTC());
    }

    public CronUtilsEngine(int threads, Clock clock) {
        AtomicInteger counter = new AtomicInteger();
        this.executor = new ScheduledThreadPoolExecutor(Math.max(1, threads), runnable -> {
            Thread thread = new Thread(runnable, "cron-engine-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
        this.executor.setRemoveOnCancelPolicy(true);
        this.clock = clock;
    }

    @Override
    public boolean validate(String expression) {
        if (expression == null || expression.isBlank()) return false;
        try {
            parse(expression);
            return true;
        } catch (IllegalArgumentException e) {
            return false;
        }
    }

    @Override
    public ScheduledHandle schedule(String expression, ZoneId zone, Runnable callback) {
        ExecutionTime executionTime = ExecutionTime.forCron(parse(expression));
        RecurringHandle handle = new RecurringHandle(expression, executionTime, zone, callback);
        handle.arm(clock.instant());
        return handle;
    }

    @Override
    public ScheduledHandle scheduleOnce(Duration delay, Runnable callback) {
        long delayMs = Math.max(0, delay.toMillis());
        OneShotHandle handle = new OneShotHandle();
        handle.future = executor.schedule(() -> {
            if (handle.stopped) return;
            handle.stopped = true;
            runSafely(callback, "one-shot timer");
        }, delayMs, TimeUnit.MILLISECONDS);
        return handle;
    }

    @Override
    public Optional<Instant> nextFireTime(String expression, ZoneId zone, Instant after) {
        ExecutionTime executionTime = ExecutionTime.forCron(parse(expression));
        return executionTime.nextExecution(ZonedDateTime.ofInstant(after, zone))
                .map(ZonedDateTime::toInstant);
    }

    @PreDestroy
    @Override
    public void close() {
        if (executor.isShutdown()) return;
        executor.shutdownNow();
        log.info("Cron engine stopped");
    }

    private Cron parse(String expression) {
        Cron cron = parser.parse(expression.trim());
        cron.validate();
        return cron;
    }

    private static void runSafely(Runnable callback, String what) {
        try {
            callback.run();
        } catch (RuntimeException e) {
            log.errorf(e, "Callback of %s threw", what);
        }
    }

    private final class RecurringHandle implements ScheduledHandle {

        private final String expression;
        private final ExecutionTime executionTime;
        private final ZoneId zone;
        private final Runnable callback;
        private volatile boolean stopped;
        private volatile ScheduledFuture<?> future;

        RecurringHandle(String expression, ExecutionTime executionTime, ZoneId zone, Runnable callback) {
            this.expression = expression;
            this.executionTime = executionTime;
            this.zone = zone;
            this.callback = callback;
        }

        void arm(Instant base) {
            if (stopped || executor.isShutdown()) return;
            Optional<ZonedDateTime> next = executionTime.nextExecution(ZonedDateTime.ofInstant(base, zone));
            if (next.isEmpty()) {
                log.warnf("Cron expression '%s' has no further fire times", expression);
                return;
            }
            Instant fireAt = next.get().toInstant();
            long delayMs = Math.max(0, Duration.between(clock.instant(), fireAt).toMillis());
            future = executor.schedule(() -> tick(fireAt), delayMs, TimeUnit.MILLISECONDS);
        }

        private void tick(Instant firedAt) {
            if (stopped) return;
            Instant now = clock.instant();
            arm(now.isAfter(firedAt) ? now : firedAt);
            runSafely(callback, "cron '" + expression + "'");
        }

        @Override
        public void stop() {
            stopped = true;
            ScheduledFuture<?> current = future;
            if (current != null) current.cancel(false);
        }

        @Override
        public boolean isStopped() {
            return stopped;
        }
    }

    private static final class OneShotHandle implements ScheduledHandle {

        private volatile boolean stopped;
        private volatile ScheduledFuture<?> future;

        @Override
        public void stop() {
            stopped = true;
            ScheduledFuture<?> current = future;
            if (current != null) current.cancel(false);
        }

        @Override
        public boolean isStopped() {
            return stopped;
        }
    }
}
