package com.libragraph.cron.core.schedule;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.Optional;

/**
 * Parses five-field cron expressions and drives timers for them.
 */
public interface CronEngine extends AutoCloseable {

    /** Returns whether {@code expression} is a valid five-field cron expression. */
    boolean validate(String expression);

    /**
     * Fires {@code callback} on every tick of {@code expression}, evaluated in {@code zone}.
     *
     * @throws IllegalArgumentException if the expression does not parse
     */
    ScheduledHandle schedule(String expression, ZoneId zone, Runnable callback);

    /** Fires {@code callback} once after {@code delay}; a non-positive delay fires promptly. */
    ScheduledHandle scheduleOnce(Duration delay, Runnable callback);

    /** Next tick strictly after {@code after}, or empty if the expression never fires again. */
    Optional<Instant> nextFireTime(String expression, ZoneId zone, Instant after);

    /** Stops every timer and releases the engine's threads. */
    @Override
    void close();
}
