package com.libragraph.cron.util;

import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.temporal.TemporalAccessor;
import java.util.Objects;
import java.util.Optional;

/**
 * A job's schedule string, split into its two shapes: a recurring cron
 * expression, or a one-shot {@code once:<ISO-8601>} instant.
 *
 * <p>Cron grammar is not checked here; that belongs to the cron engine.
 * The {@code once:} literal is fully parsed: {@code 2025-03-01T09:00:00Z},
 * {@code 2025-03-01T09:00:00+08:00} and zone-less {@code 2025-03-01T09:00:00}
 * (read in the supplied zone) are accepted.
 */
public record JobSchedule(String expression, Instant fireAt) {

    public static final String ONCE_PREFIX = "once:";

    public JobSchedule {
        Objects.requireNonNull(expression, "expression cannot be null");
    }

    /** True for the {@code once:} form, whether or not its timestamp parses. */
    public static boolean isOnce(String schedule) {
        return schedule != null && schedule.startsWith(ONCE_PREFIX);
    }

    /**
     * Parses a schedule string, reading zone-less {@code once:} timestamps in the system zone.
     *
     * @throws IllegalArgumentException if the string is blank or the {@code once:} timestamp is malformed
     */
    public static JobSchedule parse(String schedule) {
        return parse(schedule, ZoneId.systemDefault());
    }

    /**
     * Parses a schedule string.
     *
     * @param zone zone used for {@code once:} timestamps that carry no offset
     * @throws IllegalArgumentException if the string is blank or the {@code once:} timestamp is
     *         malformed or not representable in epoch milliseconds
     */
    public static JobSchedule parse(String schedule, ZoneId zone) {
        Objects.requireNonNull(schedule, "schedule cannot be null");
        Objects.requireNonNull(zone, "zone cannot be null");

        String trimmed = schedule.trim();
        if (trimmed.isEmpty()) {
            throw new IllegalArgumentException("Schedule cannot be blank");
        }
        if (!isOnce(trimmed)) {
            return new JobSchedule(trimmed, null);
        }

        String timestamp = trimmed.substring(ONCE_PREFIX.length()).trim();
        Instant fireAt = parseInstant(timestamp, zone)
                .orElseThrow(() -> new IllegalArgumentException(
                        "Invalid once: timestamp (expected ISO-8601): " + schedule));
        try {
            fireAt.toEpochMilli();
        } catch (ArithmeticException e) {
            throw new IllegalArgumentException("once: timestamp out of range: " + schedule, e);
        }
        return new JobSchedule(trimmed, fireAt);
    }

    /** Builds the {@code once:} literal for an instant. */
    public static JobSchedule once(Instant fireAt) {
        Objects.requireNonNull(fireAt, "fireAt cannot be null");
        return new JobSchedule(ONCE_PREFIX + fireAt, fireAt);
    }

    public boolean isOnce() {
        return fireAt != null;
    }

    public boolean isRecurring() {
        return fireAt == null;
    }

    @Override
    public String toString() {
        return expression;
    }

    private static Optional<Instant> parseInstant(String text, ZoneId zone) {
        if (text.isEmpty()) {
            return Optional.empty();
        }
        try {
            TemporalAccessor parsed = DateTimeFormatter.ISO_DATE_TIME
                    .parseBest(text, ZonedDateTime::from, LocalDateTime::from);
            if (parsed instanceof ZonedDateTime zoned) {
                return Optional.of(zoned.toInstant());
            }
            return Optional.of(((LocalDateTime) parsed).atZone(zone).toInstant());
        } catch (DateTimeException e) {
            return Optional.empty();
        }
    }
}
