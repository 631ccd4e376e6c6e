package com.libragraph.cron.core.recovery;

import java.time.Duration;
import java.time.Instant;

/**
 * Classifies a one-shot job by how its scheduled instant relates to the current time.
 * Pure; holds only the grace period.
 */
public class RecoveryClassifier {

    /** How late a missed one-shot job may still be fired after a restart. */
    public static final Duration DEFAULT_GRACE_PERIOD = Duration.ofMinutes(10);

    private final Duration gracePeriod;

    public RecoveryClassifier() {
        this(DEFAULT_GRACE_PERIOD);
    }

    public RecoveryClassifier(Duration gracePeriod) {
        if (gracePeriod.isNegative()) {
            throw new IllegalArgumentException("Grace period must not be negative: " + gracePeriod);
        }
        this.gracePeriod = gracePeriod;
    }

    public Duration gracePeriod() {
        return gracePeriod;
    }

    public RecoveryDecision classify(Instant scheduledAt, Instant now) {
        return classify(scheduledAt.toEpochMilli(), now.toEpochMilli(), gracePeriod.toMillis());
    }

    public static RecoveryDecision classify(long scheduledAtMs, long nowMs, long gracePeriodMs) {
        if (scheduledAtMs > nowMs) return RecoveryDecision.FUTURE;
        if (nowMs - scheduledAtMs <= gracePeriodMs) return RecoveryDecision.RECOVER;
        return RecoveryDecision.STALE;
    }
}
