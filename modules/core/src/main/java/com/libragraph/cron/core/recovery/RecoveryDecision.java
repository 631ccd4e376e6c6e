package com.libragraph.cron.core.recovery;

/**
 * What to do with a one-shot job found at startup.
 */
public enum RecoveryDecision {
    /** The instant has not arrived yet: arm a timer for it. */
    FUTURE,
    /** The instant was missed by no more than the grace period: fire now, once. */
    RECOVER,
    /** The instant was missed by more than the grace period: mark completed without firing. */
    STALE
}
