package com.libragraph.cron.core.event;

/**
 * Best-effort announcement channel. Implementations must not throw and must not block the caller.
 */
public interface CronEventSink {

    void emit(CronEvent event);
}
