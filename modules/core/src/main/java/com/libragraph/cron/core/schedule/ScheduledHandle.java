package com.libragraph.cron.core.schedule;

/**
 * A live timer registration. Stopping prevents future fires only; a callback already
 * running is not interrupted.
 */
public interface ScheduledHandle {

    void stop();

    boolean isStopped();
}
