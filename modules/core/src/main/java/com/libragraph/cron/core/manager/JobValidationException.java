package com.libragraph.cron.core.manager;

/**
 * A job definition was rejected before anything was persisted: malformed cron expression,
 * malformed {@code once:} timestamp, unknown timezone or a missing required field.
 */
public class JobValidationException extends RuntimeException {

    public JobValidationException(String message) {
        super(message);
    }

    public JobValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
