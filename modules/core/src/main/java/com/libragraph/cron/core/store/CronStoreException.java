package com.libragraph.cron.core.store;

/**
 * The job store cannot be opened or a statement failed outside the transient-retry window.
 */
public class CronStoreException extends RuntimeException {

    public CronStoreException(String message, Throwable cause) {
        super(message, cause);
    }

    public CronStoreException(String message) {
        super(message);
    }
}
