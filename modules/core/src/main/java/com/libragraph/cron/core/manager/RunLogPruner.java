package com.libragraph.cron.core.manager;

import io.quarkus.scheduler.Scheduled;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import static io.quarkus.scheduler.Scheduled.ConcurrentExecution.SKIP;

/**
 * Daily sweep deleting run logs older than the retention window.
 */
@ApplicationScoped
public class RunLogPruner {

    private static final Logger log = Logger.getLogger(RunLogPruner.class);

    @Inject
    CronJobManager manager;

    @ConfigProperty(name = "cron.run-log.retention-days", defaultValue = "90")
    int retentionDays;

    @Scheduled(every = "24h", delayed = "1h", concurrentExecution = SKIP)
    public void sweep() {
        prune();
    }

    int prune() {
        if (!manager.isRunning()) {
            log.debug("Cron job manager not running, skipping run log prune");
            return 0;
        }
        try {
            return manager.pruneRunLogs(retentionDays);
        } catch (RuntimeException e) {
            log.warnf(e, "Run log prune failed");
            return 0;
        }
    }
}
