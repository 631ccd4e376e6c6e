package com.libragraph.cron.core.manager;

import com.libragraph.cron.core.execution.ExecutionEngine;
import io.quarkus.runtime.Startup;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Instance;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

/**
 * Starts the cron job manager at boot when the host deploys an {@link ExecutionEngine} bean,
 * and shuts it down with the container. Without an engine bean the host must call
 * {@link CronJobManager#init} itself.
 */
@ApplicationScoped
@Startup
public class CronSchedulerService {

    private static final Logger log = Logger.getLogger(CronSchedulerService.class);

    @Inject
    CronJobManager manager;

    @Inject
    Instance<ExecutionEngine> engines;

    @PostConstruct
    void start() {
        if (engines.isUnsatisfied()) {
            log.warn("No ExecutionEngine bean deployed; cron scheduler waits for an explicit init");
            return;
        }
        if (engines.isAmbiguous()) {
            throw new IllegalStateException("More than one ExecutionEngine bean is deployed");
        }
        manager.init(engines.get());
    }

    @PreDestroy
    void stop() {
        manager.shutdown();
    }
}
