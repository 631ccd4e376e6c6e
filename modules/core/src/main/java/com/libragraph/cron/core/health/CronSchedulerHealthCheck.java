package com.libragraph.cron.core.health;

import com.libragraph.cron.core.manager.CronJobManager;
import com.libragraph.cron.core.store.CronStore;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.health.HealthCheck;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.eclipse.microprofile.health.Readiness;

@Readiness
@ApplicationScoped
public class CronSchedulerHealthCheck implements HealthCheck {

    @Inject
    CronJobManager manager;

    @Inject
    CronStore store;

    @Override
    public HealthCheckResponse call() {
        if (!manager.isRunning()) {
            return HealthCheckResponse.named("cron-scheduler")
                    .down()
                    .withData("state", manager.state().name())
                    .build();
        }
        if (!store.ping()) {
            return HealthCheckResponse.named("cron-scheduler")
                    .down()
                    .withData("error", "store unreachable")
                    .build();
        }
        return HealthCheckResponse.named("cron-scheduler")
                .up()
                .withData("jobs", store.countJobs())
                .withData("registered", manager.registeredJobCount())
                .build();
    }
}
