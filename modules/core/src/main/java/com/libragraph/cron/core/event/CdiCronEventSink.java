package com.libragraph.cron.core.event;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Event;
import jakarta.enterprise.event.NotificationOptions;
import jakarta.inject.Inject;
import jakarta.inject.Named;
import org.jboss.logging.Logger;

import java.util.concurrent.ExecutorService;

/**
 * Publishes cron events as asynchronous CDI events. Observe them with {@code @ObservesAsync CronJobCreatedEvent}
 * (or any other concrete event type).
 */
@ApplicationScoped
public class CdiCronEventSink implements CronEventSink {

    private static final Logger log = Logger.getLogger(CdiCronEventSink.class);

    @Inject
    Event<CronEvent> events;

    @Inject
    @Named("eventExecutor")
    ExecutorService executor;

    @Override
    public void emit(CronEvent event) {
        try {
            events.fireAsync(event, NotificationOptions.ofExecutor(executor))
                    .exceptionally(e -> {
                        log.warnf("Observer of %s for job %s failed: %s", event.name(), event.jobId(), e.getMessage());
                        return null;
                    });
        } catch (RuntimeException e) {
            log.warnf(e, "Could not announce %s for job %s", event.name(), event.jobId());
        }
    }
}
