package com.libragraph.cron.app;

import com.libragraph.cron.core.event.CronEvent;
import com.libragraph.cron.core.event.CronJobCreatedEvent;
import com.libragraph.cron.core.event.CronJobExecutedEvent;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.ObservesAsync;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

@ApplicationScoped
public class CronEventRecorder {

    private final List<CronEvent> received = new CopyOnWriteArrayList<>();

    void onCreated(@ObservesAsync CronJobCreatedEvent event) {
        received.add(event);
    }

    void onExecuted(@ObservesAsync CronJobExecutedEvent event) {
        received.add(event);
    }

    public List<CronEvent> receivedFor(String jobId) {
        return received.stream().filter(e -> e.jobId().equals(jobId)).toList();
    }
}
