package com.libragraph.cron.core.event;

import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Named;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Executor for asynchronous cron event observers. A cached pool of daemon platform threads
 * ({@code cron-events-N}) that never holds up JVM exit; it runs on JDK 17, so there are no
 * virtual threads.
 */
@ApplicationScoped
public class EventExecutorProducer {

    private ExecutorService executor;

    @Produces
    @ApplicationScoped
    @Named("eventExecutor")
    public ExecutorService eventExecutor() {
        AtomicInteger counter = new AtomicInteger();
        executor = Executors.newCachedThreadPool(runnable -> {
            Thread thread = new Thread(runnable, "cron-events-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
        return executor;
    }

    @PreDestroy
    void shutdown() {
        if (executor != null) executor.shutdown();
    }
}
