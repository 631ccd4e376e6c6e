package com.libragraph.cron.core.schedule;

import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory map of job id to its live timer. Never persisted; rebuilt from the store at startup.
 */
public class ScheduleRegistry {

    private final Map<String, ScheduledHandle> handles = new ConcurrentHashMap<>();

    /** Registers a timer for the job, stopping any timer it replaces. */
    public void register(String jobId, ScheduledHandle handle) {
        ScheduledHandle previous = handles.put(jobId, handle);
        if (previous != null && previous != handle) previous.stop();
    }

    /** Stops and removes the job's timer. Returns whether one was registered. */
    public boolean unregister(String jobId) {
        ScheduledHandle handle = handles.remove(jobId);
        if (handle == null) return false;
        handle.stop();
        return true;
    }

    public void stopAll() {
        for (String jobId : Set.copyOf(handles.keySet())) {
            unregister(jobId);
        }
    }

    public boolean isRegistered(String jobId) {
        return handles.containsKey(jobId);
    }

    public int size() {
        return handles.size();
    }
}
