package com.libragraph.cron.core.execution;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.libragraph.cron.core.store.CronJobRecord;
import com.libragraph.cron.types.ExecutionMode;
import org.jboss.logging.Logger;

import java.util.Map;

/**
 * Everything the execution engine needs to run one firing of a job.
 *
 * @param taskContext the job's JSON context parsed into a map, or null when absent or not a JSON object
 * @param label       short tag for the session, {@code cron:<job name>}
 */
public record ExecutionContext(
        String jobId,
        String jobName,
        String scope,
        String taskPrompt,
        Map<String, Object> taskContext,
        ExecutionMode executionMode,
        String model,
        Long timeoutMs,
        String label,
        String systemInstructions
) {

    private static final Logger log = Logger.getLogger(ExecutionContext.class);
    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    public static ExecutionContext forJob(CronJobRecord job, ObjectMapper mapper) {
        return new ExecutionContext(
                job.id(),
                job.name(),
                job.scope(),
                job.taskPrompt(),
                parseContext(job, mapper),
                job.executionMode(),
                job.model(),
                job.timeoutMs(),
                "cron:" + job.name(),
                "You are running the scheduled task \"" + job.name()
                        + "\". Complete the task and report its result before finishing.");
    }

    private static Map<String, Object> parseContext(CronJobRecord job, ObjectMapper mapper) {
        String raw = job.taskContext();
        if (raw == null || raw.isBlank()) return null;
        try {
            return mapper.readValue(raw, MAP_TYPE);
        } catch (JsonProcessingException e) {
            log.warnf("Job %s has a task context that is not a JSON object, ignoring it: %s",
                    job.id(), e.getOriginalMessage());
            return null;
        }
    }
}
