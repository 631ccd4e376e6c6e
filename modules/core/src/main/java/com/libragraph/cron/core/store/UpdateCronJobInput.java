package com.libragraph.cron.core.store;

import com.libragraph.cron.types.ExecutionMode;

/**
 * Partial update of a job. A null field leaves the column unchanged. An empty string clears
 * an optional text column ({@code description}, {@code timezone}, {@code taskContext},
 * {@code model}, {@code linkedScheduleId}); a {@code timeoutMs} of 0 clears the timeout.
 */
public record UpdateCronJobInput(
        String name,
        String description,
        String schedule,
        String timezone,
        String taskPrompt,
        String taskContext,
        ExecutionMode executionMode,
        String model,
        Long timeoutMs,
        Integer maxRetries,
        String linkedScheduleId
) {

    public static UpdateCronJobInput empty() {
        return new UpdateCronJobInput(null, null, null, null, null, null, null, null, null, null, null);
    }

    public UpdateCronJobInput withName(String value) {
        return new UpdateCronJobInput(value, description, schedule, timezone, taskPrompt, taskContext,
                executionMode, model, timeoutMs, maxRetries, linkedScheduleId);
    }

    public UpdateCronJobInput withDescription(String value) {
        return new UpdateCronJobInput(name, value, schedule, timezone, taskPrompt, taskContext,
                executionMode, model, timeoutMs, maxRetries, linkedScheduleId);
    }

    public UpdateCronJobInput withSchedule(String value) {
        return new UpdateCronJobInput(name, description, value, timezone, taskPrompt, taskContext,
                executionMode, model, timeoutMs, maxRetries, linkedScheduleId);
    }

    public UpdateCronJobInput withTimezone(String value) {
        return new UpdateCronJobInput(name, description, schedule, value, taskPrompt, taskContext,
                executionMode, model, timeoutMs, maxRetries, linkedScheduleId);
    }

    public UpdateCronJobInput withTaskPrompt(String value) {
        return new UpdateCronJobInput(name, description, schedule, timezone, value, taskContext,
                executionMode, model, timeoutMs, maxRetries, linkedScheduleId);
    }

    public UpdateCronJobInput withTaskContext(String value) {
        return new UpdateCronJobInput(name, description, schedule, timezone, taskPrompt, value,
                executionMode, model, timeoutMs, maxRetries, linkedScheduleId);
    }

    public UpdateCronJobInput withExecutionMode(ExecutionMode value) {
        return new UpdateCronJobInput(name, description, schedule, timezone, taskPrompt, taskContext,
                value, model, timeoutMs, maxRetries, linkedScheduleId);
    }

    public UpdateCronJobInput withModel(String value) {
        return new UpdateCronJobInput(name, description, schedule, timezone, taskPrompt, taskContext,
                executionMode, value, timeoutMs, maxRetries, linkedScheduleId);
    }

    public UpdateCronJobInput withTimeoutMs(Long value) {
        return new UpdateCronJobInput(name, description, schedule, timezone, taskPrompt, taskContext,
                executionMode, model, value, maxRetries, linkedScheduleId);
    }

    public UpdateCronJobInput withMaxRetries(Integer value) {
        return new UpdateCronJobInput(name, description, schedule, timezone, taskPrompt, taskContext,
                executionMode, model, timeoutMs, value, linkedScheduleId);
    }

    public UpdateCronJobInput withLinkedScheduleId(String value) {
        return new UpdateCronJobInput(name, description, schedule, timezone, taskPrompt, taskContext,
                executionMode, model, timeoutMs, maxRetries, value);
    }
}
