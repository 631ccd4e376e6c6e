package com.libragraph.cron.core.store;

import com.libragraph.cron.types.ExecutionMode;

/**
 * Fields supplied when a job is created. Optional fields may be null;
 * {@code executionMode} defaults to {@link ExecutionMode#ISOLATED} and {@code maxRetries} to 0.
 */
public record CreateCronJobInput(
        String name,
        String description,
        String scope,
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

    public static Builder builder(String name, String scope, String schedule, String taskPrompt) {
        return new Builder(name, scope, schedule, taskPrompt);
    }

    public static final class Builder {
        private final String name;
        private final String scope;
        private final String schedule;
        private final String taskPrompt;
        private String description;
        private String timezone;
        private String taskContext;
        private ExecutionMode executionMode;
        private String model;
        private Long timeoutMs;
        private Integer maxRetries;
        private String linkedScheduleId;

        private Builder(String name, String scope, String schedule, String taskPrompt) {
            this.name = name;
            this.scope = scope;
            this.schedule = schedule;
            this.taskPrompt = taskPrompt;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder timezone(String timezone) {
            this.timezone = timezone;
            return this;
        }

        public Builder taskContext(String taskContext) {
            this.taskContext = taskContext;
            return this;
        }

        public Builder executionMode(ExecutionMode executionMode) {
            this.executionMode = executionMode;
            return this;
        }

        public Builder model(String model) {
            this.model = model;
            return this;
        }

        public Builder timeoutMs(Long timeoutMs) {
            this.timeoutMs = timeoutMs;
            return this;
        }

        public Builder maxRetries(Integer maxRetries) {
            this.maxRetries = maxRetries;
            return this;
        }

        public Builder linkedScheduleId(String linkedScheduleId) {
            this.linkedScheduleId = linkedScheduleId;
            return this;
        }

        public CreateCronJobInput build() {
            return new CreateCronJobInput(name, description, scope, schedule, timezone, taskPrompt,
                    taskContext, executionMode, model, timeoutMs, maxRetries, linkedScheduleId);
        }
    }
}
