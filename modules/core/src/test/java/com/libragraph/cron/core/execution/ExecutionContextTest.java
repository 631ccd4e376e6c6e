package com.libragraph.cron.core.execution;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.libragraph.cron.core.store.CronJobRecord;
import com.libragraph.cron.types.CronJobStatus;
import com.libragraph.cron.types.ExecutionMode;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class ExecutionContextTest {

    private final ObjectMapper mapper = new ObjectMapper();

    private static CronJobRecord job(String taskContext) {
        Instant now = Instant.parse("2025-03-01T12:00:00Z");
        return new CronJobRecord("job-1", "Daily Report", null, "default", "0 9 * * *", null,
                "Generate daily report", taskContext, ExecutionMode.MAIN, "large", 60_000L, 2, null,
                CronJobStatus.ACTIVE, null, null, null, 0, now, now);
    }

    @Test
    void carriesJobFields() {
        ExecutionContext ctx = ExecutionContext.forJob(job(null), mapper);

        assertThat(ctx.jobId()).isEqualTo("job-1");
        assertThat(ctx.scope()).isEqualTo("default");
        assertThat(ctx.taskPrompt()).isEqualTo("Generate daily report");
        assertThat(ctx.executionMode()).isEqualTo(ExecutionMode.MAIN);
        assertThat(ctx.model()).isEqualTo("large");
        assertThat(ctx.timeoutMs()).isEqualTo(60_000L);
        assertThat(ctx.label()).isEqualTo("cron:Daily Report");
        assertThat(ctx.systemInstructions()).contains("Daily Report");
        assertThat(ctx.taskContext()).isNull();
    }

    @Test
    void parsesJsonContext() {
        ExecutionContext ctx = ExecutionContext.forJob(job("{\"folder\":\"inbox\",\"tags\":[\"a\",\"b\"]}"), mapper);

        assertThat(ctx.taskContext())
                .containsEntry("folder", "inbox")
                .containsEntry("tags", List.of("a", "b"));
    }

    @Test
    void ignoresMalformedContext() {
        ExecutionContext ctx = ExecutionContext.forJob(job("not json"), mapper);

        assertThat(ctx.taskContext()).isNull();
    }

    @Test
    void nonObjectContextIsIgnored() {
        Map<String, Object> parsed = ExecutionContext.forJob(job("[1,2]"), mapper).taskContext();

        assertThat(parsed).isNull();
    }
}
