package com.libragraph.cron.util;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.ZoneId;

import static org.assertj.core.api.Assertions.*;

class JobScheduleTest {

    private static final ZoneId SHANGHAI = ZoneId.of("Asia/Shanghai");

    // --- Recurring ---

    @Test
    void cronExpressionIsRecurring() {
        JobSchedule schedule = JobSchedule.parse("0 9 * * *");
        assertThat(schedule.isRecurring()).isTrue();
        assertThat(schedule.isOnce()).isFalse();
        assertThat(schedule.fireAt()).isNull();
        assertThat(schedule.expression()).isEqualTo("0 9 * * *");
    }

    @Test
    void cronExpressionIsTrimmed() {
        assertThat(JobSchedule.parse("  */5 * * * * ").expression()).isEqualTo("*/5 * * * *");
    }

    @Test
    void rejectsBlank() {
        assertThatIllegalArgumentException()
                .isThrownBy(() -> JobSchedule.parse("   "))
                .withMessageContaining("blank");
    }

    @Test
    void rejectsNull() {
        assertThatNullPointerException()
                .isThrownBy(() -> JobSchedule.parse(null));
    }

    // --- once: ---

    @Test
    void onceWithUtcDesignator() {
        JobSchedule schedule = JobSchedule.parse("once:2025-03-01T09:00:00Z");
        assertThat(schedule.isOnce()).isTrue();
        assertThat(schedule.fireAt()).isEqualTo(Instant.parse("2025-03-01T09:00:00Z"));
    }

    @Test
    void onceWithOffset() {
        JobSchedule schedule = JobSchedule.parse("once:2025-03-01T17:00:00+08:00");
        assertThat(schedule.fireAt()).isEqualTo(Instant.parse("2025-03-01T09:00:00Z"));
    }

    @Test
    void onceWithMillis() {
        JobSchedule schedule = JobSchedule.parse("once:2025-03-01T09:00:00.250Z");
        assertThat(schedule.fireAt()).isEqualTo(Instant.parse("2025-03-01T09:00:00.250Z"));
    }

    @Test
    void onceWithoutOffsetUsesSuppliedZone() {
        JobSchedule schedule = JobSchedule.parse("once:2025-03-01T17:00:00", SHANGHAI);
        assertThat(schedule.fireAt()).isEqualTo(Instant.parse("2025-03-01T09:00:00Z"));
    }

    @Test
    void onceFactoryProducesParsableLiteral() {
        Instant at = Instant.parse("2030-01-02T03:04:05Z");
        JobSchedule schedule = JobSchedule.once(at);
        assertThat(schedule.expression()).isEqualTo("once:2030-01-02T03:04:05Z");
        assertThat(JobSchedule.parse(schedule.toString())).isEqualTo(schedule);
    }

    @Test
    void rejectsMalformedOnceTimestamp() {
        assertThatIllegalArgumentException()
                .isThrownBy(() -> JobSchedule.parse("once:tomorrow morning"))
                .withMessageContaining("Invalid once: timestamp");
    }

    @Test
    void rejectsOnceTimestampBeyondEpochMillis() {
        assertThatIllegalArgumentException()
                .isThrownBy(() -> JobSchedule.parse("once:+999999999-12-31T00:00:00Z"))
                .withMessageContaining("out of range");
    }

    @Test
    void rejectsEmptyOnceTimestamp() {
        assertThatIllegalArgumentException()
                .isThrownBy(() -> JobSchedule.parse("once:"))
                .withMessageContaining("Invalid once: timestamp");
    }

    @Test
    void isOnceChecksPrefixOnly() {
        assertThat(JobSchedule.isOnce("once:garbage")).isTrue();
        assertThat(JobSchedule.isOnce("0 9 * * *")).isFalse();
        assertThat(JobSchedule.isOnce(null)).isFalse();
    }
}
