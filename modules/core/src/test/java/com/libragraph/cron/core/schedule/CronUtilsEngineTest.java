package com.libragraph.cron.core.schedule;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CronUtilsEngineTest {

    private final CronUtilsEngine engine = new CronUtilsEngine(1, Clock.systemUTC());

    @AfterEach
    void tearDown() {
        engine.close();
    }

    @Test
    void validatesFiveFieldExpressions() {
        assertThat(engine.validate("0 9 * * *")).isTrue();
        assertThat(engine.validate("*/5 * * * *")).isTrue();
        assertThat(engine.validate("30 8 * * 1-5")).isTrue();
    }

    @Test
    void rejectsMalformedExpressions() {
        assertThat(engine.validate("not-a-cron")).isFalse();
        assertThat(engine.validate("61 * * * *")).isFalse();
        assertThat(engine.validate("0 0 9 * * *")).isFalse();
        assertThat(engine.validate("")).isFalse();
        assertThat(engine.validate(null)).isFalse();
    }

    @Test
    void scheduleRejectsInvalidExpression() {
        assertThatThrownBy(() -> engine.schedule("not-a-cron", ZoneOffset.UTC, () -> { }))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void nextFireTimeHonoursZone() {
        Instant after = Instant.parse("2025-03-01T08:00:00Z");

        assertThat(engine.nextFireTime("0 9 * * *", ZoneOffset.UTC, after))
                .contains(Instant.parse("2025-03-01T09:00:00Z"));
        assertThat(engine.nextFireTime("0 9 * * *", ZoneId.of("Asia/Shanghai"), after))
                .contains(Instant.parse("2025-03-02T01:00:00Z"));
    }

    @Test
    void scheduleOnceFires() throws InterruptedException {
        CountDownLatch fired = new CountDownLatch(1);
        ScheduledHandle handle = engine.scheduleOnce(Duration.ofMillis(20), fired::countDown);

        assertThat(fired.await(5, TimeUnit.SECONDS)).isTrue();
        assertThat(handle.isStopped()).isTrue();
    }

    @Test
    void stoppedOneShotNeverFires() throws InterruptedException {
        CountDownLatch fired = new CountDownLatch(1);
        ScheduledHandle handle = engine.scheduleOnce(Duration.ofMillis(200), fired::countDown);

        handle.stop();

        assertThat(fired.await(500, TimeUnit.MILLISECONDS)).isFalse();
    }

    @Test
    void recurringHandleStops() {
        ScheduledHandle handle = engine.schedule("* * * * *", ZoneOffset.UTC, () -> { });

        assertThat(handle.isStopped()).isFalse();
        handle.stop();
        assertThat(handle.isStopped()).isTrue();
    }
}
