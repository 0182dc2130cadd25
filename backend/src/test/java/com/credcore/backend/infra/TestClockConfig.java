package com.credcore.backend.infra;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.util.concurrent.atomic.AtomicReference;

import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Primary;

/**
 * 테스트 전용 시계
 * - 쿨다운/만료 테스트는 sleep 대신 TEST_CLOCK.advance(...)로 시간을 민다.
 * - 시작 시각은 초 단위로 떨어지는 값이어야 발급 시각 절삭과 어긋나지 않는다.
 */
@TestConfiguration
public class TestClockConfig {

    public static final ZoneId TEST_ZONE = ZoneId.of("Asia/Seoul");
    public static final LocalDateTime TEST_START_LOCAL = LocalDateTime.of(2026, 1, 1, 9, 0);
    public static final Instant TEST_START = TEST_START_LOCAL.atZone(TEST_ZONE).toInstant();
    public static final MutableClock TEST_CLOCK = new MutableClock(TEST_START, TEST_ZONE);

    public static void reset() {
        TEST_CLOCK.set(TEST_START);
    }

    public static LocalDateTime nowLocal() {
        return LocalDateTime.ofInstant(TEST_CLOCK.instant(), TEST_ZONE);
    }

    @Bean
    @Primary
    Clock clock() {
        return TEST_CLOCK;
    }

    public static final class MutableClock extends Clock {
        private final ZoneId zone;
        private final AtomicReference<Instant> now;

        public MutableClock(Instant initialInstant, ZoneId zone) {
            this.zone = zone;
            this.now = new AtomicReference<>(initialInstant);
        }

        @Override
        public ZoneId getZone() {
            return zone;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return new MutableClock(now.get(), zone);
        }

        @Override
        public Instant instant() {
            return now.get();
        }

        public void set(Instant instant) {
            now.set(instant);
        }

        public void advance(Duration d) {
            now.updateAndGet(i -> i.plus(d));
        }

        public void advanceSeconds(long seconds) {
            advance(Duration.ofSeconds(seconds));
        }
    }
}
