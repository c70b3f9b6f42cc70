package com.compass.dispatcher.ratelimit;

import com.compass.dispatcher.config.DispatcherProperties;
import com.compass.dispatcher.pool.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class InMemoryRateLimiterTest {

    private MutableClock clock;
    private InMemoryRateLimiter limiter;

    @BeforeEach
    void setUp() {
        DispatcherProperties properties = new DispatcherProperties();
        properties.setRateLimitMaxRequests(2);
        properties.setRateLimitWindowSeconds(60);
        clock = new MutableClock(Instant.parse("2024-03-01T10:00:00Z"));
        limiter = new InMemoryRateLimiter(properties, clock);
    }

    @Test
    void rejectsOnceWindowIsFull() {
        assertThat(limiter.tryAcquire("sk-limited-0001")).isTrue();
        assertThat(limiter.tryAcquire("sk-limited-0001")).isTrue();
        assertThat(limiter.tryAcquire("sk-limited-0001")).isFalse();
        assertThat(limiter.remainingQuota("sk-limited-0001")).isZero();
    }

    @Test
    void windowSlidesForward() {
        limiter.tryAcquire("sk-limited-0001");
        clock.advance(Duration.ofSeconds(30));
        limiter.tryAcquire("sk-limited-0001");

        clock.advance(Duration.ofSeconds(31));

        assertThat(limiter.remainingQuota("sk-limited-0001")).isEqualTo(1);
        assertThat(limiter.tryAcquire("sk-limited-0001")).isTrue();
    }

    @Test
    void countsKeysIndependently() {
        limiter.tryAcquire("sk-limited-0001");
        limiter.tryAcquire("sk-limited-0001");

        assertThat(limiter.tryAcquire("sk-other-00002")).isTrue();
        assertThat(limiter.remainingQuota("sk-never-used-3")).isEqualTo(2);
    }
}
