package com.compass.dispatcher.service;

import com.compass.common.exception.AiResponseFormatException;
import com.compass.common.exception.AiServiceException;
import com.compass.common.exception.KeyPoolExhaustedException;
import com.compass.dispatcher.config.DispatcherProperties;
import com.compass.dispatcher.pool.InMemoryApiKeyPool;
import com.compass.dispatcher.ratelimit.RateLimiter;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class DispatcherServiceTest {

    private DispatcherProperties properties;
    private InMemoryApiKeyPool keyPool;
    private RateLimiter rateLimiter;
    private DispatcherService dispatcher;

    @BeforeEach
    void setUp() {
        properties = new DispatcherProperties();
        properties.setMaxConcurrent(2);
        properties.setRetryCount(1);
        properties.setRetryBackoffMillis(0);
        properties.setKeyBorrowTimeoutSeconds(0);
        keyPool = new InMemoryApiKeyPool(properties);
        rateLimiter = mock(RateLimiter.class);
        when(rateLimiter.tryAcquire(anyString())).thenReturn(true);
        dispatcher = new DispatcherService(keyPool, rateLimiter, properties);
    }

    @AfterEach
    void tearDown() {
        dispatcher.shutdown();
    }

    @Test
    void retriesOnceWithAnotherKeyAfterCallFailure() {
        keyPool.addKeys(List.of("sk-broken-000001", "sk-healthy-00002"));
        List<String> usedKeys = Collections.synchronizedList(new ArrayList<>());

        String result = dispatcher.callWithRetry("classify", key -> {
            usedKeys.add(key);
            if (key.startsWith("sk-broken")) {
                throw new IllegalStateException("HTTP 401");
            }
            return "ok";
        });

        assertThat(result).isEqualTo("ok");
        assertThat(usedKeys).containsExactly("sk-broken-000001", "sk-healthy-00002");
        assertThat(keyPool.failedCount()).isEqualTo(1);
        assertThat(keyPool.availableCount()).isEqualTo(1);
    }

    @Test
    void malformedReplyKeepsKeyHealthyAndGivesUpAfterRetry() {
        keyPool.addKey("sk-only-key-0001");
        AtomicInteger attempts = new AtomicInteger();

        assertThatThrownBy(() -> dispatcher.callWithRetry("classify", key -> {
            attempts.incrementAndGet();
            throw new AiResponseFormatException("not json");
        }))
                .isInstanceOf(AiServiceException.class)
                .hasCauseInstanceOf(AiResponseFormatException.class);

        assertThat(attempts).hasValue(2);
        assertThat(keyPool.failedCount()).isZero();
        assertThat(keyPool.availableCount()).isEqualTo(1);
    }

    @Test
    void failsWhenNoKeyIsAvailable() {
        assertThatThrownBy(() -> dispatcher.callWithRetry("classify", key -> "never"))
                .isInstanceOf(AiServiceException.class);
    }

    @Test
    void interruptedBorrowGivesUpWithoutRetrying() {
        properties.setRetryCount(3);
        AtomicInteger calls = new AtomicInteger();

        Thread.currentThread().interrupt();
        try {
            assertThatThrownBy(() -> dispatcher.callWithRetry("classify", key -> {
                calls.incrementAndGet();
                return "never";
            }))
                    .isInstanceOf(AiServiceException.class)
                    .cause()
                    .isInstanceOfSatisfying(KeyPoolExhaustedException.class,
                            e -> assertThat(e.getReason()).isEqualTo(KeyPoolExhaustedException.Reason.INTERRUPTED));
        } finally {
            Thread.interrupted();
        }

        assertThat(calls).hasValue(0);
    }

    @Test
    void dispatchAllKeepsInputOrderAndIsolatesFailures() {
        keyPool.addKeys(List.of("sk-a-0000000001", "sk-b-0000000002"));

        List<String> results = dispatcher.dispatchAll(List.of(1, 2, 3, 4), n -> {
            if (n == 3) {
                throw new IllegalArgumentException("bad row");
            }
            return "row-" + n;
        });

        assertThat(results).containsExactly("row-1", "row-2", null, "row-4");
    }

    @Test
    void dispatchAllNeverExceedsConfiguredConcurrency() {
        keyPool.addKeys(List.of("sk-a-0000000001", "sk-b-0000000002", "sk-c-0000000003", "sk-d-0000000004"));
        AtomicInteger running = new AtomicInteger();
        AtomicInteger peak = new AtomicInteger();

        List<Integer> items = new ArrayList<>();
        for (int i = 0; i < 12; i++) {
            items.add(i);
        }
        dispatcher.dispatchAll(items, n -> {
            int now = running.incrementAndGet();
            peak.accumulateAndGet(now, Math::max);
            try {
                Thread.sleep(20);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            } finally {
                running.decrementAndGet();
            }
            return n;
        });

        assertThat(peak.get()).isBetween(1, 2);
    }

    @Test
    void interruptedDispatchLeavesUnscheduledRowsEmpty() {
        keyPool.addKey("sk-a-0000000001");
        AtomicInteger executed = new AtomicInteger();

        Thread.currentThread().interrupt();
        List<Integer> results;
        try {
            results = dispatcher.dispatchAll(List.of(1, 2, 3), n -> {
                executed.incrementAndGet();
                return n;
            });
        } finally {
            Thread.interrupted();
        }

        assertThat(results).hasSize(3).containsOnlyNulls();
        assertThat(executed).hasValue(0);
    }

    @Test
    void interruptWhileTaskRunsKeepsItsResult() {
        keyPool.addKey("sk-a-0000000001");
        AtomicInteger executed = new AtomicInteger();
        Thread caller = Thread.currentThread();

        List<Integer> results;
        boolean interruptRestored;
        try {
            results = dispatcher.dispatchAll(List.of(1, 2, 3), n -> {
                executed.incrementAndGet();
                caller.interrupt();
                try {
                    Thread.sleep(50);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                return n * 10;
            });
        } finally {
            interruptRestored = Thread.interrupted();
        }

        assertThat(results).containsExactly(10, null, null);
        assertThat(executed).hasValue(1);
        assertThat(interruptRestored).isTrue();
    }

    @Test
    void emptyInputReturnsEmptyList() {
        assertThat(dispatcher.dispatchAll(List.<String>of(), s -> s)).isEmpty();
    }
}
