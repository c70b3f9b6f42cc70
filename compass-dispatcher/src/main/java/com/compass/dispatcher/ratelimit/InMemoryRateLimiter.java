package com.compass.dispatcher.ratelimit;

import com.compass.common.util.KeyMasks;
import com.compass.dispatcher.config.DispatcherProperties;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 基于内存的滑动窗口限流器。
 * <p>
 * 每个 Key 维护一个请求时间戳队列，清理过期记录后计数；
 * 检查与记录在同一把锁内完成，并发 worker 不会超发。
 */
@Slf4j
public class InMemoryRateLimiter implements RateLimiter {

    private final DispatcherProperties properties;
    private final Clock clock;

    /** key 标识 -> 请求时间戳队列 */
    private final Map<String, Deque<Long>> windows = new ConcurrentHashMap<>();

    public InMemoryRateLimiter(DispatcherProperties properties) {
        this(properties, Clock.systemUTC());
    }

    InMemoryRateLimiter(DispatcherProperties properties, Clock clock) {
        this.properties = properties;
        this.clock = clock;
    }

    @Override
    public boolean tryAcquire(String apiKey) {
        Deque<Long> timestamps = windows.computeIfAbsent(KeyMasks.slotOf(apiKey), k -> new ArrayDeque<>());
        long now = clock.millis();

        synchronized (timestamps) {
            evictExpired(timestamps, now);
            if (timestamps.size() >= properties.getRateLimitMaxRequests()) {
                log.debug("Key {} 已达速率限制 ({}/{})",
                        KeyMasks.mask(apiKey), timestamps.size(), properties.getRateLimitMaxRequests());
                return false;
            }
            timestamps.addLast(now);
            return true;
        }
    }

    @Override
    public long remainingQuota(String apiKey) {
        Deque<Long> timestamps = windows.get(KeyMasks.slotOf(apiKey));
        if (timestamps == null) {
            return properties.getRateLimitMaxRequests();
        }
        synchronized (timestamps) {
            evictExpired(timestamps, clock.millis());
            return Math.max(0, properties.getRateLimitMaxRequests() - timestamps.size());
        }
    }

    private void evictExpired(Deque<Long> timestamps, long now) {
        long windowStart = now - properties.getRateLimitWindowSeconds() * 1000L;
        while (!timestamps.isEmpty() && timestamps.peekFirst() < windowStart) {
            timestamps.pollFirst();
        }
    }
}
