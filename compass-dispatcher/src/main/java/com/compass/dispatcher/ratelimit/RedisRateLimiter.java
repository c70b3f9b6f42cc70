package com.compass.dispatcher.ratelimit;

import com.compass.common.util.IdGenerator;
import com.compass.common.util.KeyMasks;
import com.compass.dispatcher.config.DispatcherProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ZSetOperations;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 多实例共享配额的滑动窗口限流器，每个 API Key 一个 Sorted Set，成员为请求凭据，score 为请求时间。
 * <p>
 * 先占位再计数：写入本次凭据后统计窗口内条数，超出上限则撤回自己的凭据并拒绝。
 * 多个实例同时争抢最后一个名额时可能都被拒绝，但不会超发。
 * 窗口边界与 {@link InMemoryRateLimiter} 一致：早于 (now - window) 的请求不再计数。
 */
@Slf4j
public class RedisRateLimiter implements RateLimiter {

    private final StringRedisTemplate redisTemplate;
    private final DispatcherProperties properties;
    private final Clock clock;

    /** 凭据前缀，区分实例 */
    private final String instanceTag = IdGenerator.shortUuid().substring(0, 8);
    private final AtomicLong ticketSequence = new AtomicLong();

    public RedisRateLimiter(StringRedisTemplate redisTemplate, DispatcherProperties properties) {
        this(redisTemplate, properties, Clock.systemUTC());
    }

    RedisRateLimiter(StringRedisTemplate redisTemplate, DispatcherProperties properties, Clock clock) {
        this.redisTemplate = redisTemplate;
        this.properties = properties;
        this.clock = clock;
    }

    @Override
    public boolean tryAcquire(String apiKey) {
        String window = windowKey(apiKey);
        long now = clock.millis();
        ZSetOperations<String, String> zSet = redisTemplate.opsForZSet();

        zSet.removeRangeByScore(window, 0, windowStart(now) - 1);

        String ticket = instanceTag + ":" + ticketSequence.incrementAndGet();
        zSet.add(window, ticket, now);
        redisTemplate.expire(window, Duration.ofSeconds(properties.getRateLimitWindowSeconds() + 10L));

        Long used = zSet.zCard(window);
        int limit = properties.getRateLimitMaxRequests();
        if (used != null && used > limit) {
            zSet.remove(window, ticket);
            log.debug("Key {} 已达速率限制 ({}/{}s 内 {} 次)",
                    KeyMasks.mask(apiKey), limit, properties.getRateLimitWindowSeconds(), used - 1);
            return false;
        }
        return true;
    }

    /**
     * 只读统计，不清理过期凭据。
     */
    @Override
    public long remainingQuota(String apiKey) {
        Long used = redisTemplate.opsForZSet()
                .count(windowKey(apiKey), windowStart(clock.millis()), Double.POSITIVE_INFINITY);
        return Math.max(0, properties.getRateLimitMaxRequests() - (used != null ? used : 0));
    }

    String windowKey(String apiKey) {
        return properties.getRateLimitKeyPrefix() + KeyMasks.slotOf(apiKey);
    }

    private long windowStart(long now) {
        return now - properties.getRateLimitWindowSeconds() * 1000L;
    }
}
