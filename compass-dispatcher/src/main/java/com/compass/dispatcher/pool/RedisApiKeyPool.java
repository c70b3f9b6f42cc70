package com.compass.dispatcher.pool;

import com.compass.common.exception.KeyPoolExhaustedException;
import com.compass.common.util.KeyMasks;
import com.compass.dispatcher.config.DispatcherProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Duration;
import java.util.Set;

/**
 * 基于 Redis 的 API Key 轮询池。
 * <p>
 * 可用 Key 存在 List 中（BLPOP 借出、RPUSH 归还），
 * 失败 Key 存在 Sorted Set 中，score 为失败时间戳，恢复时只取冷却期满的成员。
 * 所有实例共享同一个 Key 池。
 */
@Slf4j
public class RedisApiKeyPool implements ApiKeyPool {

    private final StringRedisTemplate redisTemplate;
    private final DispatcherProperties properties;

    public RedisApiKeyPool(StringRedisTemplate redisTemplate, DispatcherProperties properties) {
        this.redisTemplate = redisTemplate;
        this.properties = properties;
    }

    @Override
    public String borrowKey() {
        String key = redisTemplate.opsForList().leftPop(
                properties.getKeyPoolName(),
                Duration.ofSeconds(properties.getKeyBorrowTimeoutSeconds())
        );
        if (key == null) {
            throw KeyPoolExhaustedException.poolEmpty(properties.getKeyBorrowTimeoutSeconds());
        }
        log.debug("借出 Key: {}", KeyMasks.mask(key));
        return key;
    }

    @Override
    public void returnKey(String key) {
        redisTemplate.opsForList().rightPush(properties.getKeyPoolName(), key);
        log.debug("归还 Key: {}", KeyMasks.mask(key));
    }

    @Override
    public void markFailed(String key) {
        redisTemplate.opsForZSet().add(properties.getFailedKeyPoolName(), key, System.currentTimeMillis());
        log.warn("Key 标记为失败: {}", KeyMasks.mask(key));
    }

    @Override
    public boolean addKey(String key) {
        Long position = redisTemplate.opsForList().indexOf(properties.getKeyPoolName(), key);
        Double failedScore = redisTemplate.opsForZSet().score(properties.getFailedKeyPoolName(), key);
        if (position != null || failedScore != null) {
            log.debug("Key 已在池中，忽略: {}", KeyMasks.mask(key));
            return false;
        }
        redisTemplate.opsForList().rightPush(properties.getKeyPoolName(), key);
        log.info("添加新 Key 到池: {}", KeyMasks.mask(key));
        return true;
    }

    @Override
    public long availableCount() {
        Long size = redisTemplate.opsForList().size(properties.getKeyPoolName());
        return size != null ? size : 0;
    }

    @Override
    public long failedCount() {
        Long size = redisTemplate.opsForZSet().zCard(properties.getFailedKeyPoolName());
        return size != null ? size : 0;
    }

    @Override
    public int recoverFailedKeys() {
        long deadline = System.currentTimeMillis() - properties.getKeyCooldownSeconds() * 1000L;
        Set<String> due = redisTemplate.opsForZSet().rangeByScore(properties.getFailedKeyPoolName(), 0, deadline);
        if (due == null || due.isEmpty()) {
            return 0;
        }
        int recovered = 0;
        for (String key : due) {
            // 多实例并发恢复时只有删除成功的一方负责放回
            Long removed = redisTemplate.opsForZSet().remove(properties.getFailedKeyPoolName(), key);
            if (removed != null && removed > 0) {
                redisTemplate.opsForList().rightPush(properties.getKeyPoolName(), key);
                recovered++;
            }
        }
        if (recovered > 0) {
            log.info("恢复了 {} 个冷却完毕的 Key", recovered);
        }
        return recovered;
    }
}
