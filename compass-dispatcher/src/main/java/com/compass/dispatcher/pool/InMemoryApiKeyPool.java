package com.compass.dispatcher.pool;

import com.compass.common.exception.KeyPoolExhaustedException;
import com.compass.common.util.KeyMasks;
import com.compass.dispatcher.config.DispatcherProperties;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.Iterator;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * 基于内存的 API Key 轮询池。
 * <p>
 * 可用 Key 放在 {@link LinkedBlockingQueue} 中，借出时阻塞等待；
 * 失败 Key 记录失败时间，冷却期满后由 {@link #recoverFailedKeys()} 放回。
 */
@Slf4j
public class InMemoryApiKeyPool implements ApiKeyPool {

    private final BlockingQueue<String> available = new LinkedBlockingQueue<>();
    private final Map<String, Long> failedAt = new ConcurrentHashMap<>();
    private final Set<String> known = ConcurrentHashMap.newKeySet();
    private final DispatcherProperties properties;
    private final Clock clock;

    public InMemoryApiKeyPool(DispatcherProperties properties) {
        this(properties, Clock.systemUTC());
    }

    InMemoryApiKeyPool(DispatcherProperties properties, Clock clock) {
        this.properties = properties;
        this.clock = clock;
    }

    @Override
    public String borrowKey() {
        try {
            String key = available.poll(properties.getKeyBorrowTimeoutSeconds(), TimeUnit.SECONDS);
            if (key == null) {
                throw KeyPoolExhaustedException.poolEmpty(properties.getKeyBorrowTimeoutSeconds());
            }
            log.debug("借出 Key: {}", KeyMasks.mask(key));
            return key;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw KeyPoolExhaustedException.interrupted();
        }
    }

    @Override
    public void returnKey(String key) {
        available.offer(key);
        log.debug("归还 Key: {}", KeyMasks.mask(key));
    }

    @Override
    public void markFailed(String key) {
        failedAt.put(key, clock.millis());
        log.warn("Key 标记为失败: {}", KeyMasks.mask(key));
    }

    @Override
    public boolean addKey(String key) {
        if (!known.add(key)) {
            log.debug("Key 已在池中，忽略: {}", KeyMasks.mask(key));
            return false;
        }
        available.offer(key);
        log.info("添加新 Key 到池: {}", KeyMasks.mask(key));
        return true;
    }

    @Override
    public long availableCount() {
        return available.size();
    }

    @Override
    public long failedCount() {
        return failedAt.size();
    }

    @Override
    public int recoverFailedKeys() {
        long deadline = clock.millis() - properties.getKeyCooldownSeconds() * 1000L;
        int recovered = 0;
        Iterator<Map.Entry<String, Long>> it = failedAt.entrySet().iterator();
        while (it.hasNext()) {
            Map.Entry<String, Long> entry = it.next();
            if (entry.getValue() <= deadline) {
                it.remove();
                available.offer(entry.getKey());
                recovered++;
            }
        }
        if (recovered > 0) {
            log.info("恢复了 {} 个冷却完毕的 Key", recovered);
        }
        return recovered;
    }
}
