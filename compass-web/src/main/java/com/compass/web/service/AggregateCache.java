package com.compass.web.service;

import com.compass.ai.config.AiProperties;
import com.compass.common.dto.UniversityAggregate;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * 聚合结果与院校综述缓存，由聚合服务显式持有。
 * <p>
 * 综述按 (院校, 参与评论 ID 指纹) 缓存，评论集合不变则复用；
 * 有新的审核通过评论时按院校整体失效。生成失败的综述不缓存。
 */
@Slf4j
@Component
public class AggregateCache {

    private static final char KEY_SEPARATOR = '\u0000';

    private final Cache<String, UniversityAggregate> aggregates;
    private final Cache<String, String> summaries;

    /** 失效计数，加载期间发生过失效的结果不写回 */
    private final AtomicLong invalidations = new AtomicLong();

    public AggregateCache(AiProperties aiProperties) {
        Duration ttl = Duration.ofMinutes(aiProperties.getSummary().getCacheTtlMinutes());
        this.aggregates = Caffeine.newBuilder()
                .expireAfterWrite(ttl)
                .maximumSize(1_000)
                .build();
        this.summaries = Caffeine.newBuilder()
                .expireAfterWrite(ttl)
                .maximumSize(1_000)
                .build();
    }

    /**
     * 取聚合结果，未命中时调用 loader 计算；loader 抛出的异常原样传递，不缓存。
     * <p>
     * loader 含 AI 综述调用，在缓存之外执行后再写入，不占用 Caffeine 的原子计算；
     * 同一院校并发未命中时可能重复计算，结果相同，后写覆盖先写。
     * 加载期间有过失效的，本次结果照常返回但不缓存。
     */
    public UniversityAggregate getAggregate(String uniName, Function<String, UniversityAggregate> loader) {
        UniversityAggregate cached = aggregates.getIfPresent(uniName);
        if (cached != null) {
            return cached;
        }
        long generation = invalidations.get();
        UniversityAggregate computed = loader.apply(uniName);
        if (invalidations.get() == generation) {
            aggregates.put(uniName, computed);
        }
        return computed;
    }

    public Optional<String> getSummary(String uniName, String idsFingerprint, Supplier<Optional<String>> generator) {
        String key = uniName + KEY_SEPARATOR + idsFingerprint;
        String cached = summaries.getIfPresent(key);
        if (cached != null) {
            return Optional.of(cached);
        }
        Optional<String> generated = generator.get();
        generated.ifPresent(summary -> summaries.put(key, summary));
        return generated;
    }

    /**
     * 某院校有新的审核通过评论时调用。
     */
    public void invalidate(String uniName) {
        invalidations.incrementAndGet();
        aggregates.invalidate(uniName);
        String prefix = uniName + KEY_SEPARATOR;
        summaries.asMap().keySet().removeIf(key -> key.startsWith(prefix));
        log.debug("院校 {} 的聚合缓存已失效", uniName);
    }
}
