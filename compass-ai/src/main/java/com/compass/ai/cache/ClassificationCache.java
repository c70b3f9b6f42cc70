package com.compass.ai.cache;

import com.compass.common.dto.ClassifierResult;
import com.compass.common.model.Language;
import com.compass.common.util.Fingerprints;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;

/**
 * 内容寻址的分类缓存。
 * <p>
 * 指纹 = SHA-256(语言标签, 清洗后正文)。同一指纹在缓存生命周期内最多触发一次外部调用：
 * 并发请求同一指纹时，后来者等待首个请求的 in-flight 结果。计算失败不入缓存，下次仍会重新计算。
 */
@Slf4j
@Component
public class ClassificationCache {

    private final ClassificationStore store;
    private final Map<String, CompletableFuture<ClassifierResult>> inFlight = new ConcurrentHashMap<>();
    private final AtomicLong hits = new AtomicLong();
    private final AtomicLong misses = new AtomicLong();

    public ClassificationCache(ClassificationStore store) {
        this.store = store;
    }

    /**
     * 命中则直接返回缓存结果，否则调用 computeFn 计算并保存。
     *
     * @throws RuntimeException computeFn 抛出的异常原样向上传递
     */
    public ClassifierResult getOrCompute(String cleanText, Language language, Supplier<ClassifierResult> computeFn) {
        String fingerprint = Fingerprints.ofContent(language.tag(), cleanText);

        Optional<ClassifierResult> stored = store.find(fingerprint);
        if (stored.isPresent()) {
            hits.incrementAndGet();
            return stored.get();
        }

        CompletableFuture<ClassifierResult> mine = new CompletableFuture<>();
        CompletableFuture<ClassifierResult> existing = inFlight.putIfAbsent(fingerprint, mine);
        if (existing != null) {
            log.debug("指纹 {} 正在计算中，等待已有请求", Fingerprints.shortForm(fingerprint));
            ClassifierResult shared = await(existing);
            hits.incrementAndGet();
            return shared;
        }

        try {
            // 抢到计算权之前，上一个计算者可能刚刚写完
            stored = store.find(fingerprint);
            if (stored.isPresent()) {
                hits.incrementAndGet();
                mine.complete(stored.get());
                return stored.get();
            }

            misses.incrementAndGet();
            ClassifierResult result = computeFn.get();
            mine.complete(result);
            persist(fingerprint, language, result);
            return result;
        } catch (RuntimeException e) {
            mine.completeExceptionally(e);
            throw e;
        } finally {
            inFlight.remove(fingerprint, mine);
        }
    }

    /**
     * 结果已经算出来了，写存储失败只影响下次命中，不影响本次返回。
     */
    private void persist(String fingerprint, Language language, ClassifierResult result) {
        try {
            store.save(fingerprint, language, result);
            log.debug("分类结果已缓存: {}", Fingerprints.shortForm(fingerprint));
        } catch (RuntimeException e) {
            log.warn("分类结果写入缓存失败, 指纹 {}: {}", Fingerprints.shortForm(fingerprint), e.getMessage(), e);
        }
    }

    public CacheStats stats() {
        return new CacheStats(hits.get(), misses.get(), store.size());
    }

    private static ClassifierResult await(CompletableFuture<ClassifierResult> future) {
        try {
            return future.join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException cause) {
                throw cause;
            }
            throw e;
        }
    }
}
