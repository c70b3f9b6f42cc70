package com.compass.dispatcher.service;

import com.compass.common.exception.AiResponseFormatException;
import com.compass.common.exception.AiServiceException;
import com.compass.common.exception.KeyPoolExhaustedException;
import com.compass.dispatcher.config.DispatcherProperties;
import com.compass.dispatcher.pool.ApiKeyPool;
import com.compass.dispatcher.ratelimit.RateLimiter;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Semaphore;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

/**
 * 调度服务：AI 调用的 Key 借还、限流与重试，以及批量任务的有界并发执行。
 * <p>
 * 核心策略：
 * - 固定大小的工作线程池 + Semaphore 控制并发度，调度方阻塞等待而非失败
 * - 调度线程被中断时停止调度剩余任务，已调度任务跑完并保留结果
 * - AI 调用失败按配置重试（默认一次），线性退避
 */
@Slf4j
@Service
public class DispatcherService {

    private final ApiKeyPool keyPool;
    private final RateLimiter rateLimiter;
    private final DispatcherProperties properties;
    private final ExecutorService workerPool;

    public DispatcherService(ApiKeyPool keyPool, RateLimiter rateLimiter, DispatcherProperties properties) {
        this.keyPool = keyPool;
        this.rateLimiter = rateLimiter;
        this.properties = properties;
        this.workerPool = Executors.newFixedThreadPool(Math.max(1, properties.getMaxConcurrent()),
                namedThreadFactory("compass-worker-"));
    }

    /**
     * 有界并发执行一批任务。
     * <p>
     * 任务本身应自行处理业务异常；抛出的异常只记录日志，对应位置结果为 null。
     * 调度线程被中断后，尚未调度的任务不会执行，对应位置同样为 null。
     *
     * @param items 待处理的数据列表
     * @param task  任务逻辑
     * @return 结果列表（与输入顺序一致）
     */
    public <T, R> List<R> dispatchAll(List<T> items, Function<T, R> task) {
        int totalTasks = items.size();
        if (totalTasks == 0) {
            return new ArrayList<>();
        }
        int keyCount = Math.max(1, (int) keyPool.availableCount());
        int concurrency = Math.min(keyCount, Math.min(Math.max(1, properties.getMaxConcurrent()), totalTasks));

        log.info("开始并发调度 {} 个任务, Key池可用: {}, 并发度: {}", totalTasks, keyCount, concurrency);

        Semaphore semaphore = new Semaphore(concurrency);
        AtomicInteger completed = new AtomicInteger(0);
        List<CompletableFuture<R>> futures = new ArrayList<>(totalTasks);

        for (int idx = 0; idx < totalTasks; idx++) {
            try {
                semaphore.acquire();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("调度被中断, 已调度 {}/{}，剩余任务不再执行", idx, totalTasks);
                break;
            }

            final T item = items.get(idx);
            final int taskIndex = idx;
            CompletableFuture<R> future = CompletableFuture.supplyAsync(() -> {
                try {
                    return task.apply(item);
                } catch (RuntimeException e) {
                    log.warn("任务 #{} 执行异常: {}", taskIndex, e.getMessage());
                    return null;
                } finally {
                    semaphore.release();
                    int done = completed.incrementAndGet();
                    if (done % 10 == 0 || done == totalTasks) {
                        log.info("调度进度: {}/{}", done, totalTasks);
                    }
                }
            }, workerPool);
            futures.add(future);
        }

        // 已调度的任务一定会跑完，等待期间先清掉中断标记，收集完再恢复
        boolean interrupted = Thread.interrupted();
        List<R> results = new ArrayList<>(totalTasks);
        for (CompletableFuture<R> future : futures) {
            results.add(awaitUninterruptibly(future));
        }
        while (results.size() < totalTasks) {
            results.add(null);
        }
        if (interrupted || Thread.currentThread().isInterrupted()) {
            Thread.currentThread().interrupt();
        }
        return results;
    }

    /**
     * 借 Key 调用 AI，失败时按配置重试。
     * <p>
     * 网络/鉴权类失败会把 Key 标记为失败；返回内容不合法（{@link AiResponseFormatException}）
     * 不是 Key 的问题，Key 正常归还。
     *
     * @param purpose 调用用途，仅用于日志
     * @param call    实际调用 apiKey -> result
     * @throws AiServiceException 全部尝试失败
     */
    public <R> R callWithRetry(String purpose, Function<String, R> call) {
        int maxAttempts = Math.max(0, properties.getRetryCount()) + 1;
        RuntimeException lastException = null;

        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            if (attempt > 1) {
                backoff(attempt - 1);
                if (Thread.currentThread().isInterrupted()) {
                    break;
                }
            }

            String key;
            try {
                key = borrowKeyWithRateLimit();
            } catch (KeyPoolExhaustedException e) {
                log.warn("[{}] 暂无可用 Key (尝试 {}/{}, {}): {}",
                        purpose, attempt, maxAttempts, e.getReason(), e.getMessage());
                lastException = e;
                if (!e.isRetryable()) {
                    break;
                }
                continue;
            }

            try {
                R result = call.apply(key);
                keyPool.returnKey(key);
                return result;
            } catch (AiResponseFormatException e) {
                keyPool.returnKey(key);
                log.warn("[{}] AI 返回内容不合法 (尝试 {}/{}): {}", purpose, attempt, maxAttempts, e.getMessage());
                lastException = e;
            } catch (RuntimeException e) {
                keyPool.markFailed(key);
                log.warn("[{}] AI 调用失败 (尝试 {}/{}): {}", purpose, attempt, maxAttempts, e.getMessage());
                lastException = e;
            }
        }

        throw new AiServiceException("[" + purpose + "] 在 " + maxAttempts + " 次尝试后仍然失败", lastException);
    }

    /**
     * 借出 Key 并确保未超过速率限制。
     */
    private String borrowKeyWithRateLimit() {
        int maxAttempts = 3;
        for (int i = 0; i < maxAttempts; i++) {
            String key = keyPool.borrowKey();
            if (rateLimiter.tryAcquire(key)) {
                return key;
            }
            keyPool.returnKey(key);
            log.debug("Key 已达限流，等待后重试");
            sleep(1000);
        }
        throw KeyPoolExhaustedException.rateLimited(maxAttempts);
    }

    private void backoff(int retryIndex) {
        long delay = properties.getRetryBackoffMillis() * retryIndex;
        if (delay > 0) {
            sleep(delay);
        }
    }

    private void sleep(long ms) {
        try {
            Thread.sleep(ms);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private <R> R awaitUninterruptibly(CompletableFuture<R> future) {
        try {
            return future.join();
        } catch (CompletionException | CancellationException e) {
            log.error("获取任务结果异常", e.getCause() != null ? e.getCause() : e);
            return null;
        }
    }

    @PreDestroy
    public void shutdown() {
        workerPool.shutdownNow();
    }

    private static ThreadFactory namedThreadFactory(String prefix) {
        AtomicInteger counter = new AtomicInteger(1);
        return runnable -> {
            Thread t = new Thread(runnable, prefix + counter.getAndIncrement());
            t.setDaemon(true);
            return t;
        };
    }
}
