package com.compass.dispatcher.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * 调度中心配置项。
 */
@Data
@ConfigurationProperties(prefix = "compass.dispatcher")
public class DispatcherProperties {

    /** 存储类型: memory（内存，轻量部署） / redis（分布式） */
    private String storageType = "memory";

    /** 批量导入的最大并发数（工作线程数） */
    private int maxConcurrent = 4;

    /** AI 调用失败后的重试次数，默认重试一次 */
    private int retryCount = 1;

    /** 重试退避基数（毫秒），第 n 次重试等待 n * base */
    private long retryBackoffMillis = 1000;

    /** Key 池在 Redis 中的 key 名 */
    private String keyPoolName = "compass:ai:key:pool";

    /** 失败 Key 队列在 Redis 中的 key 名 */
    private String failedKeyPoolName = "compass:ai:key:failed";

    /** Key 冷却时间（秒），失败后等待多久恢复 */
    private int keyCooldownSeconds = 60;

    /** 限流窗口在 Redis 中的 key 前缀，后接 Key 标识 */
    private String rateLimitKeyPrefix = "compass:ai:ratelimit:";

    /** 滑动窗口限流的窗口大小（秒） */
    private int rateLimitWindowSeconds = 60;

    /** 每个 Key 在窗口内的最大请求数 */
    private int rateLimitMaxRequests = 50;

    /** 借用 Key 的超时时间（秒） */
    private int keyBorrowTimeoutSeconds = 30;
}
