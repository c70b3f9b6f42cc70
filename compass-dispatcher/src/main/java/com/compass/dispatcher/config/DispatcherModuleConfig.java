package com.compass.dispatcher.config;

import com.compass.dispatcher.pool.ApiKeyPool;
import com.compass.dispatcher.pool.InMemoryApiKeyPool;
import com.compass.dispatcher.pool.RedisApiKeyPool;
import com.compass.dispatcher.ratelimit.InMemoryRateLimiter;
import com.compass.dispatcher.ratelimit.RateLimiter;
import com.compass.dispatcher.ratelimit.RedisRateLimiter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.ComponentScan;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;

/**
 * 调度模块配置。
 * <p>
 * Key 池和限流窗口总是成对切换，由 {@code compass.dispatcher.storage-type} 决定：
 * {@code memory}（默认）单进程导入，{@code redis} 多个实例共用同一批 AI Key 和配额。
 */
@Slf4j
@Configuration
@ComponentScan(basePackages = "com.compass.dispatcher")
@EnableConfigurationProperties(DispatcherProperties.class)
public class DispatcherModuleConfig {

    @Configuration(proxyBeanMethods = false)
    @ConditionalOnProperty(name = "compass.dispatcher.storage-type", havingValue = "memory", matchIfMissing = true)
    static class LocalKeyStorage {

        @Bean
        public ApiKeyPool apiKeyPool(DispatcherProperties properties) {
            log.info("AI Key 池: 进程内, 借用超时 {}s, 失败冷却 {}s",
                    properties.getKeyBorrowTimeoutSeconds(), properties.getKeyCooldownSeconds());
            return new InMemoryApiKeyPool(properties);
        }

        @Bean
        public RateLimiter rateLimiter(DispatcherProperties properties) {
            log.info("AI 调用限流: 进程内, 每个 Key {} 次 / {}s",
                    properties.getRateLimitMaxRequests(), properties.getRateLimitWindowSeconds());
            return new InMemoryRateLimiter(properties);
        }
    }

    @Configuration(proxyBeanMethods = false)
    @ConditionalOnProperty(name = "compass.dispatcher.storage-type", havingValue = "redis")
    static class SharedKeyStorage {

        @Bean
        public ApiKeyPool apiKeyPool(StringRedisTemplate redisTemplate, DispatcherProperties properties) {
            log.info("AI Key 池: Redis 共享 (可用 {}, 冷却 {})",
                    properties.getKeyPoolName(), properties.getFailedKeyPoolName());
            return new RedisApiKeyPool(redisTemplate, properties);
        }

        @Bean
        public RateLimiter rateLimiter(StringRedisTemplate redisTemplate, DispatcherProperties properties) {
            log.info("AI 调用限流: Redis 共享 ({}*), 每个 Key {} 次 / {}s", properties.getRateLimitKeyPrefix(),
                    properties.getRateLimitMaxRequests(), properties.getRateLimitWindowSeconds());
            return new RedisRateLimiter(redisTemplate, properties);
        }
    }
}
