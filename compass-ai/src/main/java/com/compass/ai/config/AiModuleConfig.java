package com.compass.ai.config;

import com.compass.ai.cache.ClassificationStore;
import com.compass.ai.cache.InMemoryClassificationStore;
import lombok.extern.slf4j.Slf4j;
import okhttp3.OkHttpClient;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.ComponentScan;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * AI 模块自动配置。
 * <p>
 * 分类缓存通过 {@code compass.cache.storage-type} 切换：
 * {@code memory}（默认）在这里注册，{@code jdbc} 由 web 模块提供。
 */
@Slf4j
@Configuration
@ComponentScan(basePackages = "com.compass.ai")
@EnableConfigurationProperties({AiProperties.class, CacheProperties.class})
public class AiModuleConfig {

    @Bean
    public OkHttpClient aiHttpClient(AiProperties properties) {
        return new OkHttpClient.Builder()
                .connectTimeout(Duration.ofSeconds(10))
                .readTimeout(Duration.ofSeconds(properties.getRequestTimeoutSeconds()))
                .writeTimeout(Duration.ofSeconds(10))
                .build();
    }

    @Bean
    @ConditionalOnProperty(name = "compass.cache.storage-type", havingValue = "memory", matchIfMissing = true)
    public ClassificationStore inMemoryClassificationStore() {
        log.info("使用内存分类缓存（重启后失效）");
        return new InMemoryClassificationStore();
    }
}
