package com.compass.config;

import com.compass.common.util.KeyMasks;
import com.compass.dispatcher.pool.ApiKeyPool;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.CommandLineRunner;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.List;

/**
 * 应用启动时把配置的 AI 服务 Key 加入调度池。
 * <p>
 * 配置方式：{@code compass.api-keys: sk-key1,sk-key2}，或环境变量 {@code COMPASS_API_KEYS}。
 * 使用 spring-ai 提供方时 Key 只用于限流计数，可以填任意占位值。
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ApiKeyInitializer implements CommandLineRunner {

    private final ApiKeyPool keyPool;

    @Value("${compass.api-keys:}")
    private String apiKeysConfig;

    @Override
    public void run(String... args) {
        List<String> keys = parseKeys(apiKeysConfig);
        if (keys.isEmpty()) {
            log.warn("未配置 compass.api-keys（环境变量 COMPASS_API_KEYS），AI 评分将全部失败，评论以空评分入库");
            return;
        }

        // 已在池中的 Key 会被忽略，多实例共用 Redis 池时重启不会重复加入
        int added = keyPool.addKeys(keys);
        log.info("已加载 {} 个 API Key 到调度池（新增 {}）: {}", keys.size(), added,
                keys.stream().map(KeyMasks::mask).toList());
    }

    static List<String> parseKeys(String config) {
        if (config == null || config.isBlank()) {
            return List.of();
        }
        return Arrays.stream(config.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .distinct()
                .toList();
    }
}
