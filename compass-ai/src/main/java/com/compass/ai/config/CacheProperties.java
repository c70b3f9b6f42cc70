package com.compass.ai.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * 分类缓存配置项。
 */
@Data
@ConfigurationProperties(prefix = "compass.cache")
public class CacheProperties {

    /** 存储类型: memory（进程内，重启即失效） / jdbc（落库，跨重启命中） */
    private String storageType = "memory";
}
