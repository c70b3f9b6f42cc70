package com.compass.text.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.ComponentScan;
import org.springframework.context.annotation.Configuration;

/**
 * 文本清洗模块自动配置。
 */
@Configuration
@ComponentScan(basePackages = "com.compass.text")
@EnableConfigurationProperties(TextProperties.class)
public class TextModuleConfig {
}
