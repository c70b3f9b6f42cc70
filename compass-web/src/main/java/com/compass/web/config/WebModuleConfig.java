package com.compass.web.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.ComponentScan;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.relational.core.dialect.Dialect;

/**
 * Web 模块配置。
 */
@Configuration
@ComponentScan(basePackages = "com.compass.web")
@EnableConfigurationProperties({PipelineProperties.class, AdminProperties.class})
public class WebModuleConfig {

    /**
     * Spring Data JDBC 无法从 JDBC URL 识别 SQLite，显式注册方言。
     */
    @Bean
    public Dialect jdbcDialect() {
        return SqliteDialect.INSTANCE;
    }
}
