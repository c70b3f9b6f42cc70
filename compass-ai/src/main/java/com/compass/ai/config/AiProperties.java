package com.compass.ai.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * AI 模块配置项。
 */
@Data
@ConfigurationProperties(prefix = "compass.ai")
public class AiProperties {

    /** 当前使用的 AI 提供商: openai / anthropic / spring-ai */
    private String provider = "openai";

    /** OpenAI 兼容接口配置 */
    private OpenAiConfig openai = new OpenAiConfig();

    /** Anthropic 配置 */
    private AnthropicConfig anthropic = new AnthropicConfig();

    /** 单次 API 调用的读超时（秒） */
    private int requestTimeoutSeconds = 30;

    /** 院校综述 */
    private SummaryConfig summary = new SummaryConfig();

    @Data
    public static class OpenAiConfig {
        private String baseUrl = "https://api.openai.com/v1";
        private String model = "gpt-4o-mini";
        private double temperature = 0.0;
        private int maxTokens = 512;
    }

    @Data
    public static class AnthropicConfig {
        private String baseUrl = "https://api.anthropic.com/v1";
        private String model = "claude-3-5-haiku-20241022";
        private double temperature = 0.0;
        private int maxTokens = 512;
    }

    @Data
    public static class SummaryConfig {

        /** 参与综述的最近评论条数上限 */
        private int maxReviews = 20;

        /** 综述与聚合结果的缓存时长（分钟） */
        private int cacheTtlMinutes = 10;
    }
}
