package com.compass.ai.provider;

/**
 * AI 文本补全提供商接口。
 * 通过适配器模式支持不同的 AI 服务商（OpenAI 兼容接口、Anthropic、Spring AI ChatModel）。
 */
public interface AiProvider {

    /**
     * 发送单轮 Chat 请求（阻塞式，等待完整响应）。
     *
     * @param prompt 完整提示词
     * @param apiKey 从 Key 池借出的 API Key
     * @return AI 返回的文本
     */
    String complete(String prompt, String apiKey);

    /**
     * 获取提供商名称。
     */
    String getProviderName();
}
