package com.compass.ai.provider;

import com.compass.ai.config.AiProperties;
import com.compass.common.exception.AiServiceException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import org.springframework.stereotype.Component;

import java.io.IOException;

/**
 * Anthropic Messages API 实现。
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AnthropicProvider implements AiProvider {

    private static final MediaType JSON_MEDIA = MediaType.parse("application/json; charset=utf-8");
    private static final String API_VERSION = "2023-06-01";

    private final OkHttpClient aiHttpClient;
    private final AiProperties properties;
    private final ObjectMapper objectMapper = new ObjectMapper();

    @Override
    public String complete(String prompt, String apiKey) {
        AiProperties.AnthropicConfig config = properties.getAnthropic();
        String url = config.getBaseUrl() + "/messages";

        try {
            ObjectNode root = objectMapper.createObjectNode();
            root.put("model", config.getModel());
            root.put("max_tokens", config.getMaxTokens());
            root.put("temperature", config.getTemperature());

            ArrayNode messages = root.putArray("messages");
            ObjectNode userMsg = messages.addObject();
            userMsg.put("role", "user");
            userMsg.put("content", prompt);

            Request request = new Request.Builder()
                    .url(url)
                    .addHeader("x-api-key", apiKey)
                    .addHeader("anthropic-version", API_VERSION)
                    .addHeader("Content-Type", "application/json")
                    .post(RequestBody.create(objectMapper.writeValueAsString(root), JSON_MEDIA))
                    .build();

            try (Response response = aiHttpClient.newCall(request).execute()) {
                String body = response.body() != null ? response.body().string() : "";

                if (!response.isSuccessful()) {
                    log.error("Anthropic API 调用失败: {} - {}", response.code(), OpenAiProvider.abbreviate(body));
                    throw new AiServiceException("Anthropic API 返回错误: " + response.code());
                }

                JsonNode json = objectMapper.readTree(body);
                StringBuilder result = new StringBuilder();
                for (JsonNode block : json.path("content")) {
                    if ("text".equals(block.path("type").asText())) {
                        result.append(block.path("text").asText());
                    }
                }

                if (result.toString().isBlank()) {
                    throw new AiServiceException("Anthropic API 返回空内容");
                }

                log.debug("Anthropic 响应长度: {} 字符", result.length());
                return result.toString();
            }

        } catch (AiServiceException e) {
            throw e;
        } catch (IOException e) {
            throw new AiServiceException("调用 Anthropic API 时发生网络错误", e);
        }
    }

    @Override
    public String getProviderName() {
        return "anthropic";
    }
}
