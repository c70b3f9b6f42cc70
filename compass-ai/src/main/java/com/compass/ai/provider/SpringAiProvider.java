package com.compass.ai.provider;

import com.compass.common.exception.AiServiceException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.chat.messages.UserMessage;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.chat.prompt.Prompt;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * 基于 Spring AI {@link ChatModel} 的实现。
 * <p>
 * 凭据由 ChatModel 自身的配置（spring.ai.*）决定，Key 池借出的 Key 只用于限流计数。
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SpringAiProvider implements AiProvider {

    private final ObjectProvider<ChatModel> chatModelProvider;

    @Override
    public String complete(String prompt, String apiKey) {
        ChatModel chatModel = chatModelProvider.getIfAvailable();
        if (chatModel == null) {
            throw new AiServiceException("未配置 Spring AI ChatModel");
        }

        ChatResponse response;
        try {
            response = chatModel.call(new Prompt(List.of(new UserMessage(prompt))));
        } catch (RuntimeException e) {
            throw new AiServiceException("Spring AI 调用失败: " + e.getMessage(), e);
        }

        String text = response != null && response.getResult() != null && response.getResult().getOutput() != null
                ? response.getResult().getOutput().getText()
                : null;
        if (text == null || text.isBlank()) {
            throw new AiServiceException("Spring AI 返回空内容");
        }
        log.debug("Spring AI 响应长度: {} 字符", text.length());
        return text;
    }

    @Override
    public String getProviderName() {
        return "spring-ai";
    }
}
