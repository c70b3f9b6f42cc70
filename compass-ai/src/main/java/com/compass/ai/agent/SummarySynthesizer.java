package com.compass.ai.agent;

import com.compass.ai.prompt.PromptTemplates;
import com.compass.ai.provider.AiProvider;
import com.compass.ai.provider.AiProviderFactory;
import com.compass.common.exception.AiResponseFormatException;
import com.compass.common.exception.AiServiceException;
import com.compass.dispatcher.service.DispatcherService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

/**
 * 院校综述：把若干条评论摘要合成一段叙述。
 * <p>
 * 综述是锦上添花，AI 失败只记日志并返回空，不影响聚合结果。缓存由调用方负责。
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SummarySynthesizer {

    private final AiProviderFactory providerFactory;
    private final PromptTemplates promptTemplates;
    private final DispatcherService dispatcher;
    private final ObjectProvider<AiCallRecorder> recorders;

    /**
     * @param uniName  院校名
     * @param snippets 评论摘要（无摘要时为正文），按时间倒序
     * @return 综述；无输入或 AI 失败时为空
     */
    public Optional<String> synthesize(String uniName, List<String> snippets) {
        if (snippets == null || snippets.isEmpty()) {
            return Optional.empty();
        }

        try {
            AiProvider provider = providerFactory.getProvider();
            String prompt = promptTemplates.renderUniversitySummary(uniName, snippets);

            String summary = dispatcher.callWithRetry(AiCallEvent.PURPOSE_SUMMARY, apiKey -> {
                long start = System.currentTimeMillis();
                try {
                    String text = provider.complete(prompt, apiKey).trim();
                    if (text.isEmpty()) {
                        throw new AiResponseFormatException("综述为空");
                    }
                    record(provider, uniName, start, null);
                    return text;
                } catch (RuntimeException e) {
                    record(provider, uniName, start, e);
                    throw e;
                }
            });

            log.info("院校 {} 综述生成完成, 基于 {} 条评论", uniName, snippets.size());
            return Optional.of(summary);

        } catch (AiServiceException e) {
            log.warn("院校 {} 综述生成失败: {}", uniName, e.getMessage());
            return Optional.empty();
        }
    }

    private void record(AiProvider provider, String uniName, long start, RuntimeException error) {
        AiCallEvent event = AiCallEvent.builder()
                .purpose(AiCallEvent.PURPOSE_SUMMARY)
                .provider(provider.getProviderName())
                .subject(uniName)
                .latencyMs(System.currentTimeMillis() - start)
                .success(error == null)
                .errorMessage(error != null ? error.getMessage() : null)
                .build();
        recorders.orderedStream().forEach(r -> r.record(event));
    }
}
