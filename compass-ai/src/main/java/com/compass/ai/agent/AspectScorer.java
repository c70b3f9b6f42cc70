package com.compass.ai.agent;

import com.compass.ai.cache.ClassificationCache;
import com.compass.ai.prompt.PromptTemplates;
import com.compass.ai.provider.AiProvider;
import com.compass.ai.provider.AiProviderFactory;
import com.compass.common.dto.ClassifierResult;
import com.compass.common.exception.AiServiceException;
import com.compass.common.model.Language;
import com.compass.common.util.Fingerprints;
import com.compass.dispatcher.service.DispatcherService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Service;

/**
 * 方面级情感评分（ABSA）。
 * <p>
 * 先查分类缓存；未命中时渲染分类 Prompt，经调度中心借 Key、限流、重试调用 AI，
 * 再解析校验返回。重试用尽后返回失败结果而不抛异常。
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AspectScorer {

    private final ClassificationCache cache;
    private final AiProviderFactory providerFactory;
    private final PromptTemplates promptTemplates;
    private final ClassifierResponseParser parser;
    private final DispatcherService dispatcher;
    private final ObjectProvider<AiCallRecorder> recorders;

    public ScoringOutcome score(String cleanText, Language language) {
        String fingerprint = Fingerprints.ofContent(language.tag(), cleanText);
        boolean[] computed = {false};

        try {
            ClassifierResult result = cache.getOrCompute(cleanText, language, () -> {
                computed[0] = true;
                return classify(cleanText, language, fingerprint);
            });

            if (!computed[0]) {
                log.debug("分类缓存命中: {}", Fingerprints.shortForm(fingerprint));
                record(AiCallEvent.builder()
                        .purpose(AiCallEvent.PURPOSE_CLASSIFY)
                        .provider("cache")
                        .subject(Fingerprints.shortForm(fingerprint))
                        .success(true)
                        .cacheHit(true)
                        .build());
            }
            return ScoringOutcome.success(result, !computed[0]);

        } catch (AiServiceException e) {
            log.warn("评论 {} 评分失败: {}", Fingerprints.shortForm(fingerprint), e.getMessage());
            return ScoringOutcome.failure(e.getMessage());
        }
    }

    private ClassifierResult classify(String cleanText, Language language, String fingerprint) {
        AiProvider provider = providerFactory.getProvider();
        String prompt = promptTemplates.renderClassification(cleanText, language);

        return dispatcher.callWithRetry(AiCallEvent.PURPOSE_CLASSIFY, apiKey -> {
            long start = System.currentTimeMillis();
            try {
                ClassifierResult result = parser.parse(provider.complete(prompt, apiKey));
                record(callEvent(provider, fingerprint, start, null));
                return result;
            } catch (RuntimeException e) {
                record(callEvent(provider, fingerprint, start, e));
                throw e;
            }
        });
    }

    private AiCallEvent callEvent(AiProvider provider, String fingerprint, long start, RuntimeException error) {
        return AiCallEvent.builder()
                .purpose(AiCallEvent.PURPOSE_CLASSIFY)
                .provider(provider.getProviderName())
                .subject(Fingerprints.shortForm(fingerprint))
                .latencyMs(System.currentTimeMillis() - start)
                .success(error == null)
                .errorMessage(error != null ? error.getMessage() : null)
                .build();
    }

    private void record(AiCallEvent event) {
        recorders.orderedStream().forEach(r -> r.record(event));
    }
}
