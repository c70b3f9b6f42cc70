package com.compass.ai.agent;

import com.compass.ai.cache.ClassificationCache;
import com.compass.ai.cache.InMemoryClassificationStore;
import com.compass.ai.prompt.PromptTemplates;
import com.compass.ai.provider.AiProvider;
import com.compass.ai.provider.AiProviderFactory;
import com.compass.common.exception.AiServiceException;
import com.compass.common.model.Language;
import com.compass.dispatcher.service.DispatcherService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.beans.factory.ObjectProvider;

import java.util.function.Function;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class AspectScorerTest {

    private static final String VALID_REPLY =
            "{\"academics\":4,\"cost\":2,\"social\":5,\"accommodation\":3,\"summary\":\"Strong courses, costly city.\"}";

    @Mock
    private AiProviderFactory providerFactory;
    @Mock
    private AiProvider provider;
    @Mock
    private PromptTemplates promptTemplates;
    @Mock
    private DispatcherService dispatcher;
    @Mock
    private ObjectProvider<AiCallRecorder> recorders;
    @Mock
    private AiCallRecorder recorder;

    private ClassificationCache cache;
    private AspectScorer scorer;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        cache = new ClassificationCache(new InMemoryClassificationStore());
        scorer = new AspectScorer(cache, providerFactory, promptTemplates, new ClassifierResponseParser(),
                dispatcher, recorders);

        lenient().when(providerFactory.getProvider()).thenReturn(provider);
        lenient().when(provider.getProviderName()).thenReturn("openai");
        lenient().when(promptTemplates.renderClassification(anyString(), any())).thenReturn("PROMPT");
        lenient().when(recorders.orderedStream()).thenAnswer(inv -> Stream.of(recorder));
        // 模拟调度中心：借一个固定 Key 调用一次，失败时包装成 AiServiceException
        lenient().when(dispatcher.callWithRetry(anyString(), any())).thenAnswer(inv -> {
            Function<String, Object> call = inv.getArgument(1);
            try {
                return call.apply("sk-test-key-0001");
            } catch (RuntimeException e) {
                throw new AiServiceException("retries exhausted", e);
            }
        });
    }

    @Test
    void scoresTextThroughProviderAndParser() {
        when(provider.complete("PROMPT", "sk-test-key-0001")).thenReturn(VALID_REPLY);

        ScoringOutcome outcome = scorer.score("Strong courses but Munich is costly.", Language.EN);

        assertThat(outcome.isSuccess()).isTrue();
        assertThat(outcome.isCacheHit()).isFalse();
        assertThat(outcome.getResult().getScores().getSocial()).isEqualTo(5);
        assertThat(outcome.getResult().getSummary()).isEqualTo("Strong courses, costly city.");
        verify(promptTemplates).renderClassification("Strong courses but Munich is costly.", Language.EN);
    }

    @Test
    void identicalTextDoesNotCallProviderTwice() {
        when(provider.complete(anyString(), anyString())).thenReturn(VALID_REPLY);

        ScoringOutcome first = scorer.score("Same review text", Language.EN);
        ScoringOutcome second = scorer.score("Same review text", Language.EN);

        assertThat(second.isCacheHit()).isTrue();
        assertThat(second.getResult()).isEqualTo(first.getResult());
        verify(provider, times(1)).complete(anyString(), anyString());
    }

    @Test
    void outOfRangeReplyYieldsFailureAndIsNotCached() {
        when(provider.complete(anyString(), anyString()))
                .thenReturn("{\"academics\":9,\"cost\":2,\"social\":5,\"accommodation\":3,\"summary\":\"x\"}")
                .thenReturn(VALID_REPLY);

        ScoringOutcome failed = scorer.score("Review with bad reply", Language.EN);
        ScoringOutcome retriedLater = scorer.score("Review with bad reply", Language.EN);

        assertThat(failed.isSuccess()).isFalse();
        assertThat(failed.getResult()).isNull();
        assertThat(failed.getFailureReason()).isNotBlank();
        assertThat(retriedLater.isSuccess()).isTrue();
        assertThat(retriedLater.isCacheHit()).isFalse();
    }

    @Test
    void recordsEveryCallAndCacheHit() {
        when(provider.complete(anyString(), anyString())).thenReturn(VALID_REPLY);

        scorer.score("Logged review", Language.EN);
        scorer.score("Logged review", Language.EN);

        ArgumentCaptor<AiCallEvent> events = ArgumentCaptor.forClass(AiCallEvent.class);
        verify(recorder, atLeastOnce()).record(events.capture());
        assertThat(events.getAllValues()).hasSize(2);
        assertThat(events.getAllValues().get(0).isCacheHit()).isFalse();
        assertThat(events.getAllValues().get(0).getProvider()).isEqualTo("openai");
        assertThat(events.getAllValues().get(1).isCacheHit()).isTrue();
        verify(dispatcher, times(1)).callWithRetry(eq(AiCallEvent.PURPOSE_CLASSIFY), any());
    }
}
