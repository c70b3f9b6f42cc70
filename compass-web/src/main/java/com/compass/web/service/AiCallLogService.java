package com.compass.web.service;

import com.compass.ai.agent.AiCallEvent;
import com.compass.ai.agent.AiCallRecorder;
import com.compass.common.util.Timestamps;
import com.compass.web.entity.AiCallLogEntity;
import com.compass.web.repository.AiCallLogRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

/**
 * AI 调用日志落库。
 * <p>
 * 日志写入失败只告警，不影响评分流程本身。
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AiCallLogService implements AiCallRecorder {

    private static final int MAX_ERROR_LENGTH = 500;

    private final AiCallLogRepository repository;

    @Override
    public void record(AiCallEvent event) {
        AiCallLogEntity entity = AiCallLogEntity.builder()
                .purpose(event.getPurpose())
                .provider(event.getProvider())
                .subject(event.getSubject())
                .latencyMs(event.getLatencyMs())
                .success(event.isSuccess())
                .cacheHit(event.isCacheHit())
                .errorMessage(truncate(event.getErrorMessage()))
                .createdAt(Timestamps.now())
                .build();
        try {
            repository.save(entity);
        } catch (DataAccessException e) {
            log.warn("AI 调用日志写入失败: {}", e.getMessage());
        }
    }

    private static String truncate(String message) {
        if (message == null || message.length() <= MAX_ERROR_LENGTH) {
            return message;
        }
        return message.substring(0, MAX_ERROR_LENGTH);
    }
}
