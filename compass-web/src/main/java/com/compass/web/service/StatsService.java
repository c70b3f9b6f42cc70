package com.compass.web.service;

import com.compass.ai.cache.CacheStats;
import com.compass.ai.cache.ClassificationCache;
import com.compass.common.dto.AdminStats;
import com.compass.common.model.ReviewStatus;
import com.compass.dispatcher.pool.ApiKeyPool;
import com.compass.web.entity.AiCallLogEntity;
import com.compass.web.repository.AiCallLogRepository;
import com.compass.web.repository.ReviewRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * 管理端运行统计：审核队列、缓存效果、AI 调用健康度与 Key 池状态。
 */
@Service
@RequiredArgsConstructor
public class StatsService {

    private final ReviewRepository reviewRepository;
    private final AiCallLogRepository callLogRepository;
    private final ClassificationCache classificationCache;
    private final ApiKeyPool keyPool;

    public AdminStats snapshot() {
        Map<String, Long> byStatus = new LinkedHashMap<>();
        for (ReviewStatus status : ReviewStatus.values()) {
            byStatus.put(status.name().toLowerCase(Locale.ROOT), reviewRepository.countByStatus(status.name()));
        }

        CacheStats cacheStats = classificationCache.stats();

        List<AdminStats.FailedCall> recentFailures = callLogRepository.findRecentFailures().stream()
                .map(StatsService::toFailedCall)
                .collect(Collectors.toList());

        return AdminStats.builder()
                .reviewsByStatus(byStatus)
                .cacheHits(cacheStats.getHits())
                .cacheMisses(cacheStats.getMisses())
                .cacheEntries(cacheStats.getEntries())
                .aiCalls(callLogRepository.countRemoteCalls())
                .aiCallFailures(callLogRepository.countFailedCalls())
                .availableKeys(keyPool.availableCount())
                .failedKeys(keyPool.failedCount())
                .recentFailures(recentFailures)
                .build();
    }

    private static AdminStats.FailedCall toFailedCall(AiCallLogEntity log) {
        return AdminStats.FailedCall.builder()
                .purpose(log.getPurpose())
                .provider(log.getProvider())
                .subject(log.getSubject())
                .errorMessage(log.getErrorMessage())
                .createdAt(log.getCreatedAt())
                .build();
    }
}
