package com.compass.common.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

/**
 * 管理端运行统计。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class AdminStats {

    /** key: pending / approved / rejected */
    private Map<String, Long> reviewsByStatus;

    private long cacheHits;
    private long cacheMisses;
    private long cacheEntries;

    private long aiCalls;
    private long aiCallFailures;

    private long availableKeys;
    private long failedKeys;

    private List<FailedCall> recentFailures;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public static class FailedCall {
        private String purpose;
        private String provider;
        private String subject;
        private String errorMessage;
        private String createdAt;
    }
}
