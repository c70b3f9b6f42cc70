package com.compass.common.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

/**
 * 单个院校的聚合视图，完全可由已审核通过的评论重建。
 * <p>
 * 顶层 avg_* / overall_score 为按量加权（每条评论权重相同），
 * trust_weighted 为按可信度加权，by_trust 按可信度分层给出各自的均值，
 * 使用方可以按可信度筛选而不必只看一个混合值。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class UniversityAggregate {

    private String uniName;
    private String city;

    /** 审核通过的评论总数（含未评分） */
    private int reviewCount;

    private BigDecimal avgAcademics;
    private BigDecimal avgCost;
    private BigDecimal avgSocial;
    private BigDecimal avgAccommodation;
    private BigDecimal overallScore;

    private AspectMeans trustWeighted;

    /** key: high / low */
    private Map<String, AspectMeans> byTrust;

    /** 有评分、参与均值计算的评论 ID（升序） */
    private List<Long> contributingIds;

    private String themeSummary;
}
