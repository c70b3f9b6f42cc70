package com.compass.common.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * 一组方面均值（保留两位小数），无贡献的维度为 null 而非 0。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class AspectMeans {

    private BigDecimal avgAcademics;
    private BigDecimal avgCost;
    private BigDecimal avgSocial;
    private BigDecimal avgAccommodation;
    private BigDecimal overallScore;

    /** 参与计算的已评分评论数 */
    private int scoredCount;
}
