package com.compass.common.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * 院校列表中的一行。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class UniversitySummary {

    private String uniName;
    private String city;
    private BigDecimal overallScore;
    private BigDecimal avgAcademics;
    private BigDecimal avgCost;
    private BigDecimal avgSocial;
    private BigDecimal avgAccommodation;
    private int reviewCount;
}
