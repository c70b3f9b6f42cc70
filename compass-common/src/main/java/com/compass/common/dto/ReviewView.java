package com.compass.common.dto;

import com.compass.common.model.Language;
import com.compass.common.model.ReviewerType;
import com.compass.common.model.ReviewStatus;
import com.compass.common.model.Sentiment;
import com.compass.common.model.SourceType;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 对外展示的单条评论（正文已匿名化，不含任何身份字段）。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class ReviewView {

    private Long id;
    private String uniName;
    private String city;
    private SourceType sourceType;
    private ReviewerType reviewerType;
    private ReviewStatus status;
    private Language rawLanguage;
    private String rawReviewText;
    private Integer academicsScore;
    private Integer costScore;
    private Integer socialScore;
    private Integer accommodationScore;
    private Sentiment overallSentiment;
    private String themeSummary;
    private String createdAt;
}
