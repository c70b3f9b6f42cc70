package com.compass.common.dto;

import com.compass.common.json.StrictIntegerDeserializer;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 用户提交的评论，数值评分为自评，视为权威值。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class ReviewSubmission {

    private String uniName;
    private String city;
    private String major;
    private String rawReviewText;

    /** 评分只接受整数字面量，5.9 之类的小数直接拒绝而不是截断 */
    @JsonDeserialize(using = StrictIntegerDeserializer.class)
    private Integer academicsScore;
    @JsonDeserialize(using = StrictIntegerDeserializer.class)
    private Integer costScore;
    @JsonDeserialize(using = StrictIntegerDeserializer.class)
    private Integer socialScore;
    @JsonDeserialize(using = StrictIntegerDeserializer.class)
    private Integer accommodationScore;

    public AspectScores toScores() {
        return AspectScores.builder()
                .academics(academicsScore)
                .cost(costScore)
                .social(socialScore)
                .accommodation(accommodationScore)
                .build();
    }
}
