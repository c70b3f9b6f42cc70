package com.compass.common.dto;

import com.compass.common.model.SourceType;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 批量导入的一行原始评论（问卷行、爬虫片段），由上游生产者提供。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class RawReviewRow {

    private String uniName;
    private String city;

    /** 专业方向（可选） */
    private String major;

    /** 上游声明的来源，缺省视为问卷 */
    private SourceType sourceType;

    private String rawReviewText;
}
