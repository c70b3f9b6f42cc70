package com.compass.web.entity;

import com.compass.common.model.Language;
import com.compass.common.model.ReviewStatus;
import com.compass.common.model.ReviewerType;
import com.compass.common.model.Sentiment;
import com.compass.common.model.SourceType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

/**
 * 评论表：每条原始评论清洗、评分后的记录。
 * <p>
 * 入库后只有审核状态（及审核时间）会变化；枚举字段按枚举名存储。
 */
@Table("t_review")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ReviewEntity {

    @Id
    private Long id;

    private String uniName;
    private String city;
    private String major;

    private SourceType sourceType;
    private ReviewerType reviewerType;
    private ReviewStatus status;

    /** 已脱敏的正文 */
    private String rawReviewText;
    private Language rawLanguage;

    /** SHA-256(语言, 正文)，同时是分类缓存的键 */
    private String contentFingerprint;

    private Integer academicsScore;
    private Integer costScore;
    private Integer socialScore;
    private Integer accommodationScore;

    private Sentiment overallSentiment;
    private String themeSummary;

    /** SQLite TEXT 格式（yyyy-MM-dd HH:mm:ss） */
    private String createdAt;
    private String moderatedAt;
}
