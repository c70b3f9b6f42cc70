package com.compass.web.entity;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

/**
 * 分类缓存表：指纹唯一，只插入不更新。
 */
@Table("t_classification_cache")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ClassificationCacheEntity {

    @Id
    private Long id;

    private String fingerprint;
    private String language;

    /** 校验通过的 ClassifierResult（JSON） */
    private String resultJson;

    private String createdAt;
}
