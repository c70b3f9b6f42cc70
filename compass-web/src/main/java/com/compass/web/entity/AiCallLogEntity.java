package com.compass.web.entity;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

/**
 * AI 调用日志：监控分类/综述调用的健康度与缓存效果。
 */
@Table("t_ai_call_log")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AiCallLogEntity {

    @Id
    private Long id;

    /** classify / summary */
    private String purpose;
    private String provider;
    private String subject;
    private Long latencyMs;

    @Builder.Default
    private Boolean success = true;

    @Builder.Default
    private Boolean cacheHit = false;

    private String errorMessage;

    private String createdAt;
}
