package com.compass.common.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 评分来源：AI 批量处理 / 用户自评。与 {@link SourceType} 相互独立。
 */
public enum ReviewerType {

    AI_PROCESSED("ai_processed"),
    USER_SUBMITTED("user_submitted");

    private final String wireName;

    ReviewerType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    /** 初始审核状态：用户提交待审，AI 批量导入直接通过 */
    public ReviewStatus initialStatus() {
        return this == USER_SUBMITTED ? ReviewStatus.PENDING : ReviewStatus.APPROVED;
    }
}
