package com.compass.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 评论来源类型，由上游生产者（问卷导入、爬虫、用户提交）声明。
 */
public enum SourceType {

    SURVEY("survey", TrustTier.HIGH),
    WEB_SCRAPE("web_scrape", TrustTier.LOW),
    USER_SUBMITTED("user_submitted", TrustTier.HIGH);

    private final String wireName;
    private final TrustTier trustTier;

    SourceType(String wireName, TrustTier trustTier) {
        this.wireName = wireName;
        this.trustTier = trustTier;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    /** 问卷与审核通过的用户评论为高可信，爬虫数据量大但可信度低 */
    public TrustTier trustTier() {
        return trustTier;
    }

    @JsonCreator
    public static SourceType fromWire(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        for (SourceType type : values()) {
            if (type.wireName.equalsIgnoreCase(value.trim()) || type.name().equalsIgnoreCase(value.trim())) {
                return type;
            }
        }
        throw new IllegalArgumentException("未知的来源类型: " + value);
    }
}
