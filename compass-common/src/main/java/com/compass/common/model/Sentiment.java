package com.compass.common.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 整体情感倾向。
 */
public enum Sentiment {

    POSITIVE("positive"),
    NEUTRAL("neutral"),
    NEGATIVE("negative");

    private final String wireName;

    Sentiment(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    /**
     * 解析 AI 返回的情感标签，大小写不敏感，无法识别返回 null。
     */
    public static Sentiment parse(String value) {
        if (value == null) {
            return null;
        }
        String v = value.trim();
        for (Sentiment s : values()) {
            if (s.wireName.equalsIgnoreCase(v)) {
                return s;
            }
        }
        return null;
    }

    /**
     * 由四项评分均值推导：>= 3.5 正面，<= 2.5 负面，其余中性。
     */
    public static Sentiment fromMeanScore(double mean) {
        if (mean >= 3.5) {
            return POSITIVE;
        }
        if (mean <= 2.5) {
            return NEGATIVE;
        }
        return NEUTRAL;
    }
}
