package com.compass.common.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 启发式识别出的评论语言标签。
 */
public enum Language {

    EN("en"),
    AR("ar"),
    UNKNOWN("unknown");

    private final String tag;

    Language(String tag) {
        this.tag = tag;
    }

    @JsonValue
    public String tag() {
        return tag;
    }
}
