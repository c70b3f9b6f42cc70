package com.compass.common.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 可信度分层。
 */
public enum TrustTier {

    HIGH("high"),
    LOW("low");

    private final String wireName;

    TrustTier(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }
}
