package com.compass.common.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 审核状态机：PENDING → APPROVED / REJECTED，后两者为终态。
 */
public enum ReviewStatus {

    PENDING("pending"),
    APPROVED("approved"),
    REJECTED("rejected");

    private final String wireName;

    ReviewStatus(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    public boolean isTerminal() {
        return this != PENDING;
    }

    public boolean canTransitionTo(ReviewStatus target) {
        return this == PENDING && target != PENDING;
    }
}
