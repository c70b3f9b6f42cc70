package com.compass.common.model;

/**
 * 四个评分维度。
 */
public enum Aspect {

    ACADEMICS("academics"),
    COST("cost"),
    SOCIAL("social"),
    ACCOMMODATION("accommodation");

    public static final int MIN_SCORE = 1;
    public static final int MAX_SCORE = 5;

    private final String key;

    Aspect(String key) {
        this.key = key;
    }

    /** AI 返回 JSON 中对应的字段名 */
    public String key() {
        return key;
    }

    public static boolean inRange(int score) {
        return score >= MIN_SCORE && score <= MAX_SCORE;
    }
}
