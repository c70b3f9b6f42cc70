package com.compass.ai.agent;

import lombok.Builder;
import lombok.Data;

/**
 * 一次 AI 调用（或缓存命中）的记录。
 */
@Data
@Builder
public class AiCallEvent {

    public static final String PURPOSE_CLASSIFY = "classify";
    public static final String PURPOSE_SUMMARY = "summary";

    private String purpose;
    private String provider;

    /** 分类调用为内容指纹前缀，综述调用为院校名 */
    private String subject;

    private long latencyMs;
    private boolean success;
    private boolean cacheHit;
    private String errorMessage;
}
