package com.compass.ai.agent;

/**
 * AI 调用记录落点，由上层模块实现（如写入调用日志表）。
 */
public interface AiCallRecorder {

    void record(AiCallEvent event);
}
