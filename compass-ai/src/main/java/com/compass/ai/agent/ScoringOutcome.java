package com.compass.ai.agent;

import com.compass.common.dto.ClassifierResult;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * 单条评论的评分结果：成功时携带分类结果，失败时只携带原因。
 * <p>
 * 失败是值而不是异常，流水线据此把评分字段置空后继续处理下一条。
 */
@Getter
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class ScoringOutcome {

    private final ClassifierResult result;
    private final String failureReason;
    private final boolean cacheHit;

    public static ScoringOutcome success(ClassifierResult result, boolean cacheHit) {
        return new ScoringOutcome(result, null, cacheHit);
    }

    public static ScoringOutcome failure(String reason) {
        return new ScoringOutcome(null, reason, false);
    }

    public boolean isSuccess() {
        return result != null;
    }
}
