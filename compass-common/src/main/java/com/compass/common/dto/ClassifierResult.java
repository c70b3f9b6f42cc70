package com.compass.common.dto;

import com.compass.common.model.Sentiment;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * AI 分类服务经过校验后的结构化输出，同时也是分类缓存中保存的值。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ClassifierResult {

    /** 四项评分，缓存中的结果一定齐全且在 [1,5] 内 */
    private AspectScores scores;

    /** 1-2 句英文主题摘要 */
    private String summary;

    private Sentiment sentiment;
}
