package com.compass.text.model;

import com.compass.common.model.Language;
import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * 清洗结果：匿名化后的正文 + 语言标签。
 */
@Data
@AllArgsConstructor
public class NormalizedText {

    private String cleanText;
    private Language language;
}
