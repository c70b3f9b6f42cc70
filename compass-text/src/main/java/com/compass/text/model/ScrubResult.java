package com.compass.text.model;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * 个人信息擦除结果。
 */
@Data
@AllArgsConstructor
public class ScrubResult {

    private String text;

    /** 替换掉的片段数 */
    private int replacements;

    /** 擦除后复检仍有残留（或存在无法闭合的姓名标记），该字段不能保证匿名 */
    private boolean residual;
}
