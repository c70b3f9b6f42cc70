package com.compass.common.exception;

import java.util.List;

/**
 * 提交字段缺失或越界，入库前拒绝。
 */
public class ValidationException extends CompassException {

    private final List<String> fieldErrors;

    public ValidationException(List<String> fieldErrors) {
        super("VALIDATION_ERROR", "提交内容校验失败: " + String.join("; ", fieldErrors));
        this.fieldErrors = List.copyOf(fieldErrors);
    }

    public List<String> getFieldErrors() {
        return fieldErrors;
    }
}
