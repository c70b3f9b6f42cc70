package com.compass.common.exception;

/**
 * 清洗后没有可用正文，评论在入库前即被拒绝。
 */
public class EmptyContentException extends CompassException {

    public EmptyContentException(String message) {
        super("EMPTY_CONTENT", message);
    }
}
