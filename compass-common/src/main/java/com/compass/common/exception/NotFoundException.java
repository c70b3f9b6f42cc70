package com.compass.common.exception;

/**
 * 评论或院校不存在。
 */
public class NotFoundException extends CompassException {

    public NotFoundException(String message) {
        super("NOT_FOUND", message);
    }
}
