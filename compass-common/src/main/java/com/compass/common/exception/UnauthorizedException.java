package com.compass.common.exception;

/**
 * 管理凭证缺失或不匹配。
 */
public class UnauthorizedException extends CompassException {

    public UnauthorizedException(String message) {
        super("UNAUTHORIZED", message);
    }
}
