package com.compass.common.exception;

/**
 * 系统基础异常，所有业务异常的父类。
 */
public class CompassException extends RuntimeException {

    private final String errorCode;

    public CompassException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public CompassException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public String getErrorCode() {
        return errorCode;
    }
}
