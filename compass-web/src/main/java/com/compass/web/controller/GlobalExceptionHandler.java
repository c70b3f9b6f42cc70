package com.compass.web.controller;

import com.compass.common.dto.ErrorResponse;
import com.compass.common.exception.AiServiceException;
import com.compass.common.exception.CompassException;
import com.compass.common.exception.EmptyContentException;
import com.compass.common.exception.InvalidTransitionException;
import com.compass.common.exception.NotFoundException;
import com.compass.common.exception.UnauthorizedException;
import com.compass.common.exception.ValidationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.servlet.resource.NoResourceFoundException;

/**
 * 全局异常处理器，业务异常按错误码映射 HTTP 状态。
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(ValidationException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public ErrorResponse handleValidation(ValidationException e) {
        log.info("提交校验失败: {}", e.getFieldErrors());
        return new ErrorResponse(e.getErrorCode(), e.getMessage(), e.getFieldErrors());
    }

    @ExceptionHandler(CompassException.class)
    public ResponseEntity<ErrorResponse> handleCompassException(CompassException e) {
        HttpStatus status = statusOf(e);
        if (status == HttpStatus.INTERNAL_SERVER_ERROR) {
            log.error("未映射的业务异常: [{}] {}", e.getErrorCode(), e.getMessage(), e);
            return ResponseEntity.status(status).body(ErrorResponse.of("SYSTEM_ERROR", "系统内部错误，请稍后重试"));
        }
        if (status.is5xxServerError()) {
            log.error("业务异常: [{}] {}", e.getErrorCode(), e.getMessage());
        } else {
            log.warn("业务异常: [{}] {}", e.getErrorCode(), e.getMessage());
        }
        return ResponseEntity.status(status).body(ErrorResponse.of(e.getErrorCode(), e.getMessage()));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public ErrorResponse handleUnreadableBody(HttpMessageNotReadableException e) {
        log.warn("请求体无法解析: {}", e.getMessage());
        return ErrorResponse.of("VALIDATION_ERROR", "请求体格式错误");
    }

    @ExceptionHandler(NoResourceFoundException.class)
    @ResponseStatus(HttpStatus.NOT_FOUND)
    public ErrorResponse handleNoResourceFound(NoResourceFoundException e) {
        // favicon.ico 等找不到不打 ERROR 日志
        log.debug("资源未找到: {}", e.getResourcePath());
        return ErrorResponse.of("NOT_FOUND", "资源不存在");
    }

    @ExceptionHandler(Exception.class)
    @ResponseStatus(HttpStatus.INTERNAL_SERVER_ERROR)
    public ErrorResponse handleGenericException(Exception e) {
        log.error("系统异常", e);
        return ErrorResponse.of("SYSTEM_ERROR", "系统内部错误，请稍后重试");
    }

    static HttpStatus statusOf(CompassException e) {
        if (e instanceof EmptyContentException) {
            return HttpStatus.BAD_REQUEST;
        }
        if (e instanceof UnauthorizedException) {
            return HttpStatus.UNAUTHORIZED;
        }
        if (e instanceof NotFoundException) {
            return HttpStatus.NOT_FOUND;
        }
        if (e instanceof InvalidTransitionException) {
            return HttpStatus.CONFLICT;
        }
        if (e instanceof AiServiceException) {
            return HttpStatus.BAD_GATEWAY;
        }
        return HttpStatus.INTERNAL_SERVER_ERROR;
    }
}
