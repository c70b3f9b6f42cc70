package com.compass.common.exception;

/**
 * AI 正常返回但内容不符合约定（非 JSON、缺字段、评分越界）。
 * <p>
 * 与网络/鉴权失败不同，这类错误不是 Key 的问题，调度层重试时不会把 Key 标记为失败。
 */
public class AiResponseFormatException extends AiServiceException {

    public AiResponseFormatException(String message) {
        super(message);
    }

    public AiResponseFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
