package com.retrygate.exception;

/**
 * 重试闸门异常基类
 */
public class RetryGateException extends RuntimeException {

    public RetryGateException(String message) {
        super(message);
    }

    public RetryGateException(String message, Throwable cause) {
        super(message, cause);
    }
}
