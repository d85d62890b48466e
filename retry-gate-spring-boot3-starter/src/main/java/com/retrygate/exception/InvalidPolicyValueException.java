package com.retrygate.exception;

import lombok.Getter;

/**
 * 策略更新参数非法（越界或格式错误），不做任何部分写入
 */
@Getter
public class InvalidPolicyValueException extends RetryGateException {

    /** 出错字段 */
    private final String field;

    /** 原始输入 */
    private final Object rejectedValue;

    public InvalidPolicyValueException(String field, Object rejectedValue, String reason) {
        super("invalid retry policy value " + field + "=" + rejectedValue + ": " + reason);
        this.field = field;
        this.rejectedValue = rejectedValue;
    }
}
