package com.retrygate.model.enums;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * 准入判定原因
 */
@AllArgsConstructor
@Getter
public enum AdmissionReason {
    /** 未达上限, 或特权调用 */
    ALLOWED("Allowed"),
    /** 已达最大重试次数 */
    LIMIT_REACHED("LimitReached"),
    /** 上限关闭或 maxAttempts=0 */
    LIMITS_DISABLED("LimitsDisabled")
    ;

    /** 对外展示与通知事件中使用的原因码 */
    private final String code;
}
