package com.retrygate.model;

import com.retrygate.model.enums.AdmissionReason;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * 单次准入判定结果, 每次请求新建, 不落库
 */
@Getter
@EqualsAndHashCode
@ToString
public final class AdmissionDecision {

    private final boolean admitted;

    private final AdmissionReason reason;

    /** 生效上限, 0 = 不限 */
    private final int effectiveLimit;

    /** 判定所依据的已用次数 */
    private final int attemptCount;

    private final boolean privileged;

    /** 可读原因, 供调用方展示 */
    private final String message;

    private AdmissionDecision(boolean admitted, AdmissionReason reason, int effectiveLimit,
                              int attemptCount, boolean privileged, String message) {
        this.admitted = admitted;
        this.reason = reason;
        this.effectiveLimit = effectiveLimit;
        this.attemptCount = attemptCount;
        this.privileged = privileged;
        this.message = message;
    }

    public static AdmissionDecision allowed(AdmissionReason reason, int effectiveLimit, int attemptCount,
                                            boolean privileged, String message) {
        return new AdmissionDecision(true, reason, effectiveLimit, attemptCount, privileged, message);
    }

    public static AdmissionDecision denied(int effectiveLimit, int attemptCount, String message) {
        return new AdmissionDecision(false, AdmissionReason.LIMIT_REACHED, effectiveLimit, attemptCount, false, message);
    }
}
