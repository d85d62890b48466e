package com.retrygate.core.decision;

import com.retrygate.model.AdmissionDecision;
import com.retrygate.model.RetryPolicySnapshot;
import com.retrygate.model.enums.AdmissionReason;

/**
 * 准入判定, 纯函数：不读写计数与策略存储
 * 判定与扣减分两步, 调用方在真正派发后再调用 increment
 */
public class AdmissionDecider {

    public AdmissionDecision decide(RetryPolicySnapshot policy, int currentCount, boolean privileged) {
        if (policy == null) {
            throw new IllegalArgumentException("policy must not be null");
        }
        if (currentCount < 0) {
            throw new IllegalArgumentException("currentCount must be >= 0, got " + currentCount);
        }
        int limit = policy.limitsActive() ? policy.getMaxAttempts() : 0;

        // 特权调用绕过上限
        if (privileged) {
            return AdmissionDecision.allowed(AdmissionReason.ALLOWED, limit, currentCount, true,
                    "Privileged caller bypasses the retry limit");
        }
        // 关闭上限与 maxAttempts=0 等价
        if (!policy.limitsActive()) {
            return AdmissionDecision.allowed(AdmissionReason.LIMITS_DISABLED, 0, currentCount, false,
                    "Retry limits are disabled");
        }
        if (currentCount >= policy.getMaxAttempts()) {
            return AdmissionDecision.denied(limit, currentCount,
                    "Maximum retry attempts reached (" + currentCount + "/" + limit + ")");
        }
        return AdmissionDecision.allowed(AdmissionReason.ALLOWED, limit, currentCount, false,
                "Retry allowed (" + currentCount + "/" + limit + " attempts used)");
    }
}
