package com.retrygate.core.notify;

import com.retrygate.exception.InvalidPolicyValueException;
import com.retrygate.exception.StorageUnavailableException;
import com.retrygate.model.AdmissionDecision;
import com.retrygate.model.RetryPolicySnapshot;
import com.retrygate.model.ctx.NotifyContext;
import com.retrygate.model.enums.NotifyEventType;

import java.time.Clock;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

public final class NotifyContexts {

    private static final int MAX_DETAIL_LEN = 4000;

    private NotifyContexts() {}

    /* ========== 对外入口（使用系统UTC时钟） ========== */

    public static NotifyContext ctxForLimitReached(String nodeId, String entityId, AdmissionDecision d) {
        return ctxForLimitReached(nodeId, entityId, d, Clock.systemUTC());
    }

    public static NotifyContext ctxForCounterReset(String nodeId, String entityId, RetryPolicySnapshot policy) {
        return ctxForCounterReset(nodeId, entityId, policy, Clock.systemUTC());
    }

    public static NotifyContext ctxForPolicyUpdated(String nodeId, RetryPolicySnapshot after) {
        return ctxForPolicyUpdated(nodeId, after, Clock.systemUTC());
    }

    public static NotifyContext ctxForPolicyRejected(String nodeId, InvalidPolicyValueException e) {
        return ctxForPolicyRejected(nodeId, e, Clock.systemUTC());
    }

    public static NotifyContext ctxForStorageUnavailable(String nodeId, String entityId, StorageUnavailableException e) {
        return ctxForStorageUnavailable(nodeId, entityId, e, Clock.systemUTC());
    }

    /* ========== 带 Clock 的重载（方便测试） ========== */

    public static NotifyContext ctxForLimitReached(String nodeId, String entityId, AdmissionDecision d, Clock clock) {
        Map<String, Object> attrs = new HashMap<>();
        attrs.put("reason", d.getReason().getCode());
        return new NotifyContext(
                NotifyEventType.LIMIT_REACHED,
                nodeId,
                entityId,
                d.getAttemptCount(),
                d.getEffectiveLimit(),
                "LIMIT_REACHED",
                d.getMessage(),
                now(clock),
                attrs
        );
    }

    public static NotifyContext ctxForCounterReset(String nodeId, String entityId, RetryPolicySnapshot policy, Clock clock) {
        Map<String, Object> attrs = policyAttrs(policy);
        return new NotifyContext(
                NotifyEventType.COUNTER_RESET,
                nodeId,
                entityId,
                0,
                policy.getMaxAttempts(),
                "RESET",
                null,
                now(clock),
                attrs
        );
    }

    public static NotifyContext ctxForPolicyUpdated(String nodeId, RetryPolicySnapshot after, Clock clock) {
        Map<String, Object> attrs = policyAttrs(after);
        return new NotifyContext(
                NotifyEventType.POLICY_UPDATED,
                nodeId,
                null,
                null,
                after.getMaxAttempts(),
                "POLICY_UPDATED",
                null,
                now(clock),
                attrs
        );
    }

    public static NotifyContext ctxForPolicyRejected(String nodeId, InvalidPolicyValueException e, Clock clock) {
        Map<String, Object> attrs = new HashMap<>();
        attrs.put("field", e.getField());
        attrs.put("rejectedValue", String.valueOf(e.getRejectedValue()));
        return new NotifyContext(
                NotifyEventType.POLICY_REJECTED,
                nodeId,
                null,
                null,
                null,
                "INVALID_POLICY_VALUE",
                truncate(e.getMessage()),
                now(clock),
                attrs
        );
    }

    public static NotifyContext ctxForStorageUnavailable(String nodeId, String entityId,
                                                         StorageUnavailableException e, Clock clock) {
        Map<String, Object> attrs = new HashMap<>();
        attrs.put("op", e.getOperation());
        return new NotifyContext(
                NotifyEventType.STORAGE_UNAVAILABLE,
                nodeId,
                entityId,
                null,
                null,
                "STORAGE_UNAVAILABLE",
                truncate(toError(e)),
                now(clock),
                attrs
        );
    }

    /* ========== 私有工具 ========== */

    private static Map<String, Object> policyAttrs(RetryPolicySnapshot p) {
        Map<String, Object> m = new HashMap<>();
        m.put("enabled", p.isEnabled());
        m.put("maxAttempts", p.getMaxAttempts());
        return m;
    }

    private static Instant now(Clock clock) {
        return Instant.now(clock);
    }

    private static String toError(Throwable e) {
        StringBuilder sb = new StringBuilder(e.getClass().getName()).append(": ").append(e.getMessage());
        // 附带根因, 便于定位连接/超时问题
        Throwable cause = e.getCause();
        while (cause != null && cause != cause.getCause()) {
            sb.append("\n  caused by ").append(cause.getClass().getName()).append(": ").append(cause.getMessage());
            cause = cause.getCause();
        }
        return sb.toString();
    }

    private static String truncate(String s) {
        if (s == null) return null;
        return s.length() > MAX_DETAIL_LEN ? s.substring(0, MAX_DETAIL_LEN) : s;
    }
}
