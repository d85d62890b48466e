package com.retrygate.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * 全局重试策略快照, 不可变
 * maxAttempts = 0 表示不限次数, 准入语义上等同 enabled = false
 */
@Getter
@EqualsAndHashCode
@ToString
public final class RetryPolicySnapshot {

    private final boolean enabled;

    private final int maxAttempts;

    private RetryPolicySnapshot(boolean enabled, int maxAttempts) {
        if (maxAttempts < 0) {
            throw new IllegalArgumentException("maxAttempts must be >= 0, got " + maxAttempts);
        }
        this.enabled = enabled;
        this.maxAttempts = maxAttempts;
    }

    public static RetryPolicySnapshot of(boolean enabled, int maxAttempts) {
        return new RetryPolicySnapshot(enabled, maxAttempts);
    }

    /** 上限是否实际生效 */
    public boolean limitsActive() {
        return enabled && maxAttempts > 0;
    }

    /** 应用部分更新, 未提供的字段保持原值 */
    public RetryPolicySnapshot merge(PolicyUpdate update) {
        return new RetryPolicySnapshot(
                update.getEnabled() == null ? enabled : update.getEnabled(),
                update.getMaxAttempts() == null ? maxAttempts : update.getMaxAttempts());
    }
}
