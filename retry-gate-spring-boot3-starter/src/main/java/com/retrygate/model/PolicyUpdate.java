package com.retrygate.model;

import com.retrygate.exception.InvalidPolicyValueException;
import lombok.Builder;
import lombok.Data;

import java.util.Locale;

/**
 * 策略部分更新, null 字段表示不修改
 */
@Data
@Builder
public class PolicyUpdate {

    private Boolean enabled;

    private Integer maxAttempts;

    public boolean isEmpty() {
        return enabled == null && maxAttempts == null;
    }

    /**
     * 解析管理端原始输入, 空白视为未提供
     */
    public static PolicyUpdate fromRaw(String enabled, String maxAttempts) {
        PolicyUpdateBuilder b = PolicyUpdate.builder();
        if (enabled != null && !enabled.isBlank()) {
            String v = enabled.trim().toLowerCase(Locale.ROOT);
            if (!v.equals("true") && !v.equals("false")) {
                throw new InvalidPolicyValueException("enabled", enabled, "expected true or false");
            }
            b.enabled(Boolean.parseBoolean(v));
        }
        if (maxAttempts != null && !maxAttempts.isBlank()) {
            try {
                b.maxAttempts(Integer.parseInt(maxAttempts.trim()));
            } catch (NumberFormatException e) {
                throw new InvalidPolicyValueException("maxAttempts", maxAttempts, "not an integer");
            }
        }
        return b.build();
    }
}
