package com.retrygate.config;

import com.retrygate.core.policy.RetryPolicy;
import org.springframework.beans.factory.InitializingBean;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.transaction.annotation.Isolation;
import org.springframework.transaction.annotation.Propagation;

import java.time.Duration;

/**
 * 重试闸门配置（绑定前缀：retry.gate）
 *
 * YAML 示例：
 * retry:
 *   gate:
 *     policy:
 *       enabled-key: transcription.retry_limit_enabled
 *       max-attempts-key: transcription.max_retries
 *       default-enabled: true
 *       default-max-attempts: 3
 *       cache-ttl: 5s
 *     tx:
 *       propagation: REQUIRED
 *       isolation: DEFAULT
 *       timeout-seconds: 0
 */
@ConfigurationProperties(prefix = "retry.gate")
public class RetryGateProperties implements InitializingBean {

    private Policy policy = new Policy();

    private Tx tx = new Tx();

    // ----------------- 嵌套配置对象 -----------------

    public static class Policy {
        /** 是否启用上限的配置 key */
        private String enabledKey = "transcription.retry_limit_enabled";

        /** 最大重试次数的配置 key */
        private String maxAttemptsKey = "transcription.max_retries";

        /** key 缺失或无法解析时的默认值 */
        private boolean defaultEnabled = true;

        /** key 缺失或无法解析时的默认值, 0 = 不限 */
        private int defaultMaxAttempts = 3;

        /** 策略快照缓存时长（最大陈旧度）, 0 表示每次读库 */
        private Duration cacheTtl = Duration.ofSeconds(5);

        public String getEnabledKey() { return enabledKey; }
        public void setEnabledKey(String enabledKey) { this.enabledKey = enabledKey; }
        public String getMaxAttemptsKey() { return maxAttemptsKey; }
        public void setMaxAttemptsKey(String maxAttemptsKey) { this.maxAttemptsKey = maxAttemptsKey; }
        public boolean isDefaultEnabled() { return defaultEnabled; }
        public void setDefaultEnabled(boolean defaultEnabled) { this.defaultEnabled = defaultEnabled; }
        public int getDefaultMaxAttempts() { return defaultMaxAttempts; }
        public void setDefaultMaxAttempts(int defaultMaxAttempts) { this.defaultMaxAttempts = defaultMaxAttempts; }
        public Duration getCacheTtl() { return cacheTtl; }
        public void setCacheTtl(Duration cacheTtl) { this.cacheTtl = cacheTtl; }
    }

    public static class Tx {
        /** 默认传播行为 */
        private Propagation propagation = Propagation.REQUIRED;

        /** 事务隔离级别（默认 DEFAULT） */
        private Isolation isolation = Isolation.DEFAULT;

        /** 超时（秒，<=0 表示不设置） */
        private int timeoutSeconds = 0;

        public Propagation getPropagation() { return propagation; }
        public void setPropagation(Propagation propagation) { this.propagation = propagation; }
        public Isolation getIsolation() { return isolation; }
        public void setIsolation(Isolation isolation) { this.isolation = isolation; }
        public int getTimeoutSeconds() { return timeoutSeconds; }
        public void setTimeoutSeconds(int timeoutSeconds) { this.timeoutSeconds = timeoutSeconds; }
    }

    // ----------------- getters/setters 顶层 -----------------

    public Policy getPolicy() { return policy; }
    public void setPolicy(Policy policy) { this.policy = policy; }

    public Tx getTx() { return tx; }
    public void setTx(Tx tx) { this.tx = tx; }

    @Override
    public void afterPropertiesSet() {
        // 参数校验
        int max = policy.getDefaultMaxAttempts();
        if (max < 0 || max > RetryPolicy.MAX_ATTEMPTS_UPPER_BOUND) {
            throw new IllegalArgumentException("retry.gate.policy.default-max-attempts must be within [0, "
                    + RetryPolicy.MAX_ATTEMPTS_UPPER_BOUND + "], got " + max);
        }
        if (policy.getEnabledKey() == null || policy.getEnabledKey().isBlank()
                || policy.getMaxAttemptsKey() == null || policy.getMaxAttemptsKey().isBlank()) {
            throw new IllegalArgumentException("retry.gate.policy keys must not be blank");
        }
        if (policy.getEnabledKey().equals(policy.getMaxAttemptsKey())) {
            throw new IllegalArgumentException("retry.gate.policy.enabled-key and max-attempts-key must differ");
        }
        if (policy.getCacheTtl() == null || policy.getCacheTtl().isNegative()) {
            throw new IllegalArgumentException("retry.gate.policy.cache-ttl must be >= 0");
        }
    }
}
