package com.retrygate.config;

import org.springframework.beans.factory.InitializingBean;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * 事件通知配置（绑定前缀：retry.gate.notify）, 默认关闭
 *
 * YAML 示例：
 * retry:
 *   gate:
 *     notify:
 *       enabled: true
 *       async:
 *         core-pool-size: 2
 *         max-pool-size: 4
 *         queue-capacity: 1000
 *         keep-alive: 60s
 *       rate-limit:
 *         window: 30s
 *         threshold: 50
 */
@ConfigurationProperties(prefix = "retry.gate.notify")
public class RetryNotifierProperties implements InitializingBean {

    private boolean enabled = false;

    private Async async = new Async();

    private RateLimit rateLimit = new RateLimit();

    /** 通知线程池, 与准入路径隔离 */
    public static class Async {
        private int corePoolSize = 2;
        private int maxPoolSize = 4;
        /** 有界队列, 满了直接丢弃事件 */
        private int queueCapacity = 1000;
        private Duration keepAlive = Duration.ofSeconds(60);

        public int getCorePoolSize() { return corePoolSize; }
        public void setCorePoolSize(int corePoolSize) { this.corePoolSize = corePoolSize; }
        public int getMaxPoolSize() { return maxPoolSize; }
        public void setMaxPoolSize(int maxPoolSize) { this.maxPoolSize = maxPoolSize; }
        public int getQueueCapacity() { return queueCapacity; }
        public void setQueueCapacity(int queueCapacity) { this.queueCapacity = queueCapacity; }
        public Duration getKeepAlive() { return keepAlive; }
        public void setKeepAlive(Duration keepAlive) { this.keepAlive = keepAlive; }
    }

    /** 同一 事件类型+级别 在窗口内最多派发 threshold 条 */
    public static class RateLimit {
        private Duration window = Duration.ofSeconds(30);
        private int threshold = 50;

        public Duration getWindow() { return window; }
        public void setWindow(Duration window) { this.window = window; }
        public int getThreshold() { return threshold; }
        public void setThreshold(int threshold) { this.threshold = threshold; }
    }

    public boolean isEnabled() { return enabled; }
    public void setEnabled(boolean enabled) { this.enabled = enabled; }

    public Async getAsync() { return async; }
    public void setAsync(Async async) { this.async = async; }

    public RateLimit getRateLimit() { return rateLimit; }
    public void setRateLimit(RateLimit rateLimit) { this.rateLimit = rateLimit; }

    @Override
    public void afterPropertiesSet() {
        if (async.getCorePoolSize() < 1 || async.getMaxPoolSize() < async.getCorePoolSize()) {
            throw new IllegalArgumentException("retry.gate.notify.async pool sizes invalid: core="
                    + async.getCorePoolSize() + ", max=" + async.getMaxPoolSize());
        }
        if (async.getQueueCapacity() < 1) {
            throw new IllegalArgumentException("retry.gate.notify.async.queue-capacity must be > 0");
        }
        if (rateLimit.getWindow() == null || rateLimit.getWindow().isNegative() || rateLimit.getWindow().isZero()) {
            throw new IllegalArgumentException("retry.gate.notify.rate-limit.window must be > 0");
        }
    }
}
