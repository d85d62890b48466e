package com.retrygate.core.policy;

import com.retrygate.config.RetryGateProperties;
import com.retrygate.core.spi.PolicyStore;
import com.retrygate.exception.InvalidPolicyValueException;
import com.retrygate.model.PolicyUpdate;
import com.retrygate.model.RetryPolicySnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 全局重试策略
 * 只暴露快照读取与部分更新, 调用方不直接接触存储 key
 */
public class RetryPolicy {

    private static final Logger log = LoggerFactory.getLogger(RetryPolicy.class);

    /** maxAttempts 合法区间上界 */
    public static final int MAX_ATTEMPTS_UPPER_BOUND = 99;

    static final String ENABLED_DESCRIPTION = "Whether retry limits are enforced (default: true)";

    static final String MAX_ATTEMPTS_DESCRIPTION = "Maximum retry attempts (default: 3, 0 = unlimited)";

    private final PolicyStore store;

    private final RetryGateProperties.Policy cfg;

    private final Clock clock;

    /** 已发布的快照, 整体替换, 读者不会看到半更新状态 */
    private final AtomicReference<Cached> cache = new AtomicReference<>();

    /** 单一策略记录锁, 不与计数操作嵌套 */
    private final ReentrantLock updateLock = new ReentrantLock();

    public RetryPolicy(PolicyStore store, RetryGateProperties.Policy cfg) {
        this(store, cfg, Clock.systemUTC());
    }

    public RetryPolicy(PolicyStore store, RetryGateProperties.Policy cfg, Clock clock) {
        this.store = store;
        this.cfg = cfg;
        this.clock = clock;
    }

    /**
     * 当前策略快照; 缓存超过 cache-ttl 后重新读取存储
     * 存储不可用时抛出 StorageUnavailableException, 不回落默认值
     */
    public RetryPolicySnapshot current() {
        Cached before = cache.get();
        Instant now = clock.instant();
        if (before != null && before.isFresh(now, cfg.getCacheTtl())) {
            return before.snapshot;
        }
        RetryPolicySnapshot loaded = load();
        // 期间若已有更新发布, 保留更新后的快照
        cache.compareAndSet(before, new Cached(loaded, now));
        return loaded;
    }

    public boolean isEnabled() {
        return current().isEnabled();
    }

    public int maxAttempts() {
        return current().getMaxAttempts();
    }

    /**
     * 部分更新; 只写入提供的字段, 两个字段同时提供时作为一个原子单元写入
     * @return 更新后的完整快照
     */
    public RetryPolicySnapshot updatePolicy(PolicyUpdate update) {
        validate(update);
        if (update.isEmpty()) {
            return current();
        }
        updateLock.lock();
        try {
            RetryPolicySnapshot before = load();

            Map<String, String> values = new LinkedHashMap<>();
            Map<String, String> descriptions = new LinkedHashMap<>();
            if (update.getEnabled() != null) {
                values.put(cfg.getEnabledKey(), String.valueOf(update.getEnabled()));
                descriptions.put(cfg.getEnabledKey(), ENABLED_DESCRIPTION);
            }
            if (update.getMaxAttempts() != null) {
                values.put(cfg.getMaxAttemptsKey(), String.valueOf(update.getMaxAttempts()));
                descriptions.put(cfg.getMaxAttemptsKey(), MAX_ATTEMPTS_DESCRIPTION);
            }
            store.setAll(values, descriptions);

            RetryPolicySnapshot after = before.merge(update);
            cache.set(new Cached(after, clock.instant()));
            log.info("[Retry-Policy] policy updated, before={}, after={}", before, after);
            return after;
        } finally {
            updateLock.unlock();
        }
    }

    /** 丢弃缓存, 下次读取直接读存储 */
    public void invalidate() {
        cache.set(null);
    }

    private RetryPolicySnapshot load() {
        String enabledKey = cfg.getEnabledKey(), maxKey = cfg.getMaxAttemptsKey();
        // 一次读取两个 key
        Map<String, String> raw = store.getAll(List.of(enabledKey, maxKey));

        boolean enabled = SettingValues.parseBoolean(enabledKey, raw.get(enabledKey), cfg.isDefaultEnabled());
        int max = SettingValues.parseInt(maxKey, raw.get(maxKey), cfg.getDefaultMaxAttempts());
        if (max < 0 || max > MAX_ATTEMPTS_UPPER_BOUND) {
            log.warn("[Retry-Policy] stored {}={} out of range, fallback to {}", maxKey, max, cfg.getDefaultMaxAttempts());
            max = cfg.getDefaultMaxAttempts();
        }
        return RetryPolicySnapshot.of(enabled, max);
    }

    private static void validate(PolicyUpdate update) {
        if (update == null) {
            throw new InvalidPolicyValueException("update", null, "must not be null");
        }
        Integer max = update.getMaxAttempts();
        if (max != null && (max < 0 || max > MAX_ATTEMPTS_UPPER_BOUND)) {
            throw new InvalidPolicyValueException("maxAttempts", max,
                    "must be within [0, " + MAX_ATTEMPTS_UPPER_BOUND + "]");
        }
    }

    private static final class Cached {
        private final RetryPolicySnapshot snapshot;
        private final Instant loadedAt;

        private Cached(RetryPolicySnapshot snapshot, Instant loadedAt) {
            this.snapshot = snapshot;
            this.loadedAt = loadedAt;
        }

        private boolean isFresh(Instant now, Duration ttl) {
            return !ttl.isZero() && now.isBefore(loadedAt.plus(ttl));
        }
    }
}
