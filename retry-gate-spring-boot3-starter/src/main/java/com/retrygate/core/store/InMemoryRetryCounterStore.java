package com.retrygate.core.store;

import com.retrygate.core.spi.RetryCounterStore;

import java.util.OptionalInt;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 内存计数存储, 实体由宿主通过 {@link #track} 登记
 */
public class InMemoryRetryCounterStore implements RetryCounterStore {

    private final ConcurrentHashMap<String, Integer> counts = new ConcurrentHashMap<>();

    /** 登记新实体, 计数从0开始; 已存在则不变 */
    public void track(String entityId) {
        counts.putIfAbsent(entityId, 0);
    }

    /** 登记实体并指定当前计数（迁移/测试用） */
    public void track(String entityId, int attemptCount) {
        if (attemptCount < 0) {
            throw new IllegalArgumentException("attemptCount must be >= 0");
        }
        counts.put(entityId, attemptCount);
    }

    @Override
    public OptionalInt find(String entityId) {
        Integer n = counts.get(entityId);
        return n == null ? OptionalInt.empty() : OptionalInt.of(n);
    }

    @Override
    public boolean compareAndSet(String entityId, int expected, int next) {
        return counts.replace(entityId, expected, next);
    }

    @Override
    public boolean reset(String entityId) {
        return counts.computeIfPresent(entityId, (k, v) -> 0) != null;
    }
}
