package com.retrygate.core.store;

import com.retrygate.core.spi.RetryCounterStore;
import com.retrygate.mapper.RetryAttemptMapper;

import java.util.OptionalInt;

/**
 * 基于 media_file.retry_attempts 列的计数存储
 */
public class MybatisRetryCounterStore implements RetryCounterStore {

    private final RetryAttemptMapper mapper;

    public MybatisRetryCounterStore(RetryAttemptMapper mapper) {
        this.mapper = mapper;
    }

    @Override
    public OptionalInt find(String entityId) {
        Integer n = StorageCalls.call("counter.find", () -> mapper.selectAttempts(entityId));
        return n == null ? OptionalInt.empty() : OptionalInt.of(n);
    }

    @Override
    public OptionalInt findLatest(String entityId) {
        Integer n = StorageCalls.call("counter.findLatest", () -> mapper.selectAttemptsForUpdate(entityId));
        return n == null ? OptionalInt.empty() : OptionalInt.of(n);
    }

    @Override
    public boolean compareAndSet(String entityId, int expected, int next) {
        return StorageCalls.call("counter.compareAndSet",
                () -> mapper.compareAndSetAttempts(entityId, expected, next)) > 0;
    }

    @Override
    public boolean reset(String entityId) {
        if (StorageCalls.call("counter.reset", () -> mapper.resetAttempts(entityId)) > 0) {
            return true;
        }
        // 0 行可能是"已为0且未改动"（useAffectedRows=true）, 以实体是否存在为准
        return StorageCalls.call("counter.reset", () -> mapper.selectAttempts(entityId)) != null;
    }
}
