package com.retrygate.core.store;

import com.retrygate.exception.StorageUnavailableException;
import org.springframework.dao.DataAccessException;
import org.springframework.transaction.TransactionException;

import java.util.function.Supplier;

/**
 * 把 Spring 的数据访问异常统一转换为 StorageUnavailableException, 保留原因（含超时）
 */
final class StorageCalls {

    private StorageCalls() {}

    static <T> T call(String operation, Supplier<T> action) {
        try {
            return action.get();
        } catch (DataAccessException | TransactionException e) {
            throw new StorageUnavailableException(operation, e);
        }
    }

    static void run(String operation, Runnable action) {
        call(operation, () -> {
            action.run();
            return null;
        });
    }

    static String requireKey(String key) {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("setting key must not be blank");
        }
        return key;
    }
}
