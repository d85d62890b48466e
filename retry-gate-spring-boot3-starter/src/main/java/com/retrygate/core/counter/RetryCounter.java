package com.retrygate.core.counter;

import com.retrygate.core.spi.RetryCounterStore;
import com.retrygate.exception.EntityNotFoundException;
import com.retrygate.exception.StorageUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.OptionalInt;

/**
 * 实体重试计数
 * increment 用有界的乐观 CAS 循环实现, 同一实体的并发 increment/reset 不丢更新, 不同实体互不阻塞
 */
public class RetryCounter {

    private static final Logger log = LoggerFactory.getLogger(RetryCounter.class);

    /** 单次 increment 允许的 CAS 冲突次数 */
    static final int MAX_CAS_CONFLICTS = 64;

    private final RetryCounterStore store;

    public RetryCounter(RetryCounterStore store) {
        this.store = store;
    }

    public int read(String entityId) {
        return current(store.find(entityId), entityId);
    }

    /**
     * 计数 +1
     * @return 新计数
     * @throws StorageUnavailableException 连续 {@value #MAX_CAS_CONFLICTS} 次 CAS 冲突仍未成功
     */
    public int increment(String entityId) {
        int expected = current(store.find(entityId), entityId);
        for (int conflicts = 0; conflicts < MAX_CAS_CONFLICTS; conflicts++) {
            if (store.compareAndSet(entityId, expected, expected + 1)) {
                if (conflicts > 0) {
                    log.debug("[Retry-Counter] entity={} incremented to {} after {} cas conflicts",
                            entityId, expected + 1, conflicts);
                }
                return expected + 1;
            }
            // 被并发修改或实体已删除, 读最新提交值（不存在时抛出）
            expected = current(store.findLatest(entityId), entityId);
        }
        log.error("[Retry-Counter] entity={} gave up after {} cas conflicts, last expected={}",
                entityId, MAX_CAS_CONFLICTS, expected);
        throw new StorageUnavailableException("counter.increment", new IllegalStateException(
                "no progress after " + MAX_CAS_CONFLICTS + " compare-and-set conflicts on entity " + entityId));
    }

    /**
     * 无条件归零, 幂等
     */
    public void reset(String entityId) {
        if (!store.reset(entityId)) {
            throw new EntityNotFoundException(entityId);
        }
    }

    private static int current(OptionalInt n, String entityId) {
        if (n.isEmpty()) {
            throw new EntityNotFoundException(entityId);
        }
        return n.getAsInt();
    }
}
