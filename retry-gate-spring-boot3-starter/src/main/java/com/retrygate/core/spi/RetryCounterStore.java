package com.retrygate.core.spi;

import java.util.OptionalInt;

/**
 * 实体重试计数存储, 只读写计数字段
 */
public interface RetryCounterStore {

    /** 实体不存在返回 empty */
    OptionalInt find(String entityId);

    /**
     * 读取最新已提交的计数, 供 CAS 冲突后重读
     * 宿主事务内的一致性读可能停留在旧快照, 数据库实现需用锁定读
     */
    default OptionalInt findLatest(String entityId) {
        return find(entityId);
    }

    /**
     * 当前值等于 expected 时写入 next
     * @return false 表示值已被并发修改或实体不存在
     */
    boolean compareAndSet(String entityId, int expected, int next);

    /**
     * 无条件归零
     * @return false 表示实体不存在
     */
    boolean reset(String entityId);
}
