package com.retrygate.model.enums;

/**
 * 通知事件
 */
public enum NotifyEventType {
    /** 非特权调用被上限拒绝 */
    LIMIT_REACHED,

    /** 管理员重置计数 */
    COUNTER_RESET,

    /** 管理员更新策略 */
    POLICY_UPDATED,

    /** 策略更新参数被拒绝 */
    POLICY_REJECTED,

    /** 存储不可用（Mapper/DB） */
    STORAGE_UNAVAILABLE
}
