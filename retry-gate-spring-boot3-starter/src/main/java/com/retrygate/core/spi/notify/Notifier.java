package com.retrygate.core.spi.notify;

import com.retrygate.model.ctx.NotifyContext;
import com.retrygate.model.enums.Severity;

/**
 * 闸门事件通知渠道（拒绝、重置、策略变更、存储故障）
 */
public interface Notifier {

    /** 渠道名, 出现在派发失败日志里 */
    String name();

    /**
     * 是否接收该事件, 默认全部接收
     * 例如只关心 STORAGE_UNAVAILABLE 的值班渠道可在此过滤
     */
    default boolean supports(NotifyContext ctx) {
        return true;
    }

    /**
     * 同步发送; 由 AsyncNotifyingService 在通知线程池中调用, 抛出异常会触发重试
     */
    void notify(NotifyContext ctx, Severity severity);
}
