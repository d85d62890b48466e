package com.retrygate.core.spi.notify;

import com.retrygate.model.ctx.NotifyContext;
import com.retrygate.model.enums.Severity;

/**
 * 派发前过滤, 在调用线程上执行, 需要足够轻量
 */
@FunctionalInterface
public interface NotifierFilter {

    /** false 表示丢弃, 计入 retry.gate.notify.suppressed */
    boolean allow(NotifyContext ctx, Severity severity);
}
