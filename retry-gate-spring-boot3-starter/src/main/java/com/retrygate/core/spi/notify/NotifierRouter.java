package com.retrygate.core.spi.notify;

import com.retrygate.model.ctx.NotifyContext;
import com.retrygate.model.enums.Severity;

import java.util.List;

/**
 * 为一个事件挑选渠道, 返回空列表表示不通知
 */
public interface NotifierRouter {

    List<Notifier> route(NotifyContext ctx, Severity severity);
}
