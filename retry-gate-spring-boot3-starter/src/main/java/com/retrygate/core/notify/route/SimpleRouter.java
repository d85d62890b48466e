package com.retrygate.core.notify.route;

import com.retrygate.core.spi.notify.Notifier;
import com.retrygate.core.spi.notify.NotifierRouter;
import com.retrygate.model.ctx.NotifyContext;
import com.retrygate.model.enums.Severity;

import java.util.List;

/**
 * 简单路由
 * 事件发给所有声明支持它的 Notifier
 */
public class SimpleRouter implements NotifierRouter {

    private final List<Notifier> notifiers;

    public SimpleRouter(List<Notifier> notifiers) {
        this.notifiers = List.copyOf(notifiers);
    }

    @Override
    public List<Notifier> route(NotifyContext ctx, Severity severity) {
        return notifiers.stream().filter(n -> n.supports(ctx)).toList();
    }
}
