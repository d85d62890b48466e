package com.retrygate.core.notify;

import com.retrygate.core.metric.RetryGateMetrics;
import com.retrygate.core.spi.notify.Notifier;
import com.retrygate.core.spi.notify.NotifierFilter;
import com.retrygate.core.spi.notify.NotifierRouter;
import com.retrygate.model.ctx.NotifyContext;
import com.retrygate.model.enums.Severity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;

/**
 * 异步派发
 * 通过路由、限流、异步执行通知, 不阻塞准入与管理路径
 */
public class AsyncNotifyingService {

    private final Logger log = LoggerFactory.getLogger(AsyncNotifyingService.class);

    /** 单个渠道最多尝试次数 */
    private static final int MAX_CHANNEL_ATTEMPTS = 3;

    private final ExecutorService exec;

    private final NotifierRouter router;

    private final NotifierFilter filter;

    private final RetryGateMetrics metrics;

    public AsyncNotifyingService(ExecutorService exec, NotifierRouter router, NotifierFilter filter, RetryGateMetrics metrics) {
        this.exec = exec;
        this.router = router;
        this.filter = filter;
        this.metrics = metrics;
    }

    public void fire(NotifyContext ctx, Severity sev) {
        if (filter != null && !filter.allow(ctx, sev)) {
            metrics.incNotifySuppressed();
            return;
        }
        try {
            exec.execute(() -> dispatch(ctx, sev));
        } catch (RejectedExecutionException e) {
            metrics.incNotifyFailed();
            log.warn("[Notify] executor rejected event={}", ctx.getType());
        }
    }

    private void dispatch(NotifyContext ctx, Severity sev) {
        List<Notifier> notifiers = router.route(ctx, sev);
        for (Notifier n : notifiers) {
            try {
                int attempt = 0;
                long backoff = 200;
                while (true) {
                    try {
                        n.notify(ctx, sev);
                        break;
                    } catch (RuntimeException e) {
                        if (++attempt >= MAX_CHANNEL_ATTEMPTS) {
                            throw e;
                        }
                        Thread.sleep(backoff);
                        // 指数退避
                        backoff = Math.min(backoff * 2, 4000);
                    }
                }
                metrics.incNotifySent();
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
                metrics.incNotifyFailed();
                log.warn("[Notify] interrupted, channel={} event={}", n.name(), ctx.getType());
                return;
            } catch (RuntimeException e) {
                metrics.incNotifyFailed();
                log.error("[Notify] channel={} event={} failed", n.name(), ctx.getType(), e);
            }
        }
    }

    public void shutdown() {
        exec.shutdown();
    }
}
