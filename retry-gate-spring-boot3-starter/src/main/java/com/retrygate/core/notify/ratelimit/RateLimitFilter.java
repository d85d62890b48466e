package com.retrygate.core.notify.ratelimit;

import com.retrygate.core.spi.notify.NotifierFilter;
import com.retrygate.model.ctx.NotifyContext;
import com.retrygate.model.enums.Severity;

import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.LongSupplier;

/**
 * 内存窗口限流, 按 事件类型+级别 计数
 */
public class RateLimitFilter implements NotifierFilter {

    private final long windowMs;

    private final int threshold;

    private final LongSupplier millis;

    private volatile long windowStart;

    private final ConcurrentHashMap<String, AtomicInteger> counter = new ConcurrentHashMap<>();

    public RateLimitFilter(Duration window, int threshold) {
        this(window, threshold, System::currentTimeMillis);
    }

    public RateLimitFilter(Duration window, int threshold, LongSupplier millis) {
        this.windowMs = window.toMillis();
        this.threshold = threshold;
        this.millis = millis;
        this.windowStart = millis.getAsLong();
    }

    @Override
    public boolean allow(NotifyContext ctx, Severity sev) {
        long now = millis.getAsLong();
        // 重置窗口
        if (now - windowStart >= windowMs) {
            windowStart = now;
            counter.clear();
        }
        String key = ctx.getType() + "_" + sev.name();
        int c = counter.computeIfAbsent(key, k -> new AtomicInteger()).incrementAndGet();
        return c <= threshold;
    }
}
