package com.retrygate.core.notify;

import com.retrygate.core.notify.ratelimit.RateLimitFilter;
import com.retrygate.model.ctx.NotifyContext;
import com.retrygate.model.enums.NotifyEventType;
import com.retrygate.model.enums.Severity;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;

import static org.junit.jupiter.api.Assertions.*;

@Tag("unit")
public class RateLimitFilterTest {

    private static NotifyContext ctx(NotifyEventType type) {
        NotifyContext c = new NotifyContext();
        c.setType(type);
        return c;
    }

    @Test
    void test_threshold_per_type_and_severity() {
        AtomicLong now = new AtomicLong(1_000);
        RateLimitFilter filter = new RateLimitFilter(Duration.ofSeconds(30), 2, now::get);

        assertTrue(filter.allow(ctx(NotifyEventType.LIMIT_REACHED), Severity.WARNING));
        assertTrue(filter.allow(ctx(NotifyEventType.LIMIT_REACHED), Severity.WARNING));
        assertFalse(filter.allow(ctx(NotifyEventType.LIMIT_REACHED), Severity.WARNING));
        // 其他类型独立计数
        assertTrue(filter.allow(ctx(NotifyEventType.COUNTER_RESET), Severity.INFO));
        assertTrue(filter.allow(ctx(NotifyEventType.LIMIT_REACHED), Severity.ERROR));
    }

    @Test
    void test_window_resets() {
        AtomicLong now = new AtomicLong(0);
        RateLimitFilter filter = new RateLimitFilter(Duration.ofSeconds(30), 1, now::get);

        assertTrue(filter.allow(ctx(NotifyEventType.STORAGE_UNAVAILABLE), Severity.ERROR));
        assertFalse(filter.allow(ctx(NotifyEventType.STORAGE_UNAVAILABLE), Severity.ERROR));
        now.set(29_999);
        assertFalse(filter.allow(ctx(NotifyEventType.STORAGE_UNAVAILABLE), Severity.ERROR));
        now.set(30_000);
        assertTrue(filter.allow(ctx(NotifyEventType.STORAGE_UNAVAILABLE), Severity.ERROR));
    }
}
