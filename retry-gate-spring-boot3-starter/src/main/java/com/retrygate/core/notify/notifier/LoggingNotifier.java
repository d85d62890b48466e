package com.retrygate.core.notify.notifier;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.retrygate.core.spi.notify.Notifier;
import com.retrygate.model.ctx.NotifyContext;
import com.retrygate.model.enums.Severity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 日志通知, 默认启用
 * 事件以单行 JSON 输出, 便于日志平台检索
 */
public class LoggingNotifier implements Notifier {

    private static final Logger log = LoggerFactory.getLogger(LoggingNotifier.class);

    private final ObjectMapper mapper;

    public LoggingNotifier() {
        this(createDefaultMapper());
    }

    public LoggingNotifier(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    @Override
    public String name() {
        return "log";
    }

    @Override
    public void notify(NotifyContext ctx, Severity severity) {
        String json = render(ctx);
        switch (severity) {
            case CRITICAL, ERROR -> log.error("[Notify-{}] {}", ctx.getType(), json);
            case WARNING -> log.warn("[Notify-{}] {}", ctx.getType(), json);
            default -> log.info("[Notify-{}] {}", ctx.getType(), json);
        }
    }

    String render(NotifyContext ctx) {
        try {
            return mapper.writeValueAsString(ctx);
        } catch (JsonProcessingException e) {
            log.debug("[Notify] json render failed, fallback to toString", e);
            return String.valueOf(ctx);
        }
    }

    private static ObjectMapper createDefaultMapper() {
        ObjectMapper m = new ObjectMapper();
        // 时间输出 ISO-8601
        m.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        m.findAndRegisterModules();
        return m;
    }
}
