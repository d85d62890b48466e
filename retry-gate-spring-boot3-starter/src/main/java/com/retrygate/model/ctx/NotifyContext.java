package com.retrygate.model.ctx;

import com.retrygate.model.enums.NotifyEventType;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;

/**
 * 事件上下文
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class NotifyContext {

    private NotifyEventType type;

    private String nodeId;

    /** 实体id, 策略类事件为空 */
    private String entityId;

    private Integer attemptCount;

    private Integer maxAttempts;

    // 分类码, 如 LIMIT_REACHED / RESET / STORAGE
    private String reasonCode;

    // 可被截断
    private String detail;

    // 事件发生时间
    private Instant when;

    // 额外字段：enabled、operation、field 等
    private Map<String, Object> attributes;
}
