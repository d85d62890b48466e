package com.retrygate.exception;

/**
 * 实体不存在（与计数为0区分）
 */
public class EntityNotFoundException extends RetryGateException {

    private final String entityId;

    public EntityNotFoundException(String entityId) {
        super("retryable entity not found, id=" + entityId);
        this.entityId = entityId;
    }

    public String getEntityId() {
        return entityId;
    }
}
