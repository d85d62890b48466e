package com.retrygate.core;

import com.retrygate.core.counter.RetryCounter;
import com.retrygate.core.decision.AdmissionDecider;
import com.retrygate.core.metric.RetryGateMetrics;
import com.retrygate.core.notify.NotifyContexts;
import com.retrygate.core.notify.NotifyingFacade;
import com.retrygate.core.policy.RetryPolicy;
import com.retrygate.exception.StorageUnavailableException;
import com.retrygate.model.AdmissionDecision;
import com.retrygate.model.RetryPolicySnapshot;
import com.retrygate.model.enums.Severity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 重试闸门入口, 供重新处理流程调用
 * 1. 派发前 decideAdmission
 * 2. 真正开始派发后 consumeAttempt（判定后未执行的请求不占用次数）
 */
public class RetryGateEngine {

    private static final Logger log = LoggerFactory.getLogger(RetryGateEngine.class);

    private final RetryPolicy policy;

    private final RetryCounter counter;

    private final AdmissionDecider decider;

    /** 指标 */
    private final RetryGateMetrics meter;

    /** 通知模块 */
    private final NotifyingFacade notifyService;

    /** 节点id */
    private final String nodeId;

    public RetryGateEngine(RetryPolicy policy,
                           RetryCounter counter,
                           AdmissionDecider decider,
                           RetryGateMetrics meter,
                           NotifyingFacade notifyService,
                           String nodeId) {
        this.policy = policy;
        this.counter = counter;
        this.decider = decider;
        this.meter = meter;
        this.notifyService = notifyService;
        this.nodeId = nodeId;
    }

    /**
     * 判定实体是否允许再次重试, 不修改计数
     */
    public AdmissionDecision decideAdmission(String entityId, boolean privileged) {
        try {
            RetryPolicySnapshot p = policy.current();
            int count = counter.read(entityId);
            AdmissionDecision d = decider.decide(p, count, privileged);
            meter.recordDecision(d);
            if (d.isAdmitted()) {
                log.debug("[Retry-Gate] admitted entity={}, reason={}, attempts={}, limit={}, privileged={}",
                        entityId, d.getReason().getCode(), count, d.getEffectiveLimit(), privileged);
            } else {
                log.warn("[Retry-Gate] denied entity={}, reason={}, attempts={}, limit={}",
                        entityId, d.getReason().getCode(), count, d.getEffectiveLimit());
                notifyService.fire(NotifyContexts.ctxForLimitReached(nodeId, entityId, d), Severity.WARNING);
            }
            return d;
        } catch (StorageUnavailableException e) {
            onStorageFailure(entityId, e);
            throw e;
        }
    }

    /**
     * 记录一次已派发的重试
     * @return 新计数
     */
    public int consumeAttempt(String entityId) {
        try {
            int n = counter.increment(entityId);
            meter.recordConsumed(n);
            log.info("[Retry-Gate] attempt consumed, entity={}, attempts={}", entityId, n);
            return n;
        } catch (StorageUnavailableException e) {
            onStorageFailure(entityId, e);
            throw e;
        }
    }

    public String getNodeId() { return nodeId; }

    private void onStorageFailure(String entityId, StorageUnavailableException e) {
        meter.incStorageErr();
        log.error("[Retry-Gate] storage unavailable, entity={}, op={}", entityId, e.getOperation(), e);
        notifyService.fire(NotifyContexts.ctxForStorageUnavailable(nodeId, entityId, e), Severity.ERROR);
    }
}
