package com.retrygate.core.admin;

import com.retrygate.core.counter.RetryCounter;
import com.retrygate.core.decision.AdmissionDecider;
import com.retrygate.core.metric.RetryGateMetrics;
import com.retrygate.core.notify.NotifyContexts;
import com.retrygate.core.notify.NotifyingFacade;
import com.retrygate.core.policy.RetryPolicy;
import com.retrygate.exception.InvalidPolicyValueException;
import com.retrygate.exception.StorageUnavailableException;
import com.retrygate.model.AdmissionDecision;
import com.retrygate.model.PolicyUpdate;
import com.retrygate.model.RetryPolicySnapshot;
import com.retrygate.model.RetryState;
import com.retrygate.model.enums.Severity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 管理端特权操作, 调用前需已在上游完成鉴权
 */
public class RetryAdminOperations {

    private static final Logger log = LoggerFactory.getLogger(RetryAdminOperations.class);

    private final RetryPolicy policy;

    private final RetryCounter counter;

    private final AdmissionDecider decider;

    private final RetryGateMetrics meter;

    private final NotifyingFacade notifyService;

    private final String nodeId;

    public RetryAdminOperations(RetryPolicy policy,
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
     * 计数归零, 已为0时同样成功
     * @return 归零后的状态（判定按非特权身份重新计算）
     */
    public RetryState resetCounter(String entityId) {
        try {
            counter.reset(entityId);
            RetryPolicySnapshot p = policy.current();
            AdmissionDecision d = decider.decide(p, 0, false);
            meter.incReset();
            log.info("[Retry-Admin] counter reset, entity={}, policy={}", entityId, p);
            notifyService.fire(NotifyContexts.ctxForCounterReset(nodeId, entityId, p), Severity.INFO);
            return new RetryState(entityId, 0, p, d);
        } catch (StorageUnavailableException e) {
            onStorageFailure(entityId, e);
            throw e;
        }
    }

    /**
     * 更新全局策略, 多个管理员并发更新时按字段后写覆盖
     */
    public RetryPolicySnapshot updatePolicy(PolicyUpdate update) {
        try {
            RetryPolicySnapshot after = policy.updatePolicy(update);
            meter.incPolicyUpdated();
            log.info("[Retry-Admin] policy updated, update={}, result={}", update, after);
            notifyService.fire(NotifyContexts.ctxForPolicyUpdated(nodeId, after), Severity.INFO);
            return after;
        } catch (InvalidPolicyValueException e) {
            meter.incPolicyRejected();
            log.warn("[Retry-Admin] policy update rejected, field={}, value={}", e.getField(), e.getRejectedValue());
            notifyService.fire(NotifyContexts.ctxForPolicyRejected(nodeId, e), Severity.WARNING);
            throw e;
        } catch (StorageUnavailableException e) {
            onStorageFailure(null, e);
            throw e;
        }
    }

    /**
     * 只读查看实体状态
     */
    public RetryState describe(String entityId) {
        try {
            RetryPolicySnapshot p = policy.current();
            int count = counter.read(entityId);
            return new RetryState(entityId, count, p, decider.decide(p, count, false));
        } catch (StorageUnavailableException e) {
            onStorageFailure(entityId, e);
            throw e;
        }
    }

    private void onStorageFailure(String entityId, StorageUnavailableException e) {
        meter.incStorageErr();
        log.error("[Retry-Admin] storage unavailable, entity={}, op={}", entityId, e.getOperation(), e);
        notifyService.fire(NotifyContexts.ctxForStorageUnavailable(nodeId, entityId, e), Severity.ERROR);
    }
}
