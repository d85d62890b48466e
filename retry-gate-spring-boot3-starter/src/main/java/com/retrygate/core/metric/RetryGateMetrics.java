package com.retrygate.core.metric;

import com.retrygate.model.AdmissionDecision;
import com.retrygate.model.enums.AdmissionReason;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;

public final class RetryGateMetrics {
    private final Counter allowed;
    private final Counter denied;
    private final Counter unlimited;
    private final Counter bypassed;
    private final Counter consumed;
    private final Counter reset;
    private final Counter policyUpdated;
    private final Counter policyRejected;
    private final Counter storageErr;
    private final Counter notifySuppressed;
    private final Counter notifySent;
    private final Counter notifyFailed;
    private final DistributionSummary attempts;

    private RetryGateMetrics(MeterRegistry reg) {
        this.allowed   = admission(reg, "allowed");
        this.denied    = admission(reg, "denied");
        this.unlimited = admission(reg, "unlimited");
        this.bypassed  = admission(reg, "bypassed");
        this.consumed  = Counter.builder("retry.gate.attempt.consumed").description("retry attempts consumed").register(reg);
        this.reset     = Counter.builder("retry.gate.counter.reset").description("counters reset by admin").register(reg);
        this.policyUpdated  = Counter.builder("retry.gate.policy.updated").description("policy updates applied").register(reg);
        this.policyRejected = Counter.builder("retry.gate.policy.rejected").description("policy updates rejected").register(reg);
        this.storageErr = Counter.builder("retry.gate.storage.error").description("storage unavailable").register(reg);
        this.notifySuppressed = Counter.builder("retry.gate.notify.suppressed").description("notify suppressed").register(reg);
        this.notifySent   = Counter.builder("retry.gate.notify.sent").description("notify sent").register(reg);
        this.notifyFailed = Counter.builder("retry.gate.notify.failed").description("notify failed").register(reg);
        this.attempts = DistributionSummary.builder("retry.gate.attempts")
                .description("attempt count after consumption").baseUnit("times").register(reg);
    }

    private static Counter admission(MeterRegistry reg, String outcome) {
        return Counter.builder("retry.gate.admission")
                .description("admission decisions")
                .tag("outcome", outcome)
                .register(reg);
    }

    public static RetryGateMetrics create(MeterRegistry reg) { return new RetryGateMetrics(reg); }

    public void recordDecision(AdmissionDecision d) {
        if (!d.isAdmitted()) {
            denied.increment();
        } else if (d.isPrivileged()) {
            bypassed.increment();
        } else if (d.getReason() == AdmissionReason.LIMITS_DISABLED) {
            unlimited.increment();
        } else {
            allowed.increment();
        }
    }

    public void recordConsumed(int attemptCount){ consumed.increment(); attempts.record(attemptCount); }
    public void incReset(){          reset.increment(); }
    public void incPolicyUpdated(){  policyUpdated.increment(); }
    public void incPolicyRejected(){ policyRejected.increment(); }
    public void incStorageErr(){     storageErr.increment(); }
    public void incNotifySuppressed(){ notifySuppressed.increment(); }
    public void incNotifySent(){     notifySent.increment(); }
    public void incNotifyFailed(){   notifyFailed.increment(); }
}
