package com.retrygate.model;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

/**
 * 实体当前的重试状态, 管理端渲染用
 */
@Getter
@AllArgsConstructor
@ToString
public class RetryState {

    private final String entityId;

    private final int attemptCount;

    private final RetryPolicySnapshot policy;

    /** 以非特权身份重新计算的判定 */
    private final AdmissionDecision decision;
}
