package com.retrygate.exception;

/**
 * 存储不可用
 * 调用方需自行决定重试读取或让外层请求失败, 引擎不会把它解释为放行或拒绝
 */
public class StorageUnavailableException extends RetryGateException {

    /** 失败的存储操作, 如 policy.getAll / counter.compareAndSet */
    private final String operation;

    public StorageUnavailableException(String operation, Throwable cause) {
        super("storage unavailable during " + operation, cause);
        this.operation = operation;
    }

    public String getOperation() {
        return operation;
    }
}
