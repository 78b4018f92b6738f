package com.jiralert.exception.guard;

/**
 * 异常类型
 * 用于 FailureClassifier 识别 下游系统性故障
 */
public class DownstreamOpenCircuitException extends RuntimeException {

    public DownstreamOpenCircuitException(String receiver, Throwable cause) {
        super("circuit open for receiver " + receiver, cause);
    }
}
