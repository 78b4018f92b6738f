package com.jiralert.exception;

/**
 * 工单系统暂时不可用（5xx / 429）, 上游可重试
 */
public class TrackerUnavailableException extends RuntimeException {

    private final int statusCode;

    public TrackerUnavailableException(int statusCode, String message, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
    }

    public int getStatusCode() {
        return statusCode;
    }
}
