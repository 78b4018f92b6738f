package com.jiralert.exception;

/**
 * 工单系统拒绝请求（请求非法、鉴权失败等）, 重试无意义
 */
public class TrackerRejectedException extends RuntimeException {

    private final int statusCode;

    public TrackerRejectedException(int statusCode, String message, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
    }

    public int getStatusCode() {
        return statusCode;
    }
}
