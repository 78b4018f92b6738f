package com.jiralert.exception;

/**
 * 根据接收者配置构造 Notifier 失败（参数非法、模板渲染失败等）, 不可重试
 */
public class NotifierConstructionException extends RuntimeException {

    public NotifierConstructionException(String message) {
        super(message);
    }

    public NotifierConstructionException(String message, Throwable cause) {
        super(message, cause);
    }
}
