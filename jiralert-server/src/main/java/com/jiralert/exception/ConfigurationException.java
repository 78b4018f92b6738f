package com.jiralert.exception;

/**
 * 启动期配置校验失败, 进程无法启动
 */
public class ConfigurationException extends RuntimeException {

    public ConfigurationException(String message) {
        super(message);
    }
}
