package com.jiralert.exception;

/**
 * 请求体无法解码为 AlertBatch
 */
public class DecodeException extends RuntimeException {

    public DecodeException(String message) {
        super(message);
    }

    public DecodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
