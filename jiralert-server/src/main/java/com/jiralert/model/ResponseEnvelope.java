package com.jiralert.model;

/**
 * /alert 的固定响应体
 */
public record ResponseEnvelope(boolean error, int status, String message) {
}
