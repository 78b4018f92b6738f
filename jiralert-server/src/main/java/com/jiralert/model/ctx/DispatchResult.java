package com.jiralert.model.ctx;

import lombok.Getter;
import org.springframework.http.HttpStatus;

import java.util.Map;

/**
 * 单次请求的派发结论, 交给 ResponseWriter 输出
 */
@Getter
public class DispatchResult {

    /** 路由未完成时使用的接收者占位名 */
    public static final String UNKNOWN_RECEIVER = "<unknown>";

    private final HttpStatus status;

    private final String message;

    private final String receiver;

    private final Map<String, String> groupLabels;

    private DispatchResult(HttpStatus status, String message, String receiver, Map<String, String> groupLabels) {
        this.status = status;
        this.message = message == null ? "" : message;
        this.receiver = receiver == null ? UNKNOWN_RECEIVER : receiver;
        this.groupLabels = groupLabels == null ? Map.of() : groupLabels;
    }

    public static DispatchResult ok(String receiver, Map<String, String> groupLabels) {
        return new DispatchResult(HttpStatus.OK, "", receiver, groupLabels);
    }

    public static DispatchResult failed(HttpStatus status, String message, String receiver, Map<String, String> groupLabels) {
        return new DispatchResult(status, message, receiver, groupLabels);
    }

    public boolean isError() {
        return status != HttpStatus.OK;
    }
}
