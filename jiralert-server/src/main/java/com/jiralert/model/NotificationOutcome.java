package com.jiralert.model;

import lombok.Getter;

/**
 * 一次投递的结果, 每次派发只产出一次
 */
@Getter
public final class NotificationOutcome {

    private static final NotificationOutcome SUCCESS = new NotificationOutcome(true, false, null);

    private final boolean success;

    private final boolean retryable;

    private final Throwable cause;

    private NotificationOutcome(boolean success, boolean retryable, Throwable cause) {
        this.success = success;
        this.retryable = retryable;
        this.cause = cause;
    }

    public static NotificationOutcome success() {
        return SUCCESS;
    }

    public static NotificationOutcome failure(boolean retryable, Throwable cause) {
        return new NotificationOutcome(false, retryable, cause);
    }

    public String message() {
        if (cause == null) {
            return "";
        }
        return cause.getMessage() == null ? cause.getClass().getSimpleName() : cause.getMessage();
    }

    @Override
    public String toString() {
        return success ? "Success" : "Failure{retryable=" + retryable + ", cause=" + message() + "}";
    }
}
