package com.jiralert.exception.guard;

public class DownstreamBulkheadFullException extends RuntimeException {

    public DownstreamBulkheadFullException(String receiver, Throwable cause) {
        super("too many concurrent deliveries for receiver " + receiver, cause);
    }
}
