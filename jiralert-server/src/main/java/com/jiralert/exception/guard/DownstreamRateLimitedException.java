package com.jiralert.exception.guard;

public class DownstreamRateLimitedException extends RuntimeException {

    public DownstreamRateLimitedException(String receiver, Throwable cause) {
        super("delivery rate limited for receiver " + receiver, cause);
    }
}
