package com.jiralert.core.failure.classifier;

import com.jiralert.core.spi.failure.FailureCaseHandler;
import com.jiralert.core.spi.failure.FailureClassifier;
import com.jiralert.exception.guard.DownstreamRateLimitedException;

/**
 * 限流
 */
public class RateLimitedHandler implements FailureCaseHandler<DownstreamRateLimitedException> {

    @Override
    public Class<DownstreamRateLimitedException> exceptionType() {
        return DownstreamRateLimitedException.class;
    }

    @Override
    public FailureClassifier.Classification execute(DownstreamRateLimitedException ex) {
        return FailureClassifier.Classification.retryable(FailureClassifier.Category.RATE_LIMITED)
                .withCode("RATE_LIMITED");
    }
}
