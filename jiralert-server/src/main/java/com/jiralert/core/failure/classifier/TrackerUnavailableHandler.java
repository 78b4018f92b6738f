package com.jiralert.core.failure.classifier;

import com.jiralert.core.spi.failure.FailureCaseHandler;
import com.jiralert.core.spi.failure.FailureClassifier;
import com.jiralert.exception.TrackerUnavailableException;

/**
 * 工单系统暂时不可用
 */
public class TrackerUnavailableHandler implements FailureCaseHandler<TrackerUnavailableException> {

    @Override
    public Class<TrackerUnavailableException> exceptionType() {
        return TrackerUnavailableException.class;
    }

    @Override
    public FailureClassifier.Classification execute(TrackerUnavailableException ex) {
        return FailureClassifier.Classification.retryable(FailureClassifier.Category.UNAVAILABLE)
                .withCode("HTTP_" + ex.getStatusCode());
    }
}
