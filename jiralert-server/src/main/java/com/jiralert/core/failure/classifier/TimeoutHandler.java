package com.jiralert.core.failure.classifier;

import com.jiralert.core.spi.failure.FailureCaseHandler;
import com.jiralert.core.spi.failure.FailureClassifier;
import java.util.concurrent.TimeoutException;

/**
 * 投递超时
 */
public class TimeoutHandler implements FailureCaseHandler<TimeoutException> {

    @Override
    public Class<TimeoutException> exceptionType() {
        return TimeoutException.class;
    }

    @Override
    public FailureClassifier.Classification execute(TimeoutException ex) {
        return FailureClassifier.Classification.retryable(FailureClassifier.Category.TIMEOUT)
                .withCode("TIMEOUT");
    }
}
