package com.jiralert.core.failure.classifier;

import com.jiralert.core.spi.failure.FailureCaseHandler;
import com.jiralert.core.spi.failure.FailureClassifier;
import com.jiralert.exception.guard.DownstreamOpenCircuitException;

/**
 * 熔断打开
 */
public class OpenCircuitHandler implements FailureCaseHandler<DownstreamOpenCircuitException> {

    @Override
    public Class<DownstreamOpenCircuitException> exceptionType() {
        return DownstreamOpenCircuitException.class;
    }

    @Override
    public FailureClassifier.Classification execute(DownstreamOpenCircuitException ex) {
        return FailureClassifier.Classification.retryable(FailureClassifier.Category.OPEN_CIRCUIT)
                .withCode("CB_OPEN");
    }
}
