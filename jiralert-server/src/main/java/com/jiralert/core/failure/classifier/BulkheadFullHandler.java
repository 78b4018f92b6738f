package com.jiralert.core.failure.classifier;

import com.jiralert.core.spi.failure.FailureCaseHandler;
import com.jiralert.core.spi.failure.FailureClassifier;
import com.jiralert.exception.guard.DownstreamBulkheadFullException;

/**
 * 并发已满
 */
public class BulkheadFullHandler implements FailureCaseHandler<DownstreamBulkheadFullException> {

    @Override
    public Class<DownstreamBulkheadFullException> exceptionType() {
        return DownstreamBulkheadFullException.class;
    }

    @Override
    public FailureClassifier.Classification execute(DownstreamBulkheadFullException ex) {
        return FailureClassifier.Classification.retryable(FailureClassifier.Category.BULKHEAD_FULL)
                .withCode("BULKHEAD_FULL");
    }
}
