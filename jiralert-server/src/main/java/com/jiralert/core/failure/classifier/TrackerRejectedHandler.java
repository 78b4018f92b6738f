package com.jiralert.core.failure.classifier;

import com.jiralert.core.spi.failure.FailureCaseHandler;
import com.jiralert.core.spi.failure.FailureClassifier;
import com.jiralert.exception.TrackerRejectedException;

/**
 * 工单系统拒绝请求
 */
public class TrackerRejectedHandler implements FailureCaseHandler<TrackerRejectedException> {

    @Override
    public Class<TrackerRejectedException> exceptionType() {
        return TrackerRejectedException.class;
    }

    @Override
    public FailureClassifier.Classification execute(TrackerRejectedException ex) {
        return FailureClassifier.Classification.permanent(FailureClassifier.Category.REJECTED)
                .withCode("HTTP_" + ex.getStatusCode());
    }
}
