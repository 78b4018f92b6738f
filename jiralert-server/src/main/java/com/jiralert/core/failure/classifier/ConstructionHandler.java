package com.jiralert.core.failure.classifier;

import com.jiralert.core.spi.failure.FailureCaseHandler;
import com.jiralert.core.spi.failure.FailureClassifier;
import com.jiralert.exception.NotifierConstructionException;

/**
 * Notifier 构造失败
 */
public class ConstructionHandler implements FailureCaseHandler<NotifierConstructionException> {

    @Override
    public Class<NotifierConstructionException> exceptionType() {
        return NotifierConstructionException.class;
    }

    @Override
    public FailureClassifier.Classification execute(NotifierConstructionException ex) {
        return FailureClassifier.Classification.permanent(FailureClassifier.Category.CONSTRUCTION)
                .withCode("CONSTRUCTION");
    }
}
