package com.jiralert.core.failure.classifier;

import com.jiralert.core.spi.failure.FailureCaseHandler;
import com.jiralert.core.spi.failure.FailureClassifier;
import java.io.IOException;

/**
 * 网络/IO 异常
 */
public class IoHandler implements FailureCaseHandler<IOException> {

    @Override
    public Class<IOException> exceptionType() {
        return IOException.class;
    }

    @Override
    public FailureClassifier.Classification execute(IOException ex) {
        return FailureClassifier.Classification.retryable(FailureClassifier.Category.IO)
                .withCode("IO");
    }
}
