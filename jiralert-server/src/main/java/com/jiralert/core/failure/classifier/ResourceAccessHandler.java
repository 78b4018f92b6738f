package com.jiralert.core.failure.classifier;

import com.jiralert.core.spi.failure.FailureCaseHandler;
import com.jiralert.core.spi.failure.FailureClassifier;
import org.springframework.web.client.ResourceAccessException;

/**
 * RestClient 连接/读取失败
 */
public class ResourceAccessHandler implements FailureCaseHandler<ResourceAccessException> {

    @Override
    public Class<ResourceAccessException> exceptionType() {
        return ResourceAccessException.class;
    }

    @Override
    public FailureClassifier.Classification execute(ResourceAccessException ex) {
        return FailureClassifier.Classification.retryable(FailureClassifier.Category.IO)
                .withCode("IO");
    }
}
