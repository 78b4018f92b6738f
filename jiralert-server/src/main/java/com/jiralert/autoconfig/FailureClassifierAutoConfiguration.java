package com.jiralert.autoconfig;

import com.jiralert.core.failure.RouterFailureClassifier;
import com.jiralert.core.failure.classifier.*;
import com.jiralert.core.spi.failure.FailureCaseHandler;
import com.jiralert.core.spi.failure.FailureClassifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

@Configuration
public class FailureClassifierAutoConfiguration {

    // 默认内置一组分类器（可通过 Bean 覆盖/新增）
    @Bean
    @ConditionalOnMissingBean(OpenCircuitHandler.class)
    public OpenCircuitHandler openCircuitHandler(){ return new OpenCircuitHandler(); }

    @Bean
    @ConditionalOnMissingBean(RateLimitedHandler.class)
    public RateLimitedHandler rateLimitedHandler(){ return new RateLimitedHandler(); }

    @Bean
    @ConditionalOnMissingBean(BulkheadFullHandler.class)
    public BulkheadFullHandler bulkheadFullHandler(){ return new BulkheadFullHandler(); }

    @Bean
    @ConditionalOnMissingBean(TimeoutHandler.class)
    public TimeoutHandler timeoutHandler(){ return new TimeoutHandler(); }

    @Bean
    @ConditionalOnMissingBean(IoHandler.class)
    public IoHandler ioHandler(){ return new IoHandler(); }

    @Bean
    @ConditionalOnMissingBean(ResourceAccessHandler.class)
    public ResourceAccessHandler resourceAccessHandler(){ return new ResourceAccessHandler(); }

    @Bean
    @ConditionalOnMissingBean(TrackerUnavailableHandler.class)
    public TrackerUnavailableHandler trackerUnavailableHandler(){ return new TrackerUnavailableHandler(); }

    @Bean
    @ConditionalOnMissingBean(TrackerRejectedHandler.class)
    public TrackerRejectedHandler trackerRejectedHandler(){ return new TrackerRejectedHandler(); }

    @Bean
    @ConditionalOnMissingBean(ConstructionHandler.class)
    public ConstructionHandler constructionHandler(){ return new ConstructionHandler(); }

    // Router 分类器, 把所有 FailureCaseHandler 注入
    @Bean
    @ConditionalOnMissingBean(FailureClassifier.class)
    public FailureClassifier failureClassifier(List<FailureCaseHandler<?>> handlers) {
        return new RouterFailureClassifier(handlers);
    }
}
