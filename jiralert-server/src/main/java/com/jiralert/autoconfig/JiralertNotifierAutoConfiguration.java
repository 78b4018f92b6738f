package com.jiralert.autoconfig;

import com.jiralert.client.JiraClient;
import com.jiralert.config.JiralertProperties;
import com.jiralert.config.ReceiverRegistry;
import com.jiralert.core.JiralertLifecycle;
import com.jiralert.core.engine.AlertDispatcher;
import com.jiralert.core.handler.GuardedDeliveryExecutor;
import com.jiralert.core.notify.NotifierGateway;
import com.jiralert.core.notify.factory.JiraIssueNotifierFactory;
import com.jiralert.core.notify.factory.LoggingNotifierFactory;
import com.jiralert.core.notify.filter.FiringAlertFilter;
import com.jiralert.core.notify.route.ConfigReceiverRouter;
import com.jiralert.core.notify.template.PlaceholderNotifierTemplate;
import com.jiralert.core.serializer.JacksonAlertDecoder;
import com.jiralert.core.spi.PayloadDecoder;
import com.jiralert.core.spi.failure.FailureClassifier;
import com.jiralert.core.spi.notify.AlertFilter;
import com.jiralert.core.spi.notify.NotifierFactory;
import com.jiralert.core.spi.notify.NotifierTemplate;
import com.jiralert.core.spi.notify.ReceiverRouter;
import io.micrometer.core.instrument.util.NamedThreadFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.JdkClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

import java.net.http.HttpClient;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

@Configuration
@EnableConfigurationProperties(JiralertProperties.class)
public class JiralertNotifierAutoConfiguration {

    /**
     * 接收者配置中心, 启动时校验失败直接拒绝启动
     */
    @Bean
    @ConditionalOnMissingBean
    public ReceiverRegistry receiverRegistry(JiralertProperties props) {
        return new ReceiverRegistry(props);
    }

    @Bean
    @ConditionalOnMissingBean(ReceiverRouter.class)
    public ReceiverRouter receiverRouter(ReceiverRegistry registry) {
        return new ConfigReceiverRouter(registry);
    }

    @Bean
    @ConditionalOnMissingBean(AlertFilter.class)
    public AlertFilter alertFilter() {
        return new FiringAlertFilter();
    }

    @Bean
    @ConditionalOnMissingBean(PayloadDecoder.class)
    public PayloadDecoder payloadDecoder() {
        return new JacksonAlertDecoder();
    }

    @Bean
    @ConditionalOnMissingBean(NotifierTemplate.class)
    public NotifierTemplate notifierTemplate() {
        return new PlaceholderNotifierTemplate();
    }

    /**
     * Jira 客户端, 读超时与投递超时一致
     */
    @Bean
    @ConditionalOnMissingBean
    public JiraClient jiraClient(RestClient.Builder builder, JiralertProperties props) {
        Duration timeout = props.getDelivery().getTimeout();
        HttpClient httpClient = HttpClient.newBuilder()
                .connectTimeout(timeout)
                .build();
        JdkClientHttpRequestFactory requestFactory = new JdkClientHttpRequestFactory(httpClient);
        requestFactory.setReadTimeout(timeout);
        return new JiraClient(builder.requestFactory(requestFactory));
    }

    @Bean
    public NotifierFactory jiraIssueNotifierFactory(JiraClient client, NotifierTemplate template) {
        return new JiraIssueNotifierFactory(client, template);
    }

    @Bean
    public NotifierFactory loggingNotifierFactory(NotifierTemplate template) {
        return new LoggingNotifierFactory(template);
    }

    /**
     * 投递线程池, 队列满直接拒绝, 由网关映射为可重试
     */
    @Bean("deliveryExecutor")
    public ExecutorService deliveryExecutor(JiralertProperties props) {
        JiralertProperties.Exec exec = props.getDelivery().getExecutor();
        return new ThreadPoolExecutor(
                exec.getCorePoolSize(),
                exec.getMaxPoolSize(),
                exec.getKeepAlive().toSeconds(),
                TimeUnit.SECONDS,
                new ArrayBlockingQueue<>(exec.getQueueCapacity()),
                new NamedThreadFactory("jiralert-delivery"),
                new ThreadPoolExecutor.AbortPolicy()
        );
    }

    @Bean
    @ConditionalOnMissingBean
    public NotifierGateway notifierGateway(List<NotifierFactory> factories,
                                           @Qualifier("deliveryExecutor") ExecutorService deliveryExecutor,
                                           GuardedDeliveryExecutor guard,
                                           FailureClassifier classifier,
                                           JiralertProperties props) {
        return new NotifierGateway(factories, deliveryExecutor, guard, classifier, props.getDelivery().getTimeout());
    }

    @Bean
    @ConditionalOnMissingBean
    public AlertDispatcher alertDispatcher(PayloadDecoder decoder,
                                           ReceiverRouter router,
                                           AlertFilter filter,
                                           NotifierGateway gateway) {
        return new AlertDispatcher(decoder, router, filter, gateway);
    }

    @Bean
    public JiralertLifecycle jiralertLifecycle(ReceiverRegistry registry,
                                               JiralertProperties props,
                                               @Qualifier("deliveryExecutor") ExecutorService deliveryExecutor) {
        return new JiralertLifecycle(registry, props, deliveryExecutor);
    }
}
