package com.jiralert.autoconfig;

import com.jiralert.core.metric.JiralertMeterRegistryProvider;
import com.jiralert.core.metric.JiralertMetrics;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.prometheusmetrics.PrometheusConfig;
import io.micrometer.prometheusmetrics.PrometheusMeterRegistry;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.stream.Collectors;

@Configuration
public class JiralertMetricsAutoConfiguration {

    /**
     * /metrics 暴露用的 Prometheus 注册表
     */
    @Bean
    @ConditionalOnMissingBean
    public PrometheusMeterRegistry prometheusMeterRegistry() {
        return new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);
    }

    @Bean
    public JiralertMeterRegistryProvider jiralertMeterRegistryProvider(PrometheusMeterRegistry primary,
                                                                       ObjectProvider<MeterRegistry> discovered) {
        return new JiralertMeterRegistryProvider(primary, discovered.orderedStream().collect(Collectors.toList()));
    }

    @Bean
    public JiralertMetrics jiralertMetrics(JiralertMeterRegistryProvider provider) {
        return JiralertMetrics.create(provider.getRegistry());
    }
}
