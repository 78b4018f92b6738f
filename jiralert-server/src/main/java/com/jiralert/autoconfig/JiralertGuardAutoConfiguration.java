package com.jiralert.autoconfig;

import com.jiralert.config.JiralertGuardProperties;
import com.jiralert.core.handler.GuardedDeliveryExecutor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties({
        JiralertGuardProperties.class
})
public class JiralertGuardAutoConfiguration {

    /**
     * 投递统一保护入口
     */
    @Bean
    @ConditionalOnMissingBean
    public GuardedDeliveryExecutor guardedDeliveryExecutor(JiralertGuardProperties props) {
        return new GuardedDeliveryExecutor(props);
    }
}
