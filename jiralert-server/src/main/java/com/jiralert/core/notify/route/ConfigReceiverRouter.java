package com.jiralert.core.notify.route;

import com.jiralert.config.ReceiverRegistry;
import com.jiralert.core.spi.notify.ReceiverRouter;
import com.jiralert.model.ReceiverConfig;

import java.util.Optional;

/**
 * 按名精确匹配配置中的接收者
 * 无通配、无默认接收者
 */
public class ConfigReceiverRouter implements ReceiverRouter {

    private final ReceiverRegistry registry;

    public ConfigReceiverRouter(ReceiverRegistry registry) {
        this.registry = registry;
    }

    @Override
    public Optional<ReceiverConfig> resolve(String receiverName) {
        return Optional.ofNullable(registry.receiverByName(receiverName));
    }
}
