package com.jiralert.core.spi.notify;

import com.jiralert.model.ReceiverConfig;

import java.util.Optional;

/**
 * 路由：接收者名 → 接收者配置
 */
public interface ReceiverRouter {

    Optional<ReceiverConfig> resolve(String receiverName);
}
