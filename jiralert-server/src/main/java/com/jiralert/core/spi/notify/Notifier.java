package com.jiralert.core.spi.notify;

import com.jiralert.model.AlertBatch;

/**
 * 投递能力, 每种接收者类型一个变体, 由 NotifierFactory 按接收者配置构造
 */
public interface Notifier {

    /**
     * 返回此Notifier的渠道名, 用于日志
     */
    String name();

    /**
     * 同步投递, 失败直接抛出, 由 FailureClassifier 判定是否可重试
     * 实现需响应线程中断, 以便超时后被取消
     */
    void notify(AlertBatch batch);
}
