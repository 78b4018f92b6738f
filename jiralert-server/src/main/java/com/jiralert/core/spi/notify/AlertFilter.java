package com.jiralert.core.spi.notify;

import com.jiralert.model.AlertBatch;

/**
 * 过滤器：投递前剔除不需要转发的告警
 */
public interface AlertFilter {

    /**
     * 返回新的批次, 不修改入参
     */
    AlertBatch filter(AlertBatch batch);
}
