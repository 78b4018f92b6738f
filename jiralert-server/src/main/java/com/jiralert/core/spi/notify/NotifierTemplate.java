package com.jiralert.core.spi.notify;

import com.jiralert.model.AlertBatch;
import com.jiralert.model.ReceiverConfig;

public interface NotifierTemplate {
    /** 渲染摘要 */
    String renderSummary(ReceiverConfig receiver, AlertBatch batch);

    /** 渲染描述 */
    String renderDescription(ReceiverConfig receiver, AlertBatch batch);
}
