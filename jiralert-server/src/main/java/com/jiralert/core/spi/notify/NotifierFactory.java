package com.jiralert.core.spi.notify;

import com.jiralert.exception.NotifierConstructionException;
import com.jiralert.model.AlertBatch;
import com.jiralert.model.ReceiverConfig;
import com.jiralert.model.enums.ReceiverType;

/**
 * 按接收者类型构造 Notifier
 * 模板在构造时渲染, 渲染失败属于构造失败
 */
public interface NotifierFactory {

    ReceiverType type();

    Notifier create(ReceiverConfig receiver, AlertBatch batch) throws NotifierConstructionException;
}
