package com.jiralert.core.notify.factory;

import com.jiralert.core.notify.notifier.LoggingNotifier;
import com.jiralert.core.spi.notify.Notifier;
import com.jiralert.core.spi.notify.NotifierFactory;
import com.jiralert.core.spi.notify.NotifierTemplate;
import com.jiralert.model.AlertBatch;
import com.jiralert.model.ReceiverConfig;
import com.jiralert.model.enums.ReceiverType;

public class LoggingNotifierFactory implements NotifierFactory {

    private final NotifierTemplate template;

    public LoggingNotifierFactory(NotifierTemplate template) {
        this.template = template;
    }

    @Override
    public ReceiverType type() {
        return ReceiverType.LOG;
    }

    @Override
    public Notifier create(ReceiverConfig receiver, AlertBatch batch) {
        String summary = receiver.getSummary() == null
                ? receiver.getName()
                : template.renderSummary(receiver, batch);
        return new LoggingNotifier(receiver, summary, template.renderDescription(receiver, batch));
    }
}
