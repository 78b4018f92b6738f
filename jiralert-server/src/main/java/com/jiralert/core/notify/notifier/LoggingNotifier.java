package com.jiralert.core.notify.notifier;

import com.jiralert.core.spi.notify.Notifier;
import com.jiralert.model.AlertBatch;
import com.jiralert.model.ReceiverConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 日志通知, type=LOG 的接收者使用, 不访问外部系统
 */
public class LoggingNotifier implements Notifier {

    private static final Logger log = LoggerFactory.getLogger(LoggingNotifier.class);

    private final ReceiverConfig receiver;

    private final String summary;

    private final String description;

    public LoggingNotifier(ReceiverConfig receiver, String summary, String description) {
        this.receiver = receiver;
        this.summary = summary;
        this.description = description;
    }

    @Override
    public String name() {
        return "log";
    }

    @Override
    public void notify(AlertBatch batch) {
        log.info("[Notify-log] receiver={}, summary={}, alerts={}, groupLabels={}",
                receiver.getName(), summary, batch.getAlerts().size(), batch.getGroupLabels());
        log.debug("[Notify-log] receiver={}, description={}", receiver.getName(), truncate(description));
    }

    private String truncate(String s) {
        return s == null ? null : (s.length() > 2000 ? s.substring(0, 2000) : s);
    }
}
