package com.jiralert.core.notify.filter;

import com.jiralert.core.spi.notify.AlertFilter;
import com.jiralert.model.Alert;
import com.jiralert.model.AlertBatch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * 只保留 firing 告警, resolved 告警不转发到工单系统
 */
public class FiringAlertFilter implements AlertFilter {

    private static final Logger log = LoggerFactory.getLogger(FiringAlertFilter.class);

    @Override
    public AlertBatch filter(AlertBatch batch) {
        List<Alert> firing = batch.getAlerts().stream()
                .filter(Alert::isFiring)
                .toList();
        if (firing.size() == batch.getAlerts().size()) {
            return batch;
        }
        // 上游本应关闭 resolved 通知
        log.warn("[Filter] receiver should have \"send_resolved: false\" set in Alertmanager config, receiver={}, dropped={}",
                batch.getReceiver(), batch.getAlerts().size() - firing.size());
        return batch.withAlerts(firing);
    }
}
