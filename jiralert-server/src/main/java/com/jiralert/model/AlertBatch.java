package com.jiralert.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;
import java.util.Map;

/**
 * Alertmanager webhook 负载
 * groupLabels 仅用于诊断日志与工单标签
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class AlertBatch {

    String version;

    String groupKey;

    String receiver;

    String status;

    @Builder.Default
    Map<String, String> groupLabels = Map.of();

    @Builder.Default
    Map<String, String> commonLabels = Map.of();

    @Builder.Default
    Map<String, String> commonAnnotations = Map.of();

    String externalURL;

    List<Alert> alerts;

    /**
     * 替换告警列表, 其余字段保持不变
     */
    public AlertBatch withAlerts(List<Alert> alerts) {
        return toBuilder().alerts(List.copyOf(alerts)).build();
    }
}
