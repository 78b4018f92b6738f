package com.jiralert.core.notify.template;

import com.jiralert.core.spi.notify.NotifierTemplate;
import com.jiralert.exception.NotifierConstructionException;
import com.jiralert.model.AlertBatch;
import com.jiralert.model.ReceiverConfig;
import org.springframework.util.PropertyPlaceholderHelper;

import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * 基于 {{key}} 占位符的模板渲染
 *
 * 支持的 key：
 *   receiver / status / externalURL / groupKey
 *   alerts.count
 *   groupLabels / groupLabels.<name>
 *   commonLabels.<name> / commonAnnotations.<name>
 * 默认值写法：{{commonAnnotations.summary:n/a}}
 */
public class PlaceholderNotifierTemplate implements NotifierTemplate {

    private static final PropertyPlaceholderHelper HELPER =
            new PropertyPlaceholderHelper("{{", "}}", ":", false);

    @Override
    public String renderSummary(ReceiverConfig receiver, AlertBatch batch) {
        return render("summary", receiver.getSummary(), receiver, batch);
    }

    @Override
    public String renderDescription(ReceiverConfig receiver, AlertBatch batch) {
        return render("description", receiver.getDescription(), receiver, batch);
    }

    private String render(String field, String tmpl, ReceiverConfig receiver, AlertBatch batch) {
        if (tmpl == null) {
            return null;
        }
        try {
            return HELPER.replacePlaceholders(tmpl, key -> resolve(key.trim(), batch));
        } catch (IllegalArgumentException e) {
            throw new NotifierConstructionException(
                    "failed to render " + field + " template for receiver " + receiver.getName() + ": " + e.getMessage(), e);
        }
    }

    static String resolve(String key, AlertBatch batch) {
        switch (key) {
            case "receiver":
                return batch.getReceiver();
            case "status":
                return batch.getStatus();
            case "externalURL":
                return batch.getExternalURL();
            case "groupKey":
                return batch.getGroupKey();
            case "alerts.count":
                return String.valueOf(batch.getAlerts() == null ? 0 : batch.getAlerts().size());
            case "groupLabels":
                return join(batch.getGroupLabels());
            default:
                break;
        }
        if (key.startsWith("groupLabels.")) {
            return lookup(batch.getGroupLabels(), key.substring("groupLabels.".length()));
        }
        if (key.startsWith("commonLabels.")) {
            return lookup(batch.getCommonLabels(), key.substring("commonLabels.".length()));
        }
        if (key.startsWith("commonAnnotations.")) {
            return lookup(batch.getCommonAnnotations(), key.substring("commonAnnotations.".length()));
        }
        return null;
    }

    private static String lookup(Map<String, String> m, String name) {
        return m == null ? null : m.get(name);
    }

    private static String join(Map<String, String> m) {
        if (m == null || m.isEmpty()) {
            return "";
        }
        return new TreeMap<>(m).entrySet().stream()
                .map(e -> e.getKey() + "=" + e.getValue())
                .collect(Collectors.joining(","));
    }
}
