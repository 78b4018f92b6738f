package com.jiralert.core.notify.notifier;

import com.jiralert.client.JiraClient;
import com.jiralert.client.JiraIssueRef;
import com.jiralert.core.spi.notify.Notifier;
import com.jiralert.model.AlertBatch;
import com.jiralert.model.ReceiverConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * 在 Jira 中为一个告警批次创建工单
 */
public class JiraIssueNotifier implements Notifier {

    private static final Logger log = LoggerFactory.getLogger(JiraIssueNotifier.class);

    /** Jira summary 长度上限 */
    static final int MAX_SUMMARY_LEN = 255;

    private final ReceiverConfig receiver;

    private final JiraClient client;

    private final String summary;

    private final String description;

    public JiraIssueNotifier(ReceiverConfig receiver, JiraClient client, String summary, String description) {
        this.receiver = receiver;
        this.client = client;
        this.summary = summary.length() > MAX_SUMMARY_LEN ? summary.substring(0, MAX_SUMMARY_LEN) : summary;
        this.description = description;
    }

    @Override
    public String name() {
        return "jira";
    }

    @Override
    public void notify(AlertBatch batch) {
        JiraIssueRef ref = client.createIssue(receiver, issueFields(batch));
        log.info("[Notify-jira] issue created, receiver={}, project={}, key={}, alerts={}",
                receiver.getName(), receiver.getProject(), ref == null ? null : ref.key(), batch.getAlerts().size());
    }

    Map<String, Object> issueFields(AlertBatch batch) {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("project", Map.of("key", receiver.getProject()));
        fields.put("issuetype", Map.of("name", receiver.getIssueType()));
        fields.put("summary", summary);
        if (description != null) {
            fields.put("description", description);
        }
        if (StringUtils.hasText(receiver.getPriority())) {
            fields.put("priority", Map.of("name", receiver.getPriority()));
        }
        fields.put("labels", labels(batch.getGroupLabels()));
        // 自定义字段原样透传
        fields.putAll(receiver.getFields());
        return fields;
    }

    List<String> labels(Map<String, String> groupLabels) {
        if (groupLabels == null) {
            groupLabels = Map.of();
        }
        List<String> labels = new ArrayList<>(receiver.getLabels());
        labels.add(groupTicketLabel(groupLabels));
        if (receiver.isAddGroupLabels()) {
            new TreeMap<>(groupLabels).forEach((k, v) -> labels.add(noSpaces(k + "=\"" + v + "\"")));
        }
        return labels;
    }

    /**
     * 形如 ALERT{alertname="X",job="y"}, Jira 标签不允许空白
     */
    static String groupTicketLabel(Map<String, String> groupLabels) {
        if (groupLabels == null) {
            groupLabels = Map.of();
        }
        String body = new TreeMap<>(groupLabels).entrySet().stream()
                .map(e -> e.getKey() + "=\"" + e.getValue() + "\"")
                .collect(Collectors.joining(","));
        return noSpaces("ALERT{" + body + "}");
    }

    private static String noSpaces(String s) {
        return s.replaceAll("\\s", "");
    }
}
