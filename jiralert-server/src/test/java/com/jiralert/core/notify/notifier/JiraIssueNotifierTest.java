package com.jiralert.core.notify.notifier;

import com.jiralert.client.JiraClient;
import com.jiralert.client.JiraIssueRef;
import com.jiralert.model.AlertBatch;
import com.jiralert.model.ReceiverConfig;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import static com.jiralert.support.AlertFixtures.batch;
import static com.jiralert.support.AlertFixtures.firing;
import static com.jiralert.support.AlertFixtures.jiraReceiver;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
@DisplayName("JiraIssueNotifier")
class JiraIssueNotifierTest {

    @Mock
    private JiraClient client;

    @Test
    @DisplayName("组装 project/issuetype/summary/labels 与自定义字段")
    @SuppressWarnings("unchecked")
    void buildsIssueFields() {
        ReceiverConfig receiver = jiraReceiver("jira-ab").toBuilder()
                .priority("Critical")
                .labels(List.of("alertmanager"))
                .fields(Map.of("customfield_10001", "ops"))
                .build();
        AlertBatch b = batch("jira-ab", Map.of("alertname", "Disk Full"), firing("Disk Full"));
        given(client.createIssue(eq(receiver), any())).willReturn(new JiraIssueRef("1", "AB-1", null));

        new JiraIssueNotifier(receiver, client, "Disk Full", "desc").notify(b);

        ArgumentCaptor<Map<String, Object>> captor = ArgumentCaptor.forClass(Map.class);
        verify(client).createIssue(eq(receiver), captor.capture());
        Map<String, Object> fields = captor.getValue();
        assertThat(fields)
                .containsEntry("project", Map.of("key", "AB"))
                .containsEntry("issuetype", Map.of("name", "Bug"))
                .containsEntry("summary", "Disk Full")
                .containsEntry("description", "desc")
                .containsEntry("priority", Map.of("name", "Critical"))
                .containsEntry("customfield_10001", "ops");
        assertThat((List<String>) fields.get("labels"))
                .containsExactly("alertmanager", "ALERT{alertname=\"DiskFull\"}");
    }

    @Test
    @DisplayName("分组标签按 key 排序并去掉空白")
    void groupTicketLabelIsSortedAndCompact() {
        Map<String, String> group = new TreeMap<>(Map.of("job", "node exporter", "alertname", "X"));

        assertThat(JiraIssueNotifier.groupTicketLabel(group)).isEqualTo("ALERT{alertname=\"X\",job=\"nodeexporter\"}");
        assertThat(JiraIssueNotifier.groupTicketLabel(Map.of())).isEqualTo("ALERT{}");
    }

    @Test
    @DisplayName("add_group_labels 时附加每个分组标签")
    void addsGroupLabels() {
        ReceiverConfig receiver = jiraReceiver("jira-ab").toBuilder().addGroupLabels(true).build();
        JiraIssueNotifier notifier = new JiraIssueNotifier(receiver, client, "s", null);

        assertThat(notifier.labels(Map.of("job", "api", "alertname", "X")))
                .containsExactly("ALERT{alertname=\"X\",job=\"api\"}", "alertname=\"X\"", "job=\"api\"");
    }

    @Test
    @DisplayName("summary 截断到 255 字符, 没有描述时不写 description")
    void truncatesSummary() {
        JiraIssueNotifier notifier = new JiraIssueNotifier(jiraReceiver("jira-ab"), client, "x".repeat(300), null);

        Map<String, Object> fields = notifier.issueFields(batch("jira-ab", Map.of(), firing("X")));

        assertThat((String) fields.get("summary")).hasSize(JiraIssueNotifier.MAX_SUMMARY_LEN);
        assertThat(fields).doesNotContainKeys("description", "priority");
    }
}
