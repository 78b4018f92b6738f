package com.jiralert.core.notify.factory;

import com.jiralert.client.JiraClient;
import com.jiralert.core.notify.notifier.JiraIssueNotifier;
import com.jiralert.core.spi.notify.Notifier;
import com.jiralert.core.spi.notify.NotifierFactory;
import com.jiralert.core.spi.notify.NotifierTemplate;
import com.jiralert.exception.NotifierConstructionException;
import com.jiralert.model.AlertBatch;
import com.jiralert.model.ReceiverConfig;
import com.jiralert.model.enums.ReceiverType;
import org.springframework.util.StringUtils;

public class JiraIssueNotifierFactory implements NotifierFactory {

    private final JiraClient client;

    private final NotifierTemplate template;

    public JiraIssueNotifierFactory(JiraClient client, NotifierTemplate template) {
        this.client = client;
        this.template = template;
    }

    @Override
    public ReceiverType type() {
        return ReceiverType.JIRA;
    }

    @Override
    public Notifier create(ReceiverConfig receiver, AlertBatch batch) {
        if (!StringUtils.hasText(receiver.getApiUrl())
                || !StringUtils.hasText(receiver.getProject())
                || !StringUtils.hasText(receiver.getIssueType())) {
            throw new NotifierConstructionException("receiver " + receiver.getName()
                    + " requires api_url, project and issue_type");
        }
        String summary = template.renderSummary(receiver, batch);
        if (!StringUtils.hasText(summary)) {
            throw new NotifierConstructionException("summary template rendered empty for receiver " + receiver.getName());
        }
        return new JiraIssueNotifier(receiver, client, summary, template.renderDescription(receiver, batch));
    }
}
