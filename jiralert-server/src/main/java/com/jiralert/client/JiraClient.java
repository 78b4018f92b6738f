package com.jiralert.client;

import com.jiralert.exception.TrackerRejectedException;
import com.jiralert.exception.TrackerUnavailableException;
import com.jiralert.model.ReceiverConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.util.StringUtils;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientResponseException;

import java.util.Map;

/**
 * Jira REST v2 客户端, 只负责创建工单
 * 5xx/429 → TrackerUnavailableException, 其余 4xx → TrackerRejectedException,
 * 网络异常以 ResourceAccessException 原样抛出
 */
public class JiraClient {

    private static final Logger log = LoggerFactory.getLogger(JiraClient.class);

    private static final String CREATE_ISSUE_PATH = "/rest/api/2/issue";

    private static final int MAX_BODY_LEN = 1000;

    private final RestClient restClient;

    public JiraClient(RestClient.Builder restClientBuilder) {
        this.restClient = restClientBuilder.build();
    }

    public JiraIssueRef createIssue(ReceiverConfig receiver, Map<String, Object> fields) {
        String url = trimTrailingSlash(receiver.getApiUrl()) + CREATE_ISSUE_PATH;
        try {
            JiraIssueRef ref = restClient.post()
                    .uri(url)
                    .contentType(MediaType.APPLICATION_JSON)
                    .accept(MediaType.APPLICATION_JSON)
                    .headers(h -> {
                        if (StringUtils.hasText(receiver.getUser())) {
                            h.setBasicAuth(receiver.getUser(), receiver.getPassword() == null ? "" : receiver.getPassword());
                        }
                    })
                    .body(Map.of("fields", fields))
                    .retrieve()
                    .body(JiraIssueRef.class);
            log.debug("[Jira] issue created, receiver={}, key={}", receiver.getName(), ref == null ? null : ref.key());
            return ref;
        } catch (RestClientResponseException e) {
            int code = e.getStatusCode().value();
            String msg = "jira responded " + code + " for receiver " + receiver.getName() + ": " + truncate(e.getResponseBodyAsString());
            if (code >= 500 || code == 429) {
                throw new TrackerUnavailableException(code, msg, e);
            }
            throw new TrackerRejectedException(code, msg, e);
        }
    }

    private static String trimTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }

    private static String truncate(String s) {
        if (s == null) return "";
        return s.length() > MAX_BODY_LEN ? s.substring(0, MAX_BODY_LEN) : s;
    }
}
