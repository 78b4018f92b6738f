package com.jiralert.client;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Jira 创建工单的返回
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record JiraIssueRef(String id, String key, String self) {
}
