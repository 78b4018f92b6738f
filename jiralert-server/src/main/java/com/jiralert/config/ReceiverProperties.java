package com.jiralert.config;

import com.jiralert.model.enums.ReceiverType;
import lombok.Data;

import java.util.List;
import java.util.Map;

/**
 * 单个接收者的原始配置, 未设置的项从 defaults 继承
 */
@Data
public class ReceiverProperties {

    private String name;

    private ReceiverType type;

    /** Jira 地址, 如 https://jira.example.com */
    private String apiUrl;

    private String user;

    private String password;

    private String project;

    private String issueType;

    private String summary;

    private String description;

    private String priority;

    private List<String> labels;

    private Map<String, Object> fields;

    /** 是否把 groupLabels 作为工单标签 */
    private Boolean addGroupLabels;
}
