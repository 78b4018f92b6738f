package com.jiralert.model;

import com.jiralert.model.enums.ReceiverType;
import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * 合并 defaults 后的接收者配置, 进程生命周期内只读
 */
@Value
@Builder(toBuilder = true)
public class ReceiverConfig {

    String name;

    ReceiverType type;

    String apiUrl;

    String user;

    String password;

    String project;

    String issueType;

    /** 摘要模板 */
    String summary;

    /** 描述模板 */
    String description;

    String priority;

    @Builder.Default
    List<String> labels = List.of();

    /** 额外字段, 原样写入 Jira fields */
    @Builder.Default
    Map<String, Object> fields = Map.of();

    boolean addGroupLabels;
}
