package com.jiralert.config;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.jiralert.exception.ConfigurationException;
import com.jiralert.model.ReceiverConfig;
import com.jiralert.model.enums.ReceiverType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.StringUtils;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * 接收者配置中心
 * 启动时合并 defaults 并校验, 之后以不可变快照提供并发只读访问
 */
public class ReceiverRegistry {

    private static final Logger log = LoggerFactory.getLogger(ReceiverRegistry.class);

    static final String SECRET = "<secret>";

    private final ObjectMapper displayMapper = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT)
            .setSerializationInclusion(JsonInclude.Include.NON_NULL);

    private final AtomicReference<Snapshot> current;

    public ReceiverRegistry(JiralertProperties props) {
        this.current = new AtomicReference<>(build(props));
    }

    /**
     * 按名精确查找, 不存在返回 null
     */
    public ReceiverConfig receiverByName(String name) {
        if (name == null) {
            return null;
        }
        return current.get().receivers().get(name);
    }

    public Collection<ReceiverConfig> receivers() {
        return current.get().receivers().values();
    }

    /**
     * 整体替换快照, 在途请求仍看到旧版本
     * 重载扩展点：进程内不会自动调用, 供外部重新绑定配置后使用; 校验失败时保留旧快照
     */
    public void replace(JiralertProperties props) {
        Snapshot next = build(props);
        current.set(next);
        log.info("[Config] receiver snapshot replaced, receivers={}", next.receivers().keySet());
    }

    /**
     * 供 /config 页面展示, 密码脱敏
     */
    public String toDisplayString() {
        Map<String, Object> view = new LinkedHashMap<>();
        view.put("receivers", receivers().stream().map(ReceiverRegistry::redact).toList());
        try {
            return displayMapper.writeValueAsString(view);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to render configuration", e);
        }
    }

    private static Map<String, Object> redact(ReceiverConfig r) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("name", r.getName());
        m.put("type", r.getType());
        m.put("api_url", r.getApiUrl());
        m.put("user", r.getUser());
        m.put("password", StringUtils.hasText(r.getPassword()) ? SECRET : null);
        m.put("project", r.getProject());
        m.put("issue_type", r.getIssueType());
        m.put("summary", r.getSummary());
        m.put("description", r.getDescription());
        m.put("priority", r.getPriority());
        m.put("labels", r.getLabels().isEmpty() ? null : r.getLabels());
        m.put("fields", r.getFields().isEmpty() ? null : r.getFields());
        m.put("add_group_labels", r.isAddGroupLabels());
        return m;
    }

    // ----------------- 合并与校验 -----------------

    static Snapshot build(JiralertProperties props) {
        ReceiverProperties defaults = Optional.ofNullable(props.getDefaults()).orElseGet(ReceiverProperties::new);
        List<ReceiverProperties> raw = Optional.ofNullable(props.getReceivers()).orElse(List.of());

        Map<String, ReceiverConfig> receivers = new LinkedHashMap<>();
        for (int i = 0; i < raw.size(); i++) {
            ReceiverConfig rc = merge(raw.get(i), defaults);
            if (!StringUtils.hasText(rc.getName())) {
                throw new ConfigurationException("missing name for receiver at index " + i);
            }
            if (receivers.containsKey(rc.getName())) {
                throw new ConfigurationException("duplicate receiver name: " + rc.getName());
            }
            validate(rc);
            receivers.put(rc.getName(), rc);
        }
        if (receivers.isEmpty()) {
            log.warn("[Config] no receivers configured, every alert will be answered with 404");
        }
        return new Snapshot(Collections.unmodifiableMap(receivers));
    }

    private static ReceiverConfig merge(ReceiverProperties r, ReceiverProperties d) {
        return ReceiverConfig.builder()
                .name(r.getName())
                .type(pick(r.getType(), d.getType(), ReceiverType.JIRA))
                .apiUrl(pick(r.getApiUrl(), d.getApiUrl(), null))
                .user(pick(r.getUser(), d.getUser(), null))
                .password(pick(r.getPassword(), d.getPassword(), null))
                .project(pick(r.getProject(), d.getProject(), null))
                .issueType(pick(r.getIssueType(), d.getIssueType(), null))
                .summary(pick(r.getSummary(), d.getSummary(), null))
                .description(pick(r.getDescription(), d.getDescription(), null))
                .priority(pick(r.getPriority(), d.getPriority(), null))
                .labels(List.copyOf(pick(r.getLabels(), d.getLabels(), List.of())))
                .fields(Collections.unmodifiableMap(new LinkedHashMap<>(pick(r.getFields(), d.getFields(), Map.of()))))
                .addGroupLabels(pick(r.getAddGroupLabels(), d.getAddGroupLabels(), Boolean.FALSE))
                .build();
    }

    private static void validate(ReceiverConfig rc) {
        if (rc.getType() != ReceiverType.JIRA) {
            return;
        }
        requireText(rc, "api_url", rc.getApiUrl());
        requireText(rc, "project", rc.getProject());
        requireText(rc, "issue_type", rc.getIssueType());
        requireText(rc, "summary", rc.getSummary());
    }

    private static void requireText(ReceiverConfig rc, String key, String value) {
        if (!StringUtils.hasText(value)) {
            throw new ConfigurationException("missing " + key + " in receiver " + rc.getName());
        }
    }

    private static <T> T pick(T own, T fallback, T def) {
        if (own != null) return own;
        if (fallback != null) return fallback;
        return def;
    }

    record Snapshot(Map<String, ReceiverConfig> receivers) {
    }
}
