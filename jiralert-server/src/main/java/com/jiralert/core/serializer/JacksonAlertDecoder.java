package com.jiralert.core.serializer;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.jiralert.core.spi.PayloadDecoder;
import com.jiralert.exception.DecodeException;
import com.jiralert.model.AlertBatch;

import java.io.IOException;

/**
 * Alertmanager webhook 负载解码
 */
public class JacksonAlertDecoder implements PayloadDecoder {

    private final ObjectMapper mapper;

    /** 使用推荐的默认配置构造 */
    public JacksonAlertDecoder() {
        this(createDefaultMapper());
    }

    /** 允许外部传入自定义 ObjectMapper */
    public JacksonAlertDecoder(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    @Override
    public AlertBatch decode(byte[] body) {
        if (body == null || body.length == 0) {
            throw new DecodeException("empty request body");
        }
        JsonNode root;
        try {
            root = mapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new DecodeException("malformed JSON: " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new DecodeException("unreadable request body", e);
        }
        // 空白字符或字面量 null
        if (root == null || root.isMissingNode() || root.isNull()) {
            throw new DecodeException("empty request body");
        }
        if (!root.isObject()) {
            throw new DecodeException("expected a JSON object, got " + root.getNodeType());
        }
        if (!root.path("receiver").isTextual()) {
            throw new DecodeException("missing or non-string field: receiver");
        }
        if (!root.path("alerts").isArray()) {
            throw new DecodeException("missing or non-array field: alerts");
        }
        for (JsonNode alert : root.path("alerts")) {
            if (!alert.isObject()) {
                throw new DecodeException("every entry of alerts must be a JSON object");
            }
        }
        try {
            return mapper.treeToValue(root, AlertBatch.class);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new DecodeException("invalid alert payload: " + e.getMessage(), e);
        }
    }

    private static ObjectMapper createDefaultMapper() {
        ObjectMapper m = new ObjectMapper();
        // 反序列化忽略未知字段，兼容新版本 Alertmanager
        m.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        // 自动发现（JSR310 等）
        m.findAndRegisterModules();
        return m;
    }
}
