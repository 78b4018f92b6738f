package com.jiralert.core.serializer;

import com.jiralert.exception.DecodeException;
import com.jiralert.model.AlertBatch;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.nio.charset.StandardCharsets;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;

import static com.jiralert.support.AlertFixtures.webhookJson;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("JacksonAlertDecoder")
class JacksonAlertDecoderTest {

    private final JacksonAlertDecoder decoder = new JacksonAlertDecoder();

    private static byte[] bytes(String s) {
        return s.getBytes(StandardCharsets.UTF_8);
    }

    @Test
    @DisplayName("解码完整的 Alertmanager 负载")
    void decodesWebhook() {
        AlertBatch batch = decoder.decode(bytes(webhookJson("jira-ab", "firing", "resolved")));

        assertThat(batch.getReceiver()).isEqualTo("jira-ab");
        assertThat(batch.getVersion()).isEqualTo("4");
        assertThat(batch.getGroupLabels()).containsEntry("alertname", "A");
        assertThat(batch.getExternalURL()).isEqualTo("http://alertmanager:9093");
        assertThat(batch.getAlerts()).hasSize(2);
        assertThat(batch.getAlerts().get(0).isFiring()).isTrue();
        assertThat(batch.getAlerts().get(1).isFiring()).isFalse();
        assertThat(batch.getAlerts().get(0).getStartsAt())
                .isEqualTo(OffsetDateTime.of(2024, 5, 1, 10, 0, 0, 0, ZoneOffset.UTC));
    }

    @Test
    @DisplayName("忽略未知字段")
    void ignoresUnknownFields() {
        AlertBatch batch = decoder.decode(bytes("{\"receiver\":\"r\",\"truncatedAlerts\":0,\"alerts\":[{\"status\":\"firing\",\"extra\":1}]}"));

        assertThat(batch.getAlerts()).hasSize(1);
        assertThat(batch.getGroupLabels()).isEmpty();
    }

    @Test
    @DisplayName("空 body 视为解码失败")
    void emptyBody() {
        assertThatThrownBy(() -> decoder.decode(new byte[0]))
                .isInstanceOf(DecodeException.class)
                .hasMessageContaining("empty");
        assertThatThrownBy(() -> decoder.decode(null))
                .isInstanceOf(DecodeException.class);
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "{not json",
            "[1,2,3]",
            "null",
            "   ",
            "{\"alerts\":[]}",
            "{\"receiver\":42,\"alerts\":[]}",
            "{\"receiver\":\"r\"}",
            "{\"receiver\":\"r\",\"alerts\":{}}",
            "{\"receiver\":\"r\",\"alerts\":[\"x\"]}",
            "{\"receiver\":\"r\",\"alerts\":[{\"startsAt\":\"yesterday\"}]}"
    })
    @DisplayName("结构错误统一抛 DecodeException")
    void rejectsMalformed(String body) {
        assertThatThrownBy(() -> decoder.decode(bytes(body)))
                .isInstanceOf(DecodeException.class);
    }

    @Test
    @DisplayName("格式错误的 JSON 带上解析器原因")
    void malformedJsonMessage() {
        assertThatThrownBy(() -> decoder.decode(bytes("{\"receiver\":")))
                .isInstanceOf(DecodeException.class)
                .hasMessageStartingWith("malformed JSON: ");
    }
}
