package com.jiralert.controller;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import com.jiralert.core.engine.AlertDispatcher;
import com.jiralert.core.metric.JiralertMetrics;
import com.jiralert.core.notify.NotifierGateway;
import com.jiralert.core.notify.filter.FiringAlertFilter;
import com.jiralert.core.serializer.JacksonAlertDecoder;
import com.jiralert.core.spi.notify.ReceiverRouter;
import com.jiralert.exception.TrackerUnavailableException;
import com.jiralert.model.NotificationOutcome;
import com.jiralert.model.ReceiverConfig;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.util.List;
import java.util.Optional;

import static com.jiralert.support.AlertFixtures.jiraReceiver;
import static com.jiralert.support.AlertFixtures.webhookJson;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * POST /alert 端到端: 解码 → 路由 → 过滤 → 投递 → 响应信封 → 计数
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("POST /alert")
class AlertWebhookControllerTest {

    @Mock
    private ReceiverRouter router;

    @Mock
    private NotifierGateway gateway;

    private SimpleMeterRegistry registry;
    private JiralertMetrics metrics;
    private MockMvc mockMvc;

    private ListAppender<ILoggingEvent> appender;
    private final List<Logger> loggers = List.of(
            (Logger) LoggerFactory.getLogger(FiringAlertFilter.class),
            (Logger) LoggerFactory.getLogger(AlertResponseWriter.class));

    private final ReceiverConfig teamA = jiraReceiver("team-a");

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = JiralertMetrics.create(registry);
        AlertDispatcher dispatcher = new AlertDispatcher(new JacksonAlertDecoder(), router, new FiringAlertFilter(), gateway);
        mockMvc = MockMvcBuilders
                .standaloneSetup(new AlertWebhookController(dispatcher, new AlertResponseWriter(metrics)))
                .build();

        appender = new ListAppender<>();
        appender.start();
        loggers.forEach(l -> l.addAppender(appender));
    }

    @AfterEach
    void tearDown() {
        loggers.forEach(l -> l.detachAppender(appender));
        appender.stop();
    }

    private long warnings() {
        return appender.list.stream().filter(e -> e.getLevel() == Level.WARN).count();
    }

    private List<ILoggingEvent> errors() {
        return appender.list.stream().filter(e -> e.getLevel() == Level.ERROR).toList();
    }

    @Nested
    @DisplayName("成功路径")
    class Success {

        @Test
        @DisplayName("单条 firing 告警: 投递一次, 200 空消息")
        void singleFiring() throws Exception {
            given(router.resolve("team-a")).willReturn(Optional.of(teamA));
            given(gateway.notify(eq(teamA), any())).willReturn(NotificationOutcome.success());

            mockMvc.perform(post("/alert").contentType(MediaType.APPLICATION_JSON).content(webhookJson("team-a", "firing")))
                    .andExpect(status().isOk())
                    .andExpect(content().contentType(MediaType.APPLICATION_JSON))
                    .andExpect(content().json("{\"error\":false,\"status\":200,\"message\":\"\"}", true));

            verify(gateway).notify(eq(teamA), argThat(b -> b.getAlerts().size() == 1));
            assertThat(metrics.requestCount("team-a", 200)).isEqualTo(1.0);
            assertThat(errors()).isEmpty();
        }

        @Test
        @DisplayName("firing + resolved: WARN 一次, 只投递 firing")
        void mixedStatuses() throws Exception {
            given(router.resolve("team-a")).willReturn(Optional.of(teamA));
            given(gateway.notify(eq(teamA), any())).willReturn(NotificationOutcome.success());

            mockMvc.perform(post("/alert").contentType(MediaType.APPLICATION_JSON)
                            .content(webhookJson("team-a", "firing", "resolved")))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.error").value(false));

            verify(gateway).notify(eq(teamA), argThat(b -> b.getAlerts().size() == 1 && b.getAlerts().get(0).isFiring()));
            assertThat(warnings()).isEqualTo(1);
        }

        @Test
        @DisplayName("全部 resolved: 200, 不投递, WARN 一次")
        void allResolved() throws Exception {
            given(router.resolve("team-a")).willReturn(Optional.of(teamA));

            mockMvc.perform(post("/alert").contentType(MediaType.APPLICATION_JSON)
                            .content(webhookJson("team-a", "resolved", "resolved")))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.status").value(200));

            verify(gateway, never()).notify(any(), any());
            assertThat(warnings()).isEqualTo(1);
            assertThat(metrics.requestCount("team-a", 200)).isEqualTo(1.0);
        }

        @Test
        @DisplayName("N 次成功请求计数恰好 +N")
        void countsEveryRequest() throws Exception {
            given(router.resolve("team-a")).willReturn(Optional.of(teamA));
            given(gateway.notify(eq(teamA), any())).willReturn(NotificationOutcome.success());

            for (int i = 0; i < 5; i++) {
                mockMvc.perform(post("/alert").contentType(MediaType.APPLICATION_JSON).content(webhookJson("team-a", "firing")))
                        .andExpect(status().isOk());
            }

            assertThat(metrics.requestCount("team-a", 200)).isEqualTo(5.0);
        }
    }

    @Nested
    @DisplayName("失败路径")
    class Failure {

        @Test
        @DisplayName("未配置的接收者: 404, 计入 (<unknown>, 404)")
        void unknownReceiver() throws Exception {
            given(router.resolve("ghost-team")).willReturn(Optional.empty());

            mockMvc.perform(post("/alert").contentType(MediaType.APPLICATION_JSON).content(webhookJson("ghost-team", "firing")))
                    .andExpect(status().isNotFound())
                    .andExpect(content().json(
                            "{\"error\":true,\"status\":404,\"message\":\"receiver missing: ghost-team\"}", true));

            assertThat(metrics.requestCount("<unknown>", 404)).isEqualTo(1.0);
            assertThat(errors()).singleElement()
                    .satisfies(e -> assertThat(e.getFormattedMessage())
                            .contains("statusCode=404")
                            .contains("statusText=Not Found")
                            .contains("receiver=<unknown>")
                            .contains("groupLabels={alertname=A}"));
        }

        @Test
        @DisplayName("暂时性投递失败: 503, 计入 (receiver, 503)")
        void transientFailure() throws Exception {
            given(router.resolve("team-a")).willReturn(Optional.of(teamA));
            given(gateway.notify(eq(teamA), any()))
                    .willReturn(NotificationOutcome.failure(true, new TrackerUnavailableException(503, "jira responded 503", null)));

            mockMvc.perform(post("/alert").contentType(MediaType.APPLICATION_JSON).content(webhookJson("team-a", "firing")))
                    .andExpect(status().isServiceUnavailable())
                    .andExpect(jsonPath("$.error").value(true))
                    .andExpect(jsonPath("$.status").value(503))
                    .andExpect(jsonPath("$.message").value("jira responded 503"));

            assertThat(metrics.requestCount("team-a", 503)).isEqualTo(1.0);
            assertThat(metrics.requestCount("team-a", 200)).isZero();
        }

        @Test
        @DisplayName("空 body: 400, 不投递")
        void emptyBody() throws Exception {
            mockMvc.perform(post("/alert").contentType(MediaType.APPLICATION_JSON))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.error").value(true))
                    .andExpect(jsonPath("$.status").value(400));

            verify(gateway, never()).notify(any(), any());
            assertThat(metrics.requestCount("<unknown>", 400)).isEqualTo(1.0);
        }

        @Test
        @DisplayName("非法 JSON: 400, 诊断中分组标签为空")
        void malformedBody() throws Exception {
            mockMvc.perform(post("/alert").contentType(MediaType.APPLICATION_JSON).content("{\"receiver\": "))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.message").value(org.hamcrest.Matchers.startsWith("malformed JSON")));

            verify(gateway, never()).notify(any(), any());
            assertThat(errors()).singleElement()
                    .satisfies(e -> assertThat(e.getFormattedMessage()).contains("groupLabels={}"));
        }
    }
}
