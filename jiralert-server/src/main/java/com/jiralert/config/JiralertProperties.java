package com.jiralert.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * JIRAlert 配置（绑定前缀：jiralert）
 *
 * YAML 示例（通常放在 config/jiralert.yml, 由 application.yml 导入）：
 * jiralert:
 *   delivery:
 *     timeout: 10s
 *     executor:
 *       core-pool-size: 4
 *       max-pool-size: 16
 *       queue-capacity: 200
 *       keep-alive: 60s
 *   shutdown:
 *     await: 30s
 *   defaults:
 *     type: JIRA
 *     api-url: https://jira.example.com
 *     user: jiralert
 *     password: secret
 *     issue-type: Bug
 *     priority: Critical
 *     summary: "{{groupLabels.alertname}} ({{alerts.count}} firing)"
 *     description: "{{commonAnnotations.description:no description}}"
 *   receivers:
 *     - name: team-a
 *       project: OPS
 *       add-group-labels: true
 */
@Validated
@ConfigurationProperties(prefix = "jiralert")
public class JiralertProperties {

    @Valid
    private Delivery delivery = new Delivery();

    @Valid
    private Shutdown shutdown = new Shutdown();

    /** 所有接收者的默认值 */
    private ReceiverProperties defaults = new ReceiverProperties();

    private List<ReceiverProperties> receivers = new ArrayList<>();

    // ----------------- 嵌套配置对象 -----------------

    public static class Delivery {
        /** 单次投递超时, 超时后取消并按可重试处理 */
        @NotNull
        private Duration timeout = Duration.ofSeconds(10);

        private Exec executor = new Exec();

        public Duration getTimeout() { return timeout; }
        public void setTimeout(Duration timeout) { this.timeout = timeout; }
        public Exec getExecutor() { return executor; }
        public void setExecutor(Exec executor) { this.executor = executor; }
    }

    public static class Exec {
        private int corePoolSize = 4;

        private int maxPoolSize = 16;

        /** 任务队列容量 */
        private int queueCapacity = 200;

        /** 线程空闲存活时间 */
        private Duration keepAlive = Duration.ofSeconds(60);

        public int getCorePoolSize() { return corePoolSize; }
        public void setCorePoolSize(int corePoolSize) { this.corePoolSize = corePoolSize; }
        public int getMaxPoolSize() { return maxPoolSize; }
        public void setMaxPoolSize(int maxPoolSize) { this.maxPoolSize = maxPoolSize; }
        public int getQueueCapacity() { return queueCapacity; }
        public void setQueueCapacity(int queueCapacity) { this.queueCapacity = queueCapacity; }
        public Duration getKeepAlive() { return keepAlive; }
        public void setKeepAlive(Duration keepAlive) { this.keepAlive = keepAlive; }
    }

    public static class Shutdown {
        /** 优雅停机等待时长 */
        @NotNull
        private Duration await = Duration.ofSeconds(30);

        public Duration getAwait() { return await; }
        public void setAwait(Duration await) { this.await = await; }
    }

    // ----------------- getters/setters 顶层 -----------------

    public Delivery getDelivery() { return delivery; }
    public void setDelivery(Delivery delivery) { this.delivery = delivery; }

    public Shutdown getShutdown() { return shutdown; }
    public void setShutdown(Shutdown shutdown) { this.shutdown = shutdown; }

    public ReceiverProperties getDefaults() { return defaults; }
    public void setDefaults(ReceiverProperties defaults) { this.defaults = defaults; }

    public List<ReceiverProperties> getReceivers() { return receivers; }
    public void setReceivers(List<ReceiverProperties> receivers) { this.receivers = receivers; }
}
