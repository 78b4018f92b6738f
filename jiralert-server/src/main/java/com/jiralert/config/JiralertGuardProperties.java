package com.jiralert.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.Map;

/**
 * jiralert:
 *   guard:
 *     enabled: true
 *     circuit-breaker:
 *       failure-rate-threshold: 60
 *       slow-call-duration-threshold: 5s
 *       sliding-window-size: 50
 *       wait-duration-in-open-state: 30s
 *     bulkhead:
 *       enabled: true
 *       max-concurrent-calls: 20
 *       max-wait-duration: 0ms
 *     rate-limiter:
 *       enabled: true
 *       limit-for-period: 10
 *       limit-refresh-period: 1s
 *       timeout-duration: 100ms
 *     cb-per-receiver:
 *       jira-ops: { failure-rate-threshold: 30, wait-duration-in-open-state: 10s }
 */
@Data
@ConfigurationProperties(prefix = "jiralert.guard")
public class JiralertGuardProperties {
    /** 总开关 */
    private boolean enabled = true;

    /** 默认配置（可被接收者覆盖） */
    private CbConfig circuitBreaker = new CbConfig();
    private BhConfig bulkhead = new BhConfig();
    private RlConfig rateLimiter = new RlConfig();

    /** 按接收者名覆盖 */
    private Map<String, CbConfig> cbPerReceiver;
    private Map<String, BhConfig> bhPerReceiver;
    private Map<String, RlConfig> rlPerReceiver;

    @Data
    public static class CbConfig {
        private boolean enabled = true;
        private float failureRateThreshold = 50f;
        private float slowCallRateThreshold = 100f;
        private Duration slowCallDurationThreshold = Duration.ofSeconds(5);
        private int slidingWindowSize = 50;
        private int minimumNumberOfCalls = 20;
        private Duration waitDurationInOpenState = Duration.ofSeconds(30);
        private int permittedNumberOfCallsInHalfOpenState = 5;
    }

    @Data
    public static class BhConfig {
        private boolean enabled = false;
        private int maxConcurrentCalls = 20;
        // 0=非阻塞
        private Duration maxWaitDuration = Duration.ofMillis(0);
    }

    @Data
    public static class RlConfig {
        private boolean enabled = false;
        // 每个窗口许可数
        private int limitForPeriod = 10;
        private Duration limitRefreshPeriod = Duration.ofSeconds(1);
        // 获取许可最大等待
        private Duration timeoutDuration = Duration.ofMillis(100);
    }
}
