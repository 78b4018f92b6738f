package com.jiralert.core.metric;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;

/**
 * 请求计数, 按 (receiver, status) 分桶
 * Micrometer 按 id 缓存 Counter, 并发自增无锁
 */
public final class JiralertMetrics {

    public static final String REQUESTS = "jiralert.requests";

    private final MeterRegistry reg;

    private JiralertMetrics(MeterRegistry reg) {
        this.reg = reg;
    }

    public static JiralertMetrics create(MeterRegistry reg) { return new JiralertMetrics(reg); }

    public void incRequest(String receiver, int status) {
        requests(receiver, status).increment();
    }

    public double requestCount(String receiver, int status) {
        return requests(receiver, status).count();
    }

    private Counter requests(String receiver, int status) {
        return Counter.builder(REQUESTS)
                .description("Requests processed, by receiver and status code")
                .tag("receiver", receiver)
                .tag("status", String.valueOf(status))
                .register(reg);
    }
}
