package com.jiralert.core.metric;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.micrometer.prometheusmetrics.PrometheusConfig;
import io.micrometer.prometheusmetrics.PrometheusMeterRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("JiralertMetrics")
class JiralertMetricsTest {

    @Test
    @DisplayName("并发自增不丢失, 不同接收者互不影响")
    void concurrentIncrements() throws InterruptedException {
        JiralertMetrics metrics = JiralertMetrics.create(new SimpleMeterRegistry());
        int threads = 8;
        int perThread = 1_000;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        for (int t = 0; t < threads; t++) {
            String receiver = t % 2 == 0 ? "team-a" : "team-b";
            pool.execute(() -> {
                try {
                    start.await();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return;
                }
                for (int i = 0; i < perThread; i++) {
                    metrics.incRequest(receiver, 200);
                }
            });
        }
        start.countDown();
        pool.shutdown();
        assertThat(pool.awaitTermination(30, TimeUnit.SECONDS)).isTrue();

        assertThat(metrics.requestCount("team-a", 200)).isEqualTo(4_000.0);
        assertThat(metrics.requestCount("team-b", 200)).isEqualTo(4_000.0);
        assertThat(metrics.requestCount("team-a", 503)).isZero();
    }

    @Test
    @DisplayName("复合注册表把计数写入 Prometheus 暴露")
    void exposedThroughPrometheus() {
        PrometheusMeterRegistry prometheus = new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);
        SimpleMeterRegistry extra = new SimpleMeterRegistry();
        JiralertMeterRegistryProvider provider = new JiralertMeterRegistryProvider(prometheus, List.of(prometheus, extra));
        JiralertMetrics metrics = JiralertMetrics.create(provider.getRegistry());

        metrics.incRequest("<unknown>", 404);
        metrics.incRequest("team-a", 200);
        metrics.incRequest("team-a", 200);

        String scrape = prometheus.scrape();
        assertThat(scrape).contains("jiralert_requests_total{receiver=\"team-a\",status=\"200\"} 2.0");
        assertThat(scrape).contains("jiralert_requests_total{receiver=\"<unknown>\",status=\"404\"} 1.0");
        assertThat(extra.get(JiralertMetrics.REQUESTS).tag("receiver", "team-a").counter().count()).isEqualTo(2.0);
    }
}
