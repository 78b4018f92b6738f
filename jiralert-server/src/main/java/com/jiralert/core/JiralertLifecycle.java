package com.jiralert.core;

import com.jiralert.config.JiralertProperties;
import com.jiralert.config.ReceiverRegistry;
import com.jiralert.model.ReceiverConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 启动时打印配置摘要, 停机时等待在途投递完成
 */
public class JiralertLifecycle implements SmartLifecycle {

    private static final Logger log = LoggerFactory.getLogger(JiralertLifecycle.class);

    private final ReceiverRegistry registry;

    private final JiralertProperties props;

    private final ExecutorService deliveryExecutor;

    private final AtomicBoolean running = new AtomicBoolean(false);

    public JiralertLifecycle(ReceiverRegistry registry, JiralertProperties props, ExecutorService deliveryExecutor) {
        this.registry = registry;
        this.props = props;
        this.deliveryExecutor = deliveryExecutor;
    }

    @Override
    public void start() {
        if (!running.compareAndSet(false, true)) {
            return;
        }
        log.info("[JIRAlert] starting, receivers={}, delivery.timeout={} ms, executor.core={}, executor.max={}, executor.queue={}",
                registry.receivers().size(),
                props.getDelivery().getTimeout().toMillis(),
                props.getDelivery().getExecutor().getCorePoolSize(),
                props.getDelivery().getExecutor().getMaxPoolSize(),
                props.getDelivery().getExecutor().getQueueCapacity());
        for (ReceiverConfig r : registry.receivers()) {
            log.info("[JIRAlert] receiver name={}, type={}, project={}, issueType={}",
                    r.getName(), r.getType(), r.getProject(), r.getIssueType());
        }
    }

    @Override
    public void stop() {
        if (!running.compareAndSet(true, false)) {
            log.info("[JIRAlert] stop skipped: already stopped");
            return;
        }
        long awaitMs = Math.max(1, props.getShutdown().getAwait().toMillis());
        log.info("[JIRAlert] stopping, waiting up to {} ms for in-flight deliveries", awaitMs);
        // 停止接受新投递, 等待在途完成
        deliveryExecutor.shutdown();
        try {
            if (!deliveryExecutor.awaitTermination(awaitMs, TimeUnit.MILLISECONDS)) {
                deliveryExecutor.shutdownNow();
                log.warn("[JIRAlert] delivery executor forced shutdown after {} ms", awaitMs);
            }
        } catch (InterruptedException ie) {
            deliveryExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("[JIRAlert] stopped");
    }

    @Override
    public boolean isRunning() {
        return running.get();
    }

    @Override public boolean isAutoStartup() { return true; }
}
