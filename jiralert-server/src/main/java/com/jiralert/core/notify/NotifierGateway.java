package com.jiralert.core.notify;

import com.jiralert.core.handler.GuardedDeliveryExecutor;
import com.jiralert.core.spi.failure.FailureClassifier;
import com.jiralert.core.spi.notify.Notifier;
import com.jiralert.core.spi.notify.NotifierFactory;
import com.jiralert.exception.NotifierConstructionException;
import com.jiralert.exception.guard.DownstreamBulkheadFullException;
import com.jiralert.model.AlertBatch;
import com.jiralert.model.NotificationOutcome;
import com.jiralert.model.ReceiverConfig;
import com.jiralert.model.enums.ReceiverType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * 投递网关
 * 按接收者类型构造 Notifier, 在投递线程池中带超时执行, 失败交给 FailureClassifier 判定
 * 构造失败与投递失败走同一个 NotificationOutcome 通道
 */
public class NotifierGateway {

    private static final Logger log = LoggerFactory.getLogger(NotifierGateway.class);

    private final Map<ReceiverType, NotifierFactory> factories = new EnumMap<>(ReceiverType.class);

    /** 投递线程池 */
    private final ExecutorService deliveryExecutor;

    /** RL/BH/CB 保护 */
    private final GuardedDeliveryExecutor guard;

    /** 失败分类器 */
    private final FailureClassifier classifier;

    /** 单次投递超时 */
    private final Duration timeout;

    public NotifierGateway(List<NotifierFactory> factories,
                           ExecutorService deliveryExecutor,
                           GuardedDeliveryExecutor guard,
                           FailureClassifier classifier,
                           Duration timeout) {
        factories.forEach(f -> this.factories.put(f.type(), f));
        this.deliveryExecutor = deliveryExecutor;
        this.guard = guard;
        this.classifier = classifier;
        this.timeout = timeout;
    }

    public NotificationOutcome notify(ReceiverConfig receiver, AlertBatch batch) {
        Notifier notifier;
        try {
            notifier = construct(receiver, batch);
        } catch (RuntimeException e) {
            return failed(receiver, "construct", e);
        }

        Future<?> f;
        try {
            f = deliveryExecutor.submit(() -> guard.execute(receiver.getName(), () -> notifier.notify(batch)));
        } catch (RejectedExecutionException rejected) {
            // 投递线程池已满 → 可重试
            return failed(receiver, notifier.name(), new DownstreamBulkheadFullException(receiver.getName(), rejected));
        }

        // 执行 with 超时
        try {
            f.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            return NotificationOutcome.success();
        } catch (TimeoutException te) {
            // 中断投递线程, 不让外部调用无限挂起
            f.cancel(true);
            return failed(receiver, notifier.name(),
                    new TimeoutException("delivery to receiver " + receiver.getName() + " timed out after " + timeout.toMillis() + " ms"));
        } catch (ExecutionException ee) {
            return failed(receiver, notifier.name(), ee.getCause() == null ? ee : ee.getCause());
        } catch (InterruptedException ie) {
            // 请求线程被中断, 投递一并取消
            f.cancel(true);
            Thread.currentThread().interrupt();
            return failed(receiver, notifier.name(), ie);
        }
    }

    private Notifier construct(ReceiverConfig receiver, AlertBatch batch) {
        NotifierFactory factory = factories.get(receiver.getType());
        if (factory == null) {
            throw new NotifierConstructionException("no notifier registered for receiver type " + receiver.getType());
        }
        return factory.create(receiver, batch);
    }

    private NotificationOutcome failed(ReceiverConfig receiver, String stage, Throwable cause) {
        FailureClassifier.Classification c = classifier.classify(cause);
        log.warn("[Notify] receiver={}, channel={}, classification={}, err={}",
                receiver.getName(), stage, c, cause.toString());
        return NotificationOutcome.failure(c.isRetryable(), cause);
    }
}
