package com.jiralert.core.engine;

import com.jiralert.core.spi.PayloadDecoder;
import com.jiralert.core.spi.notify.AlertFilter;
import com.jiralert.core.spi.notify.ReceiverRouter;
import com.jiralert.core.notify.NotifierGateway;
import com.jiralert.exception.DecodeException;
import com.jiralert.model.AlertBatch;
import com.jiralert.model.NotificationOutcome;
import com.jiralert.model.ReceiverConfig;
import com.jiralert.model.ctx.DispatchResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;

import java.util.Map;
import java.util.Optional;

/**
 * 告警派发流水线
 * decode → route → filter → notify → classify, 任一阶段失败立即短路
 * 每个请求至多投递一次, 重试交给上游（503）
 */
public class AlertDispatcher {

    private static final Logger log = LoggerFactory.getLogger(AlertDispatcher.class);

    private final PayloadDecoder decoder;

    private final ReceiverRouter router;

    private final AlertFilter filter;

    private final NotifierGateway gateway;

    public AlertDispatcher(PayloadDecoder decoder, ReceiverRouter router, AlertFilter filter, NotifierGateway gateway) {
        this.decoder = decoder;
        this.router = router;
        this.filter = filter;
        this.gateway = gateway;
    }

    public DispatchResult dispatch(byte[] body) {
        log.debug("[Dispatch] handling /alert webhook request");

        AlertBatch batch;
        try {
            batch = decoder.decode(body);
        } catch (DecodeException e) {
            return DispatchResult.failed(HttpStatus.BAD_REQUEST, e.getMessage(), DispatchResult.UNKNOWN_RECEIVER, Map.of());
        }

        Map<String, String> groupLabels = batch.getGroupLabels();
        Optional<ReceiverConfig> resolved = router.resolve(batch.getReceiver());
        if (resolved.isEmpty()) {
            return DispatchResult.failed(HttpStatus.NOT_FOUND, "receiver missing: " + batch.getReceiver(),
                    DispatchResult.UNKNOWN_RECEIVER, groupLabels);
        }
        ReceiverConfig receiver = resolved.get();
        log.debug("[Dispatch] matched receiver={}", receiver.getName());

        try {
            AlertBatch firing = filter.filter(batch);
            if (firing.getAlerts().isEmpty()) {
                log.debug("[Dispatch] no firing alerts, receiver={}", receiver.getName());
                return DispatchResult.ok(receiver.getName(), groupLabels);
            }

            NotificationOutcome outcome = gateway.notify(receiver, firing);
            if (outcome.isSuccess()) {
                return DispatchResult.ok(receiver.getName(), groupLabels);
            }
            HttpStatus status = outcome.isRetryable() ? HttpStatus.SERVICE_UNAVAILABLE : HttpStatus.INTERNAL_SERVER_ERROR;
            return DispatchResult.failed(status, outcome.message(), receiver.getName(), groupLabels);
        } catch (RuntimeException e) {
            // 流水线内部故障
            log.error("[Dispatch] unexpected error, receiver={}", receiver.getName(), e);
            return DispatchResult.failed(HttpStatus.INTERNAL_SERVER_ERROR, e.getMessage(), receiver.getName(), groupLabels);
        }
    }
}
