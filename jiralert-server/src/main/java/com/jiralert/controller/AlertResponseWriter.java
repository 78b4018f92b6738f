package com.jiralert.controller;

import com.jiralert.core.metric.JiralertMetrics;
import com.jiralert.model.ResponseEnvelope;
import com.jiralert.model.ctx.DispatchResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;

/**
 * 把派发结论写成 JSON 信封, 非 200 打 ERROR 诊断, 最后计数一次
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AlertResponseWriter {

    private final JiralertMetrics metrics;

    public ResponseEntity<ResponseEnvelope> write(DispatchResult result) {
        int status = result.getStatus().value();
        ResponseEnvelope envelope = new ResponseEnvelope(result.isError(), status, result.getMessage());
        if (result.isError()) {
            log.error("[Response] error handling request, statusCode={}, statusText={}, err={}, receiver={}, groupLabels={}",
                    status, result.getStatus().getReasonPhrase(), result.getMessage(),
                    result.getReceiver(), result.getGroupLabels());
        }
        ResponseEntity<ResponseEnvelope> response = ResponseEntity.status(status)
                .contentType(MediaType.APPLICATION_JSON)
                .body(envelope);
        metrics.incRequest(result.getReceiver(), status);
        return response;
    }
}
