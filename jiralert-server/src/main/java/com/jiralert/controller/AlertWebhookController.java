package com.jiralert.controller;

import com.jiralert.core.engine.AlertDispatcher;
import com.jiralert.model.ResponseEnvelope;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

/**
 * Alertmanager webhook 入口
 */
@RestController
@RequiredArgsConstructor
public class AlertWebhookController {

    private final AlertDispatcher dispatcher;

    private final AlertResponseWriter responseWriter;

    /**
     * 原始字节交给解码器, 格式错误统一返回 400 信封
     */
    @PostMapping("/alert")
    public ResponseEntity<ResponseEnvelope> alert(@RequestBody(required = false) byte[] body) {
        return responseWriter.write(dispatcher.dispatch(body));
    }
}
