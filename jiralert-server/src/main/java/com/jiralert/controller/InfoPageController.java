package com.jiralert.controller;

import com.jiralert.config.ReceiverRegistry;
import lombok.RequiredArgsConstructor;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.util.HtmlUtils;

/**
 * 首页与配置页
 */
@RestController
@RequiredArgsConstructor
public class InfoPageController {

    private static final String PAGE = """
            <!DOCTYPE html>
            <html>
            <head><meta charset="UTF-8"><title>JIRAlert</title></head>
            <body>
            <h1>JIRAlert</h1>
            <p><a href="/">Home</a> | <a href="/config">Config</a> | <a href="/metrics">Metrics</a> | <a href="/healthz">Health</a></p>
            %s
            </body>
            </html>
            """;

    private final ReceiverRegistry registry;

    @GetMapping(value = "/", produces = MediaType.TEXT_HTML_VALUE)
    public String home() {
        return PAGE.formatted("<p>Alertmanager webhook bridge. POST alert batches to <code>/alert</code>.</p>");
    }

    @GetMapping(value = "/config", produces = MediaType.TEXT_HTML_VALUE)
    public String config() {
        return PAGE.formatted("<h2>Configuration</h2>\n<pre>" + HtmlUtils.htmlEscape(registry.toDisplayString()) + "</pre>");
    }
}
