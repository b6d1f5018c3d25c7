package com.nim.gateway.controller;

import com.alibaba.fastjson2.JSONObject;
import com.nim.gateway.config.AppProperties;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

/**
 * 健康检查端点
 */
@RestController
public class HealthController {

    private final AppProperties properties;

    public HealthController(AppProperties properties) {
        this.properties = properties;
    }

    @GetMapping(value = "/health", produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<String> health() {
        JSONObject result = new JSONObject();
        result.put("status", "ok");
        result.put("service", "OpenAI → NVIDIA NIM Proxy");
        result.put("reasoning_display", properties.isShowReasoning());
        result.put("thinking_mode", properties.isEnableThinkingMode());
        result.put("nim_base", properties.getApiBase());
        result.put("api_key_set", properties.hasApiKey());
        return Mono.just(result.toJSONString());
    }
}
