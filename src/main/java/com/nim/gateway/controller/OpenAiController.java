package com.nim.gateway.controller;

import com.alibaba.fastjson2.JSON;
import com.alibaba.fastjson2.JSONArray;
import com.alibaba.fastjson2.JSONException;
import com.alibaba.fastjson2.JSONObject;
import com.alibaba.fastjson2.JSONWriter;
import com.nim.gateway.config.AppProperties;
import com.nim.gateway.exception.ConfigurationException;
import com.nim.gateway.exception.InvalidRequestException;
import com.nim.gateway.exception.NimGatewayException;
import com.nim.gateway.model.ModelCatalog;
import com.nim.gateway.proxy.NimApiClient;
import com.nim.gateway.proxy.SseRelay;
import com.nim.gateway.stream.StreamRewriter;
import com.nim.gateway.trace.TraceContext;
import com.nim.gateway.trace.TraceFilter;
import com.nim.gateway.translator.ChatRequestTranslator;
import com.nim.gateway.translator.ChatResponseTranslator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.buffer.DataBuffer;
import org.springframework.core.io.buffer.DataBufferFactory;
import org.springframework.http.MediaType;
import org.springframework.http.server.reactive.ServerHttpResponse;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ServerWebExchange;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.nio.charset.StandardCharsets;

/**
 * OpenAI 兼容 API 端点
 * <p>
 * POST /v1/chat/completions — 流式 + 非流式
 * GET  /v1/models            — 模型列表
 */
@RestController
@RequestMapping("/v1")
public class OpenAiController {

    private static final Logger log = LoggerFactory.getLogger(OpenAiController.class);

    private static final long MODEL_CREATED = 1700000000L;

    private final AppProperties properties;
    private final ModelCatalog modelCatalog;
    private final ChatRequestTranslator requestTranslator;
    private final ChatResponseTranslator responseTranslator;
    private final NimApiClient nimClient;
    private final SseRelay sseRelay;

    public OpenAiController(AppProperties properties, ModelCatalog modelCatalog,
                            ChatRequestTranslator requestTranslator, ChatResponseTranslator responseTranslator,
                            NimApiClient nimClient, SseRelay sseRelay) {
        this.properties = properties;
        this.modelCatalog = modelCatalog;
        this.requestTranslator = requestTranslator;
        this.responseTranslator = responseTranslator;
        this.nimClient = nimClient;
        this.sseRelay = sseRelay;
    }

    /**
     * POST /v1/chat/completions
     */
    @PostMapping(value = "/chat/completions")
    public Mono<Void> chatCompletions(@RequestBody(required = false) String body, ServerWebExchange exchange) {
        TraceContext traceCtx = TraceFilter.getTraceContext(exchange);
        if (!properties.hasApiKey()) {
            traceCtx.recordStatus(500);
            throw new ConfigurationException("NIM_API_KEY environment variable not set");
        }

        JSONObject request = parseRequest(body);
        ChatRequestTranslator.TranslateResult translated = requestTranslator.translate(request);
        traceCtx.recordModel(translated.requestedModel(), translated.nimModel(), translated.stream());

        Mono<Void> result = translated.stream()
                ? streamResponse(translated, traceCtx, exchange)
                : nonStreamResponse(translated, exchange);
        return result.doOnError(e -> traceCtx.recordStatus(
                e instanceof NimGatewayException gatewayError ? gatewayError.getStatusCode() : 500));
    }

    /**
     * GET /v1/models
     */
    @GetMapping(value = "/models", produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<String> listModels() {
        JSONArray data = new JSONArray();
        for (String id : modelCatalog.listAliases()) {
            data.add(JSONObject.of(
                    "id", id, //
                    "object", "model", //
                    "created", MODEL_CREATED, //
                    "owned_by", "nvidia-nim-proxy" //
            ));
        }
        return Mono.just(JSONObject.of("object", "list", "data", data).toJSONString());
    }

    // ==================== 流式响应 ====================

    private Mono<Void> streamResponse(ChatRequestTranslator.TranslateResult translated,
                                      TraceContext traceCtx, ServerWebExchange exchange) {
        // 上游返回 2xx 之前不写任何响应头，错误仍可以 JSON 形式返回
        return Mono.fromCallable(() -> nimClient.openStream(translated.body()))
                .subscribeOn(Schedulers.boundedElastic())
                .flatMap(upstream -> {
                    ServerHttpResponse response = exchange.getResponse();
                    response.getHeaders().setContentType(MediaType.TEXT_EVENT_STREAM);
                    response.getHeaders().setCacheControl("no-cache");
                    response.getHeaders().set("Connection", "keep-alive");
                    response.getHeaders().set("X-Accel-Buffering", "no");

                    StreamRewriter rewriter = new StreamRewriter(translated.requestedModel(), properties.isShowReasoning());
                    Flux<byte[]> records = sseRelay.relay(upstream, rewriter, traceCtx.traceId());

                    DataBufferFactory bufferFactory = response.bufferFactory();
                    return response.writeAndFlushWith(
                            records.map(bytes -> Mono.just(bufferFactory.wrap(bytes)))
                    );
                });
    }

    // ==================== 非流式响应 ====================

    private Mono<Void> nonStreamResponse(ChatRequestTranslator.TranslateResult translated, ServerWebExchange exchange) {
        return Mono.fromCallable(() -> nimClient.complete(translated.body()))
                .subscribeOn(Schedulers.boundedElastic())
                .map(upstream -> responseTranslator.toOpenAiResponse(upstream, translated.requestedModel())
                        .toJSONString(JSONWriter.Feature.WriteNulls))
                .flatMap(json -> {
                    ServerHttpResponse response = exchange.getResponse();
                    response.getHeaders().setContentType(MediaType.APPLICATION_JSON);
                    byte[] bytes = json.getBytes(StandardCharsets.UTF_8);
                    response.getHeaders().setContentLength(bytes.length);
                    DataBuffer buffer = response.bufferFactory().wrap(bytes);
                    return response.writeWith(Mono.just(buffer));
                });
    }

    private JSONObject parseRequest(String body) {
        if (body == null || body.isBlank()) {
            throw new InvalidRequestException("Request body is required");
        }
        try {
            JSONObject request = JSON.parseObject(body);
            if (request == null) {
                throw new InvalidRequestException("Request body must be a JSON object");
            }
            return request;
        } catch (JSONException e) {
            log.debug("请求体解析失败: {}", e.getMessage());
            throw new InvalidRequestException("Invalid JSON in request body", e);
        }
    }
}
