package com.nim.gateway.proxy;

import com.alibaba.fastjson2.JSON;
import com.alibaba.fastjson2.JSONException;
import com.alibaba.fastjson2.JSONObject;
import com.nim.gateway.config.AppProperties;
import com.nim.gateway.exception.NimApiException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;

/**
 * NIM API 客户端
 * <p>
 * 单次调用，不重试；非 2xx 响应和网络异常统一转为 {@link NimApiException}
 */
@Component
public class NimApiClient {

    private static final Logger log = LoggerFactory.getLogger(NimApiClient.class);

    private final HttpClient httpClient;
    private final AppProperties properties;

    public NimApiClient(HttpClient nimHttpClient, AppProperties properties) {
        this.httpClient = nimHttpClient;
        this.properties = properties;
    }

    /**
     * 调用 NIM API（非流式）
     *
     * @param body NIM 请求体
     * @return 完整响应 JSON
     */
    public JSONObject complete(JSONObject body) {
        HttpRequest request = buildRequest(body, false);
        try {
            HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
            int statusCode = response.statusCode();
            if (statusCode < 200 || statusCode >= 300) {
                throw new NimApiException(statusCode, response.body());
            }
            JSONObject json = JSON.parseObject(response.body());
            if (json == null) {
                throw new NimApiException(502, "Empty response body from upstream");
            }
            return json;
        } catch (JSONException e) {
            throw new NimApiException(502, "Invalid JSON from upstream: " + e.getMessage(), e);
        } catch (IOException e) {
            log.error("调用 NIM API 异常: {}", e.getMessage());
            throw new NimApiException(500, describe(e), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new NimApiException(500, "Request interrupted", e);
        }
    }

    /**
     * 调用 NIM API（流式）
     * <p>
     * 仅在拿到 2xx 状态后返回响应体，调用方负责关闭
     *
     * @param body NIM 请求体（stream=true）
     * @return 上游 SSE 字节流
     */
    public InputStream openStream(JSONObject body) {
        HttpRequest request = buildRequest(body, true);
        try {
            HttpResponse<InputStream> response = httpClient.send(request, HttpResponse.BodyHandlers.ofInputStream());
            int statusCode = response.statusCode();
            if (statusCode < 200 || statusCode >= 300) {
                throw new NimApiException(statusCode, readBody(response.body()));
            }
            return response.body();
        } catch (IOException e) {
            log.error("调用 NIM API 异常（流式）: {}", e.getMessage());
            throw new NimApiException(500, describe(e), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new NimApiException(500, "Request interrupted", e);
        }
    }

    private HttpRequest buildRequest(JSONObject body, boolean stream) {
        return HttpRequest.newBuilder()
                .uri(URI.create(properties.getApiBase() + "/chat/completions"))
                .timeout(Duration.ofSeconds(properties.getRequestTimeoutSeconds()))
                .header("Authorization", "Bearer " + properties.getApiKey())
                .header("Content-Type", "application/json")
                .header("Accept", stream ? "text/event-stream" : "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(body.toJSONString(), StandardCharsets.UTF_8))
                .build();
    }

    private String readBody(InputStream body) {
        try (InputStream in = body) {
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            return "读取响应体失败: " + e.getMessage();
        }
    }

    private String describe(IOException e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }
}
