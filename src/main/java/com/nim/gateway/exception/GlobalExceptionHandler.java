package com.nim.gateway.exception;

import com.alibaba.fastjson2.JSON;
import com.alibaba.fastjson2.JSONArray;
import com.alibaba.fastjson2.JSONException;
import com.alibaba.fastjson2.JSONObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.server.ResponseStatusException;

/**
 * 全局异常处理器
 * <p>
 * 统一输出 OpenAI 风格错误体：{"error":{"message","type","code"}}
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(ConfigurationException.class)
    public ResponseEntity<String> handleConfiguration(ConfigurationException e) {
        log.error("配置错误: {}", e.getMessage());
        JSONObject error = JSONObject.of(
                "message", e.getMessage(), //
                "type", "server_error" //
        );
        return buildResponse(e.getStatusCode(), error);
    }

    @ExceptionHandler(InvalidRequestException.class)
    public ResponseEntity<String> handleInvalidRequest(InvalidRequestException e) {
        log.warn("请求格式错误: {}", e.getMessage());
        return buildErrorResponse(e.getStatusCode(), "invalid_request_error", e.getMessage());
    }

    @ExceptionHandler(NimApiException.class)
    public ResponseEntity<String> handleNimApi(NimApiException e) {
        String detail = describeUpstreamBody(e.getResponseBody());
        log.error("代理错误 [{}]: {}", e.getStatusCode(), detail);
        return buildErrorResponse(e.getStatusCode(), "proxy_error", detail);
    }

    @ExceptionHandler(NimGatewayException.class)
    public ResponseEntity<String> handleGateway(NimGatewayException e) {
        log.error("网关异常: {}", e.getMessage(), e);
        return buildErrorResponse(e.getStatusCode(), "proxy_error", e.getMessage());
    }

    @ExceptionHandler(ResponseStatusException.class)
    public ResponseEntity<String> handleResponseStatus(ResponseStatusException e) {
        int statusCode = e.getStatusCode().value();
        if (statusCode == 404) {
            log.warn("路由未找到: {}", e.getReason());
            return buildErrorResponse(statusCode, "not_found", e.getReason());
        }
        log.warn("HTTP 状态异常: {} {}", statusCode, e.getReason());
        return buildErrorResponse(statusCode, "proxy_error", e.getReason());
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<String> handleUnexpected(Exception e) {
        log.error("未预期异常: {}", e.getMessage(), e);
        String message = e.getMessage() != null ? e.getMessage() : "Internal server error";
        return buildErrorResponse(500, "proxy_error", message);
    }

    /**
     * 上游错误体为 JSON 时压缩为单行，否则原样使用
     */
    static String describeUpstreamBody(String body) {
        if (body == null || body.isBlank()) {
            return "Internal server error";
        }
        String trimmed = body.trim();
        if (!trimmed.startsWith("{") && !trimmed.startsWith("[")) {
            return body;
        }
        try {
            Object parsed = JSON.parse(trimmed);
            if (parsed instanceof JSONObject || parsed instanceof JSONArray) {
                return JSON.toJSONString(parsed);
            }
        } catch (JSONException e) {
            log.debug("上游错误体不是 JSON: {}", e.getMessage());
        }
        return body;
    }

    private ResponseEntity<String> buildErrorResponse(int statusCode, String errorType, String message) {
        JSONObject error = JSONObject.of(
                "message", message, //
                "type", errorType, //
                "code", statusCode //
        );
        return buildResponse(statusCode, error);
    }

    private ResponseEntity<String> buildResponse(int statusCode, JSONObject error) {
        int status = statusCode >= 100 && statusCode <= 599 ? statusCode : HttpStatus.INTERNAL_SERVER_ERROR.value();
        return ResponseEntity
                .status(status)
                .contentType(MediaType.APPLICATION_JSON)
                .body(JSONObject.of("error", error).toJSONString());
    }
}
