package com.nim.gateway.exception;

import lombok.Getter;

/**
 * NIM 上游调用异常
 * <p>
 * HTTP 错误携带上游状态码和响应体；网络错误状态码为 500，responseBody 为异常信息
 */
@Getter
public class NimApiException extends NimGatewayException {

    private final String responseBody;

    public NimApiException(int statusCode, String responseBody) {
        super("NIM API 错误: " + statusCode + " - " + responseBody, statusCode);
        this.responseBody = responseBody;
    }

    public NimApiException(int statusCode, String responseBody, Throwable cause) {
        super("NIM API 错误: " + statusCode + " - " + responseBody, statusCode, cause);
        this.responseBody = responseBody;
    }
}
