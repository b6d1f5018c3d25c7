package com.nim.gateway.exception;

/**
 * 客户端请求格式错误
 */
public class InvalidRequestException extends NimGatewayException {

    public InvalidRequestException(String message) {
        super(message, 400);
    }

    public InvalidRequestException(String message, Throwable cause) {
        super(message, 400, cause);
    }
}
