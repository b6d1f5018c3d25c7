package com.nim.gateway.exception;

import lombok.Getter;

/**
 * NIM Gateway 异常基类
 */
@Getter
public class NimGatewayException extends RuntimeException {

    private final int statusCode;

    public NimGatewayException(String message) {
        super(message);
        this.statusCode = 500;
    }

    public NimGatewayException(String message, int statusCode) {
        super(message);
        this.statusCode = statusCode;
    }

    public NimGatewayException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = 500;
    }

    public NimGatewayException(String message, int statusCode, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
    }

}
