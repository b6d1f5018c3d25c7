package com.nim.gateway.exception;

/**
 * 配置缺失异常（如未设置 API Key），请求不会发往上游
 */
public class ConfigurationException extends NimGatewayException {

    public ConfigurationException(String message) {
        super(message, 500);
    }
}
