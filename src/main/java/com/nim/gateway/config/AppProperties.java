package com.nim.gateway.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 应用配置属性绑定
 */
@Data
@Component
@ConfigurationProperties(prefix = "nim")
public class AppProperties {

    private String apiBase = "https://integrate.api.nvidia.com/v1";
    private String apiKey = "";
    // 是否把 reasoning 以 <think> 标签注入 content
    private boolean showReasoning = true;
    // 是否为支持的模型开启 thinking 请求参数
    private boolean enableThinkingMode = true;
    private int requestTimeoutSeconds = 120;
    private double defaultTemperature = 0.6;
    private int defaultMaxTokens = 16384;
    // 额外的模型别名（客户端模型名 → NIM 模型 ID），覆盖内置映射
    private Map<String, String> modelMapping = new LinkedHashMap<>();
    private ProxyConfig proxy = new ProxyConfig();
    private LoggingConfig logging = new LoggingConfig();

    public boolean hasApiKey() {
        return apiKey != null && !apiKey.isBlank();
    }

    // --- 嵌套配置类 ---

    @Data
    public static class ProxyConfig {
        private boolean enabled = false;
        private String url = "";
    }

    @Data
    public static class LoggingConfig {
        private String filePath = "data/logs";
        private String maxFileSize = "100MB";
        private int maxHistory = 30;
        private String totalSizeCap = "1GB";
    }
}
