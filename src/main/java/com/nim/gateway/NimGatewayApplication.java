package com.nim.gateway;

import com.nim.gateway.config.AppProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.core.env.Environment;

@SpringBootApplication
public class NimGatewayApplication {

    private static final Logger log = LoggerFactory.getLogger(NimGatewayApplication.class);

    private final AppProperties properties;
    private final Environment environment;

    public NimGatewayApplication(AppProperties properties, Environment environment) {
        this.properties = properties;
        this.environment = environment;
    }

    public static void main(String[] args) {
        SpringApplication.run(NimGatewayApplication.class, args);
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onReady() {
        String port = environment.getProperty("local.server.port", environment.getProperty("server.port", "3000"));
        log.info("╔═══════════════════════════════════════════════════╗");
        log.info("║           NIM Gateway Java v1.0.0                 ║");
        log.info("║        OpenAI → NVIDIA NIM Compatible Proxy       ║");
        log.info("╚═══════════════════════════════════════════════════╝");
        log.info("健康检查: http://localhost:{}/health", port);
        log.info("API 端点:");
        log.info("  POST /v1/chat/completions");
        log.info("  GET  /v1/models");
        log.info("Reasoning 展示: {} (SHOW_REASONING=false 可关闭)", properties.isShowReasoning() ? "已启用" : "已关闭");
        log.info("Thinking 模式:  {} (ENABLE_THINKING_MODE=false 可关闭)", properties.isEnableThinkingMode() ? "已启用" : "已关闭");
        if (properties.hasApiKey()) {
            log.info("NIM API Key:    已设置");
        } else {
            log.warn("NIM API Key:    未设置，请配置 NIM_API_KEY 环境变量");
        }
    }
}
