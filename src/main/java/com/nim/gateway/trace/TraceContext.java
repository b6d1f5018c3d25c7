package com.nim.gateway.trace;

import java.time.Instant;
import java.util.UUID;

/**
 * 单次请求追踪上下文
 * <p>
 * 记录 traceId、模型和耗时，用于日志关联
 */
public class TraceContext {

    private final String traceId;
    private final Instant startTime;

    private String requestedModel;
    private String nimModel;
    private boolean stream;
    private int status = 200;

    private TraceContext(String traceId) {
        this.traceId = traceId;
        this.startTime = Instant.now();
    }

    /**
     * 创建新的追踪上下文
     */
    public static TraceContext create() {
        return new TraceContext(UUID.randomUUID().toString().replace("-", "").substring(0, 16));
    }

    /**
     * 记录模型解析结果
     */
    public void recordModel(String requestedModel, String nimModel, boolean stream) {
        this.requestedModel = requestedModel;
        this.nimModel = nimModel;
        this.stream = stream;
    }

    public void recordStatus(int status) {
        this.status = status;
    }

    public String traceId() {
        return traceId;
    }

    public String requestedModel() {
        return requestedModel;
    }

    public String nimModel() {
        return nimModel;
    }

    public boolean stream() {
        return stream;
    }

    public int status() {
        return status;
    }

    public long durationMs() {
        return Instant.now().toEpochMilli() - startTime.toEpochMilli();
    }
}
