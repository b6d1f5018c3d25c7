package com.nim.gateway.proxy;

import com.nim.gateway.stream.StreamRewriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.scheduler.Schedulers;

import java.io.IOException;
import java.io.InputStream;
import java.util.Arrays;

/**
 * 上游 SSE 转发
 * <p>
 * 在 boundedElastic 线程上按块读取上游字节，逐块交给 {@link StreamRewriter}，
 * 产出的记录立即下发。流一旦开始就不再向客户端输出错误体：
 * 上游读取失败只记录日志并结束流；客户端断开时释放改写器状态并关闭上游连接。
 */
@Component
public class SseRelay {

    private static final Logger log = LoggerFactory.getLogger(SseRelay.class);

    private static final int READ_BUFFER_SIZE = 8192;

    public Flux<byte[]> relay(InputStream upstream, StreamRewriter rewriter, String traceId) {
        return Flux.<byte[]>generate(sink -> {
                    try {
                        byte[] buf = new byte[READ_BUFFER_SIZE];
                        int len = upstream.read(buf);
                        if (len == -1) {
                            sink.complete();
                        } else {
                            sink.next(Arrays.copyOf(buf, len));
                        }
                    } catch (IOException e) {
                        sink.error(e);
                    }
                })
                .subscribeOn(Schedulers.boundedElastic())
                .concatMapIterable(rewriter::feed)
                .concatWith(Flux.defer(() -> Flux.fromIterable(rewriter.finish())))
                .onErrorResume(e -> {
                    log.error("流式响应中断: traceId={}, error={}", traceId, e.getMessage());
                    rewriter.abort();
                    return Flux.empty();
                })
                .doOnTerminate(() -> close(upstream, traceId))
                .doOnCancel(() -> {
                    log.info("客户端断开连接: traceId={}", traceId);
                    rewriter.abort();
                    close(upstream, traceId);
                });
    }

    private void close(InputStream upstream, String traceId) {
        try {
            upstream.close();
        } catch (IOException e) {
            log.debug("关闭上游连接失败: traceId={}, error={}", traceId, e.getMessage());
        }
    }
}
