package com.nim.gateway.stream;

import com.alibaba.fastjson2.JSON;
import com.alibaba.fastjson2.JSONArray;
import com.alibaba.fastjson2.JSONObject;
import com.alibaba.fastjson2.JSONWriter;
import com.nim.gateway.translator.ReasoningMarkers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * NIM SSE 流改写器
 * <p>
 * 每个响应流一个实例，按 chunk 推入上游字节，返回改写后的 SSE 记录（UTF-8 字节）：
 * <ul>
 *   <li>data 记录：解析 JSON，经 {@link FrameSplicer} 处理后重新编码</li>
 *   <li>data: [DONE]：think 标签未关闭时先补一条关闭记录</li>
 *   <li>其他行及无法解析的 data 记录：原始字节原样透传</li>
 * </ul>
 * 不做任何 I/O。方法互斥，客户端断开时可从取消线程调用 {@link #abort()}。
 */
public class StreamRewriter {

    private static final Logger log = LoggerFactory.getLogger(StreamRewriter.class);

    static final String RECORD_END = "\n\n";

    private final String model;
    private final boolean showReasoning;
    private final Clock clock;
    private final LineFramer framer = new LineFramer();

    // think 标签是否已打开
    private boolean spanOpen = false;
    private boolean finished = false;

    public StreamRewriter(String model, boolean showReasoning) {
        this(model, showReasoning, Clock.systemUTC());
    }

    public StreamRewriter(String model, boolean showReasoning, Clock clock) {
        this.model = model;
        this.showReasoning = showReasoning;
        this.clock = clock;
    }

    /**
     * 输入一个上游 chunk
     *
     * @return 本次产生的输出记录（按顺序）
     */
    public synchronized List<byte[]> feed(byte[] chunk) {
        if (finished) {
            return List.of();
        }
        List<byte[]> out = new ArrayList<>();
        for (byte[] line : framer.feed(chunk)) {
            process(RecordClassifier.classify(line), out);
        }
        return out;
    }

    /**
     * 上游正常结束
     * <p>
     * 丢弃未完成的残行；think 标签仍打开时补一条关闭记录
     */
    public synchronized List<byte[]> finish() {
        if (finished) {
            return List.of();
        }
        finished = true;
        int dropped = framer.finish();
        if (dropped > 0) {
            log.debug("流结束时丢弃未完成记录: {} 字节", dropped);
        }
        if (spanOpen) {
            spanOpen = false;
            return List.of(encode(closingFrame()));
        }
        return List.of();
    }

    /**
     * 上游出错或客户端断开：释放缓冲，不再输出
     */
    public synchronized void abort() {
        finished = true;
        framer.finish();
        spanOpen = false;
    }

    public synchronized boolean isSpanOpen() {
        return spanOpen;
    }

    private void process(SseRecord record, List<byte[]> out) {
        switch (record.type()) {
            case BLANK -> {
                // 记录分隔符，输出时由 RECORD_END 重新生成
            }
            case TERMINATOR -> {
                if (spanOpen) {
                    out.add(encode(closingFrame()));
                    spanOpen = false;
                }
                out.add(utf8(RecordClassifier.DONE_LINE + RECORD_END));
            }
            case DATA -> out.add(rewrite(record));
            case OPAQUE -> out.add(passthrough(record));
        }
    }

    private byte[] rewrite(SseRecord record) {
        String payload = record.payload();
        if (!StrictJson.isObject(payload)) {
            return passthrough(record);
        }
        try {
            JSONObject frame = JSON.parseObject(payload);
            if (frame == null) {
                return passthrough(record);
            }

            JSONObject output;
            if (showReasoning) {
                FrameSplicer.SpliceResult result = FrameSplicer.splice(frame, spanOpen);
                spanOpen = result.spanOpen();
                output = result.frame();
            } else {
                output = FrameSplicer.strip(frame);
            }

            // 未修改的帧直接使用原始文本
            if (output == frame) {
                return utf8(RecordClassifier.DATA_PREFIX + payload + RECORD_END);
            }
            return encode(output);
        } catch (RuntimeException e) {
            log.debug("无法解析的 data 记录，原样透传: {}", e.getMessage());
            return passthrough(record);
        }
    }

    private byte[] passthrough(SseRecord record) {
        byte[] raw = record.raw();
        byte[] out = Arrays.copyOf(raw, raw.length + 1);
        out[raw.length] = '\n';
        return out;
    }

    private byte[] encode(JSONObject frame) {
        return utf8(RecordClassifier.DATA_PREFIX + frame.toJSONString(JSONWriter.Feature.WriteNulls) + RECORD_END);
    }

    private static byte[] utf8(String text) {
        return text.getBytes(StandardCharsets.UTF_8);
    }

    /**
     * 构造只包含关闭标签的补充帧
     */
    JSONObject closingFrame() {
        long now = clock.millis();
        JSONObject delta = JSONObject.of("content", ReasoningMarkers.CLOSE);
        JSONObject choice = new JSONObject();
        choice.put("index", 0);
        choice.put("delta", delta);
        choice.put("finish_reason", null);

        JSONObject frame = new JSONObject();
        frame.put("id", "chatcmpl-inject-" + now);
        frame.put("object", "chat.completion.chunk");
        frame.put("created", now / 1000);
        frame.put("model", model);
        frame.put("choices", JSONArray.of(choice));
        return frame;
    }
}
