package com.nim.gateway.stream;

import com.alibaba.fastjson2.JSONArray;
import com.alibaba.fastjson2.JSONObject;
import com.nim.gateway.translator.ReasoningMarkers;

/**
 * reasoning / content 拼接状态机
 * <p>
 * 作用于 choices[0].delta：去掉 reasoning 字段，把 reasoning 文本以 think 标签注入 content。
 * 不修改输入帧，只沿修改路径复制出新的 frame / choice / delta，其余字段共享原对象。
 * 无 delta 的帧原样返回（同一实例）。
 */
public final class FrameSplicer {

    static final String REASONING_CONTENT = "reasoning_content";
    static final String REASONING = "reasoning";
    static final String CONTENT = "content";

    private FrameSplicer() {
    }

    /**
     * reasoning 展示模式
     *
     * @param frame    上游帧
     * @param spanOpen 当前 think 标签是否已打开
     * @return 新帧和新的标签状态
     */
    public static SpliceResult splice(JSONObject frame, boolean spanOpen) {
        JSONObject delta = firstDelta(frame);
        if (delta == null) {
            return new SpliceResult(frame, spanOpen);
        }

        String reasoningChunk = readReasoning(delta);
        Object rawContent = delta.get(CONTENT);
        String contentChunk = rawContent != null ? delta.getString(CONTENT) : null;

        StringBuilder inject = new StringBuilder();
        boolean open = spanOpen;

        if (reasoningChunk != null && !reasoningChunk.isEmpty()) {
            if (!open) {
                inject.append(ReasoningMarkers.OPEN);
                open = true;
            }
            inject.append(reasoningChunk);
        }

        if (contentChunk != null && !contentChunk.isEmpty()) {
            if (open) {
                inject.append(ReasoningMarkers.CLOSE);
                open = false;
            }
            inject.append(contentChunk);
        }

        JSONObject newDelta = stripReasoning(delta);
        if (!inject.isEmpty()) {
            newDelta.put(CONTENT, inject.toString());
        } else if ("".equals(contentChunk)) {
            // 保留显式的空 content，部分客户端据此判断回合仍在进行
            newDelta.put(CONTENT, "");
        } else {
            newDelta.remove(CONTENT);
        }

        return new SpliceResult(replaceDelta(frame, newDelta), open);
    }

    /**
     * reasoning 隐藏模式：丢弃 reasoning，content 缺失或为 null 时补空串
     */
    public static JSONObject strip(JSONObject frame) {
        JSONObject delta = firstDelta(frame);
        if (delta == null) {
            return frame;
        }
        String contentChunk = delta.get(CONTENT) != null ? delta.getString(CONTENT) : null;
        JSONObject newDelta = stripReasoning(delta);
        newDelta.put(CONTENT, contentChunk != null ? contentChunk : "");
        return replaceDelta(frame, newDelta);
    }

    private static JSONObject firstDelta(JSONObject frame) {
        if (!(frame.get("choices") instanceof JSONArray choices) || choices.isEmpty()) {
            return null;
        }
        if (!(choices.get(0) instanceof JSONObject choice)) {
            return null;
        }
        return choice.get("delta") instanceof JSONObject delta ? delta : null;
    }

    /**
     * 取第一个非空的 reasoning：reasoning_content 优先，其次 reasoning（仅字符串）
     */
    private static String readReasoning(JSONObject delta) {
        if (delta.get(REASONING_CONTENT) != null) {
            String text = delta.getString(REASONING_CONTENT);
            if (!text.isEmpty()) {
                return text;
            }
        }
        return delta.get(REASONING) instanceof String text && !text.isEmpty() ? text : null;
    }

    private static JSONObject stripReasoning(JSONObject delta) {
        JSONObject copy = new JSONObject(delta);
        copy.remove(REASONING_CONTENT);
        copy.remove(REASONING);
        return copy;
    }

    private static JSONObject replaceDelta(JSONObject frame, JSONObject newDelta) {
        JSONArray choices = frame.getJSONArray("choices");
        JSONObject choice = new JSONObject(choices.getJSONObject(0));
        choice.put("delta", newDelta);

        JSONArray newChoices = new JSONArray(choices);
        newChoices.set(0, choice);

        JSONObject copy = new JSONObject(frame);
        copy.put("choices", newChoices);
        return copy;
    }

    /**
     * 拼接结果
     *
     * @param frame    输出帧
     * @param spanOpen 处理后 think 标签是否仍打开
     */
    public record SpliceResult(JSONObject frame, boolean spanOpen) {}
}
