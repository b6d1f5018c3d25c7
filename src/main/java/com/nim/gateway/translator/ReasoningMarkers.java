package com.nim.gateway.translator;

/**
 * reasoning 片段在 content 中的包裹标签
 */
public final class ReasoningMarkers {

    public static final String OPEN = "<think>\n";
    public static final String CLOSE = "\n</think>\n\n";

    private ReasoningMarkers() {
    }

    /**
     * 非流式拼接：reasoning 非空时包裹后置于正文前
     */
    public static String wrap(String reasoning, String content) {
        String body = content != null ? content : "";
        if (reasoning == null || reasoning.isEmpty()) {
            return body;
        }
        return OPEN + reasoning + CLOSE + body;
    }
}
