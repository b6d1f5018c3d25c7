package com.nim.gateway.translator;

import com.alibaba.fastjson2.JSONArray;
import com.alibaba.fastjson2.JSONObject;
import com.nim.gateway.config.AppProperties;
import org.springframework.stereotype.Component;

/**
 * NIM → OpenAI 非流式响应转换
 * <p>
 * reasoning_content 以 think 标签拼接到正文前，其余字段按 OpenAI Chat Completion 格式重建
 */
@Component
public class ChatResponseTranslator {

    private final AppProperties properties;

    public ChatResponseTranslator(AppProperties properties) {
        this.properties = properties;
    }

    /**
     * 将 NIM 完整响应转换为 OpenAI Chat Completion
     *
     * @param upstream       NIM 响应体
     * @param requestedModel 客户端请求的模型名
     */
    public JSONObject toOpenAiResponse(JSONObject upstream, String requestedModel) {
        JSONArray choices = new JSONArray();
        JSONArray upstreamChoices = upstream.getJSONArray("choices");
        if (upstreamChoices != null) {
            for (int i = 0; i < upstreamChoices.size(); i++) {
                choices.add(toChoice(upstreamChoices.getJSONObject(i)));
            }
        }

        JSONObject usage = upstream.getJSONObject("usage");
        if (usage == null) {
            usage = JSONObject.of( //
                    "prompt_tokens", 0, //
                    "completion_tokens", 0, //
                    "total_tokens", 0 //
            );
        }

        long now = System.currentTimeMillis();
        JSONObject result = new JSONObject();
        result.put("id", "chatcmpl-" + now);
        result.put("object", "chat.completion");
        result.put("created", now / 1000);
        result.put("model", requestedModel);
        result.put("choices", choices);
        result.put("usage", usage);
        return result;
    }

    private JSONObject toChoice(JSONObject choice) {
        JSONObject msg = choice.getJSONObject("message");
        if (msg == null) {
            msg = new JSONObject();
        }
        String content = msg.getString("content");
        String reasoning = msg.getString("reasoning_content");

        String finalContent = properties.isShowReasoning()
                ? ReasoningMarkers.wrap(reasoning, content)
                : (content != null ? content : "");

        String role = msg.getString("role");
        JSONObject message = JSONObject.of(
                "role", role != null ? role : "assistant", //
                "content", finalContent //
        );

        JSONObject result = new JSONObject();
        result.put("index", choice.get("index"));
        result.put("message", message);
        result.put("finish_reason", choice.get("finish_reason"));
        return result;
    }
}
