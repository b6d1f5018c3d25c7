package com.nim.gateway.translator;

import com.alibaba.fastjson2.JSONArray;
import com.alibaba.fastjson2.JSONObject;
import com.nim.gateway.config.AppProperties;
import com.nim.gateway.exception.InvalidRequestException;
import com.nim.gateway.model.ModelCapability;
import com.nim.gateway.model.ModelCatalog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * OpenAI → NIM 请求转换
 * <p>
 * 解析模型名，按模型能力注入 thinking 开关，补全默认参数
 */
@Component
public class ChatRequestTranslator {

    private static final Logger log = LoggerFactory.getLogger(ChatRequestTranslator.class);

    static final String NEMOTRON_THINKING_PROMPT = "detailed thinking on";

    private final AppProperties properties;
    private final ModelCatalog modelCatalog;

    public ChatRequestTranslator(AppProperties properties, ModelCatalog modelCatalog) {
        this.properties = properties;
        this.modelCatalog = modelCatalog;
    }

    /**
     * 转换请求
     *
     * @param request 客户端请求体 JSON（不会被修改）
     * @return 转换结果
     */
    public TranslateResult translate(JSONObject request) {
        Object rawMessages = request.get("messages");
        if (!(rawMessages instanceof JSONArray messages)) {
            throw new InvalidRequestException("'messages' must be an array");
        }

        String requestedModel = request.getString("model");
        String nimModel = modelCatalog.resolve(requestedModel);
        boolean stream = request.getBooleanValue("stream", false);
        boolean thinking = properties.isEnableThinkingMode();

        JSONArray finalMessages = copyMessages(messages);
        if (thinking && modelCatalog.supports(nimModel, ModelCapability.SYSTEM_PROMPT_THINKING)) {
            injectThinkingPrompt(finalMessages);
        }

        JSONObject body = new JSONObject();
        body.put("model", nimModel);
        body.put("messages", finalMessages);
        Object temperature = request.get("temperature");
        body.put("temperature", temperature != null ? temperature : properties.getDefaultTemperature());
        body.put("max_tokens", maxTokens(request.get("max_tokens")));
        body.put("stream", stream);

        if (thinking && modelCatalog.supports(nimModel, ModelCapability.TEMPLATE_THINKING)) {
            body.put("chat_template_kwargs", JSONObject.of("enable_thinking", true));
        }

        log.debug("请求转换: model={} → {}, stream={}, messages={}", requestedModel, nimModel, stream, finalMessages.size());
        return new TranslateResult(body, requestedModel, nimModel, stream);
    }

    /**
     * 缺省、null 或 0 时使用默认值，其余数值原样透传
     */
    private Object maxTokens(Object raw) {
        if (raw == null) {
            return properties.getDefaultMaxTokens();
        }
        if (!(raw instanceof Number number)) {
            throw new InvalidRequestException("'max_tokens' must be a number");
        }
        return number.doubleValue() == 0 ? properties.getDefaultMaxTokens() : number;
    }

    private JSONArray copyMessages(JSONArray messages) {
        JSONArray copy = new JSONArray(messages.size());
        for (int i = 0; i < messages.size(); i++) {
            Object msg = messages.get(i);
            if (msg instanceof JSONObject obj) {
                copy.add(new JSONObject(obj));
            } else {
                copy.add(msg);
            }
        }
        return copy;
    }

    /**
     * Nemotron 的 thinking 开关：已有 system 消息时加前缀，否则插入新的 system 消息
     */
    private void injectThinkingPrompt(JSONArray messages) {
        if (!messages.isEmpty() && messages.get(0) instanceof JSONObject first
                && "system".equals(first.getString("role"))) {
            String content = first.getString("content");
            first.put("content", content != null ? NEMOTRON_THINKING_PROMPT + "\n\n" + content : NEMOTRON_THINKING_PROMPT);
            return;
        }
        messages.add(0, JSONObject.of("role", "system", "content", NEMOTRON_THINKING_PROMPT));
    }

    /**
     * 转换结果
     *
     * @param body           NIM 请求体
     * @param requestedModel 客户端请求的模型名
     * @param nimModel       解析后的 NIM 模型 ID
     * @param stream         是否流式
     */
    public record TranslateResult(JSONObject body, String requestedModel, String nimModel, boolean stream) {}
}
