package com.nim.gateway.translator;

import com.alibaba.fastjson2.JSON;
import com.alibaba.fastjson2.JSONObject;
import com.nim.gateway.config.AppProperties;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ChatResponseTranslatorTest {

    private static final String UPSTREAM = "{\"id\":\"up-1\",\"choices\":[{\"index\":0,\"message\":{\"role\":\"assistant\","
            + "\"content\":\"4\",\"reasoning_content\":\"2+2\"},\"finish_reason\":\"stop\"}],"
            + "\"usage\":{\"prompt_tokens\":5,\"completion_tokens\":7,\"total_tokens\":12}}";

    private static ChatResponseTranslator translator(boolean showReasoning) {
        AppProperties properties = new AppProperties();
        properties.setShowReasoning(showReasoning);
        return new ChatResponseTranslator(properties);
    }

    private static JSONObject firstMessage(JSONObject response) {
        return response.getJSONArray("choices").getJSONObject(0).getJSONObject("message");
    }

    @Test
    void wrapsReasoningBeforeContent() {
        JSONObject response = translator(true).toOpenAiResponse(JSON.parseObject(UPSTREAM), "gpt-4-turbo");

        assertEquals("<think>\n2+2\n</think>\n\n4", firstMessage(response).getString("content"));
        assertFalse(firstMessage(response).containsKey("reasoning_content"));
        assertEquals("chat.completion", response.getString("object"));
        assertEquals("gpt-4-turbo", response.getString("model"));
        assertTrue(response.getString("id").startsWith("chatcmpl-"));
        assertEquals(12, response.getJSONObject("usage").getIntValue("total_tokens"));
        assertEquals("stop", response.getJSONArray("choices").getJSONObject(0).getString("finish_reason"));
    }

    @Test
    void hidesReasoningWhenDisplayDisabled() {
        JSONObject response = translator(false).toOpenAiResponse(JSON.parseObject(UPSTREAM), "gpt-4-turbo");

        assertEquals("4", firstMessage(response).getString("content"));
    }

    @Test
    void fillsMissingFields() {
        JSONObject upstream = JSON.parseObject("{\"choices\":[{\"index\":0,\"message\":{\"content\":null}}]}");

        JSONObject response = translator(true).toOpenAiResponse(upstream, "gpt-4o");

        assertEquals("assistant", firstMessage(response).getString("role"));
        assertEquals("", firstMessage(response).getString("content"));
        assertEquals(0, response.getJSONObject("usage").getIntValue("prompt_tokens"));
    }

    @Test
    void emptyReasoningLeavesContentUnchanged() {
        JSONObject upstream = JSON.parseObject(
                "{\"choices\":[{\"index\":0,\"message\":{\"content\":\"hi\",\"reasoning_content\":\"\"}}]}");

        assertEquals("hi", firstMessage(translator(true).toOpenAiResponse(upstream, "m")).getString("content"));
    }
}
