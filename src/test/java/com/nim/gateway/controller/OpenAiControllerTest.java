package com.nim.gateway.controller;

import com.alibaba.fastjson2.JSON;
import com.alibaba.fastjson2.JSONObject;
import com.nim.gateway.exception.NimApiException;
import com.nim.gateway.proxy.NimApiClient;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.reactive.AutoConfigureWebTestClient;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.reactive.server.WebTestClient;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@SpringBootTest(properties = {
        "nim.api-key=test-key",
        "nim.show-reasoning=true",
        "nim.enable-thinking-mode=true"
})
@AutoConfigureWebTestClient
@ActiveProfiles("test")
class OpenAiControllerTest {

    @Autowired
    private WebTestClient webTestClient;

    @MockBean
    private NimApiClient nimClient;

    private static String record(String deltaJson) {
        return "data: {\"id\":\"up\",\"choices\":[{\"index\":0,\"delta\":" + deltaJson + ",\"finish_reason\":null}]}\n\n";
    }

    @Test
    void streamsRewrittenRecords() {
        String upstream = record("{\"role\":\"assistant\",\"content\":\"\"}")
                + record("{\"reasoning_content\":\"Let me think\"}")
                + record("{\"content\":\"The answer is 4\"}")
                + "data: [DONE]\n\n";
        when(nimClient.openStream(any())).thenReturn(new ByteArrayInputStream(upstream.getBytes(StandardCharsets.UTF_8)));

        String body = webTestClient.post().uri("/v1/chat/completions")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{\"model\":\"gpt-4-turbo\",\"stream\":true,\"messages\":[{\"role\":\"user\",\"content\":\"2+2?\"}]}")
                .exchange()
                .expectStatus().isOk()
                .expectHeader().contentTypeCompatibleWith(MediaType.TEXT_EVENT_STREAM)
                .expectHeader().valueEquals("Cache-Control", "no-cache")
                .expectHeader().valueEquals("X-Accel-Buffering", "no")
                .expectBody(String.class)
                .returnResult()
                .getResponseBody();

        assertNotNull(body);
        int open = body.indexOf("\"content\":\"<think>\\nLet me think\"");
        int close = body.indexOf("\"content\":\"\\n</think>\\n\\nThe answer is 4\"");
        int done = body.indexOf("data: [DONE]\n\n");
        assertTrue(body.startsWith("data: {\"id\":\"up\",\"choices\":[{\"index\":0,\"delta\":{\"role\":\"assistant\",\"content\":\"\"}"));
        assertTrue(open > 0 && close > open && done > close, body);
        assertFalse(body.contains("reasoning_content"));
        assertTrue(body.endsWith("data: [DONE]\n\n"));

        ArgumentCaptor<JSONObject> captor = ArgumentCaptor.forClass(JSONObject.class);
        verify(nimClient).openStream(captor.capture());
        assertEquals("deepseek-ai/deepseek-r1-0528", captor.getValue().getString("model"));
        assertTrue(captor.getValue().getBooleanValue("stream"));
    }

    @Test
    void streamingUpstreamErrorIsReturnedAsJson() {
        when(nimClient.openStream(any())).thenThrow(new NimApiException(429, "{\"error\":\"rate limited\"}"));

        webTestClient.post().uri("/v1/chat/completions")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{\"model\":\"gpt-4\",\"stream\":true,\"messages\":[]}")
                .exchange()
                .expectStatus().isEqualTo(429)
                .expectHeader().contentTypeCompatibleWith(MediaType.APPLICATION_JSON)
                .expectBody()
                .jsonPath("$.error.code").isEqualTo(429)
                .jsonPath("$.error.type").isEqualTo("proxy_error")
                .jsonPath("$.error.message").isEqualTo("{\"error\":\"rate limited\"}");
    }

    @Test
    void transportErrorBecomesServerError() {
        when(nimClient.complete(any())).thenThrow(new NimApiException(500, "Connection refused"));

        webTestClient.post().uri("/v1/chat/completions")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{\"model\":\"gpt-4\",\"messages\":[]}")
                .exchange()
                .expectStatus().isEqualTo(500)
                .expectBody()
                .jsonPath("$.error.code").isEqualTo(500)
                .jsonPath("$.error.message").isEqualTo("Connection refused");
    }

    @Test
    void nonStreamingResponseSplicesReasoning() {
        when(nimClient.complete(any())).thenReturn(JSON.parseObject(
                "{\"choices\":[{\"index\":0,\"message\":{\"role\":\"assistant\",\"content\":\"4\","
                        + "\"reasoning_content\":\"2+2\"},\"finish_reason\":\"stop\"}],"
                        + "\"usage\":{\"prompt_tokens\":1,\"completion_tokens\":2,\"total_tokens\":3}}"));

        webTestClient.post().uri("/v1/chat/completions")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{\"model\":\"gpt-4\",\"messages\":[{\"role\":\"user\",\"content\":\"2+2?\"}]}")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.object").isEqualTo("chat.completion")
                .jsonPath("$.model").isEqualTo("gpt-4")
                .jsonPath("$.choices[0].message.content").isEqualTo("<think>\n2+2\n</think>\n\n4")
                .jsonPath("$.choices[0].finish_reason").isEqualTo("stop")
                .jsonPath("$.usage.total_tokens").isEqualTo(3);

        ArgumentCaptor<JSONObject> captor = ArgumentCaptor.forClass(JSONObject.class);
        verify(nimClient).complete(captor.capture());
        assertEquals("qwen/qwen3-235b-a22b", captor.getValue().getString("model"));
        assertEquals(JSONObject.of("enable_thinking", true), captor.getValue().getJSONObject("chat_template_kwargs"));
    }

    @Test
    void invalidJsonIsRejected() {
        webTestClient.post().uri("/v1/chat/completions")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{not json")
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.error.type").isEqualTo("invalid_request_error");

        verify(nimClient, never()).complete(any());
    }

    @Test
    void missingMessagesIsRejected() {
        webTestClient.post().uri("/v1/chat/completions")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{\"model\":\"gpt-4\"}")
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.error.code").isEqualTo(400);
    }

    @Test
    void nonNumericMaxTokensIsRejected() {
        webTestClient.post().uri("/v1/chat/completions")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{\"model\":\"gpt-4\",\"messages\":[],\"max_tokens\":\"lots\"}")
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.error.type").isEqualTo("invalid_request_error")
                .jsonPath("$.error.message").isEqualTo("'max_tokens' must be a number");

        verify(nimClient, never()).complete(any());
    }

    @Test
    void listsModels() {
        webTestClient.get().uri("/v1/models")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.object").isEqualTo("list")
                .jsonPath("$.data.length()").isEqualTo(9)
                .jsonPath("$.data[0].id").isEqualTo("gpt-3.5-turbo")
                .jsonPath("$.data[0].created").isEqualTo(1700000000)
                .jsonPath("$.data[0].owned_by").isEqualTo("nvidia-nim-proxy");
    }

    @Test
    void healthReportsConfiguration() {
        webTestClient.get().uri("/health")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.status").isEqualTo("ok")
                .jsonPath("$.reasoning_display").isEqualTo(true)
                .jsonPath("$.thinking_mode").isEqualTo(true)
                .jsonPath("$.api_key_set").isEqualTo(true);
    }

    @Test
    void unknownEndpointReturnsJson404() {
        webTestClient.get().uri("/v1/completions")
                .exchange()
                .expectStatus().isNotFound()
                .expectBody()
                .jsonPath("$.error.type").isEqualTo("not_found")
                .jsonPath("$.error.code").isEqualTo(404)
                .jsonPath("$.error.message").isEqualTo("Endpoint /v1/completions not supported");
    }
}
