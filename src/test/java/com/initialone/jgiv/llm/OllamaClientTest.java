package com.initialone.jgiv.llm;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.initialone.jgiv.testsupport.http.OkHttpMockEngine;
import okhttp3.OkHttpClient;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class OllamaClientTest {

    private OkHttpMockEngine httpEngine;
    private OllamaClient client;

    @BeforeEach
    void setUp() {
        httpEngine = new OkHttpMockEngine();
        OkHttpClient http = new OkHttpClient.Builder().addInterceptor(httpEngine).build();
        client = new OllamaClient(http, "http://localhost:11434/", "qwen2.5:7b", 0.9, 256);
    }

    @Test
    void sendsNonStreamingChatRequest() throws Exception {
        httpEngine.enqueueJson(200, "{\"message\":{\"role\":\"assistant\",\"content\":\"Refactored parser\"}}");

        assertThat(client.summarize("diff here")).isEqualTo("Refactored parser");

        OkHttpMockEngine.CapturedRequest req = httpEngine.takeRequest();
        assertThat(req.url()).isEqualTo("http://localhost:11434/api/chat");
        JsonNode body = new ObjectMapper().readTree(req.body());
        assertThat(body.path("stream").asBoolean(true)).isFalse();
        assertThat(body.path("options").path("num_predict").asInt()).isEqualTo(256);
        assertThat(body.path("model").asText()).isEqualTo("qwen2.5:7b");
    }

    @Test
    void fallsBackToGenerateStyleResponseField() throws Exception {
        httpEngine.enqueueJson(200, "{\"response\":\"from generate\"}");

        assertThat(client.summarize("p")).isEqualTo("from generate");
    }

    @Test
    void blankReplyIsAnError() {
        httpEngine.enqueueJson(200, "{\"message\":{\"content\":\"  \"}}");

        assertThatThrownBy(() -> client.summarize("p")).isInstanceOf(IOException.class);
    }

    @Test
    void transportFailurePropagates() {
        httpEngine.enqueueFailure(new IOException("connection refused"));

        assertThatThrownBy(() -> client.summarize("p"))
                .isInstanceOf(IOException.class)
                .hasMessageContaining("connection refused");
    }
}
