package com.initialone.jgiv.llm;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Protocol;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;

import java.io.IOException;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Chat Completions client for OpenAI, DeepSeek and local OpenAI-compatible
 * servers (LM Studio, llama.cpp, vLLM).
 */
public class OpenAiCompatClient implements SummarizationClient {
    private static final MediaType MEDIA_JSON = MediaType.parse("application/json");

    private final OkHttpClient http;
    private final ObjectMapper om = new ObjectMapper();

    private final String url;
    private final String apiKey;   // optional for local servers
    private final String model;
    private final double temperature;
    private final int maxTokens;

    public OpenAiCompatClient(OkHttpClient http, String baseUrl, String apiKey, String model,
                              double temperature, int maxTokens) {
        this.http = http;
        this.url = chatUrl(baseUrl);
        this.apiKey = apiKey == null || apiKey.isBlank() ? null : apiKey;
        this.model = model;
        this.temperature = temperature;
        this.maxTokens = Math.max(1, maxTokens);
    }

    /** Every call is bounded by {@code timeoutSec} end to end. */
    public static OkHttpClient newHttpClient(int timeoutSec) {
        int t = Math.max(1, timeoutSec);
        return new OkHttpClient.Builder()
                .connectTimeout(Math.min(20, t), TimeUnit.SECONDS)
                .writeTimeout(t, TimeUnit.SECONDS)
                .readTimeout(t, TimeUnit.SECONDS)
                .callTimeout(t, TimeUnit.SECONDS)
                .retryOnConnectionFailure(true)
                .protocols(Arrays.asList(Protocol.HTTP_2, Protocol.HTTP_1_1))
                .build();
    }

    /** Accepts a bare host, a ".../v1" base, or the full completions URL. */
    static String chatUrl(String base) {
        String b = LlmText.stripTrailingSlash(base);
        if (b.endsWith("/chat/completions")) return b;
        if (b.endsWith("/v1")) return b + "/chat/completions";
        return b + "/v1/chat/completions";
    }

    public String url() {
        return url;
    }

    @Override
    public String summarize(String prompt) throws IOException {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("model", model);
        payload.put("messages", List.of(
                Map.of("role", "system", "content", LlmText.SYSTEM_PROMPT),
                Map.of("role", "user", "content", prompt)
        ));
        payload.put("temperature", temperature);
        payload.put("max_tokens", maxTokens);

        Request.Builder rb = new Request.Builder()
                .url(url)
                .header("Content-Type", "application/json")
                .header("Accept", "application/json")
                .post(RequestBody.create(om.writeValueAsString(payload), MEDIA_JSON));
        if (apiKey != null) rb.header("Authorization", "Bearer " + apiKey);

        try (Response resp = http.newCall(rb.build()).execute()) {
            String body = resp.body() != null ? resp.body().string() : "";
            if (!resp.isSuccessful()) {
                throw new IOException("LLM HTTP " + resp.code() + " from " + url + ": " + LlmText.safeTrim(body));
            }
            JsonNode root = om.readTree(body);
            JsonNode choices = root.path("choices");
            if (!choices.isArray() || choices.size() == 0) {
                throw new IOException("no choices in LLM response: " + LlmText.safeTrim(body));
            }
            String content = choices.get(0).path("message").path("content").asText("");
            if (content.isBlank()) {
                throw new IOException("empty content in LLM response");
            }
            return LlmText.stripOuterFence(content);
        }
    }
}
