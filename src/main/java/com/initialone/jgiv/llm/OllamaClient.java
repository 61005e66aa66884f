package com.initialone.jgiv.llm;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Local Ollama server, non-streaming /api/chat. */
public class OllamaClient implements SummarizationClient {
    private static final MediaType MEDIA_JSON = MediaType.parse("application/json");

    private final OkHttpClient http;
    private final ObjectMapper om = new ObjectMapper();

    private final String endpoint;
    private final String model;
    private final double temperature;
    private final int maxTokens;

    public OllamaClient(OkHttpClient http, String endpoint, String model, double temperature, int maxTokens) {
        this.http = http;
        this.endpoint = LlmText.stripTrailingSlash(endpoint);
        this.model = model;
        this.temperature = temperature;
        this.maxTokens = maxTokens;
    }

    @Override
    public String summarize(String prompt) throws IOException {
        Map<String, Object> options = new LinkedHashMap<>();
        options.put("temperature", temperature);
        if (maxTokens > 0) options.put("num_predict", maxTokens);

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("model", model);
        payload.put("messages", List.of(
                Map.of("role", "system", "content", LlmText.SYSTEM_PROMPT),
                Map.of("role", "user", "content", prompt)
        ));
        payload.put("options", options);
        payload.put("stream", false);

        Request req = new Request.Builder()
                .url(endpoint + "/api/chat")
                .header("Content-Type", "application/json")
                .post(RequestBody.create(om.writeValueAsString(payload), MEDIA_JSON))
                .build();

        try (Response resp = http.newCall(req).execute()) {
            String body = resp.body() != null ? resp.body().string() : "";
            if (!resp.isSuccessful()) {
                throw new IOException("ollama HTTP " + resp.code() + ": " + LlmText.safeTrim(body));
            }
            JsonNode root = om.readTree(body);
            JsonNode content = root.path("message").path("content");
            if (content.isMissingNode() || content.isNull()) content = root.path("response");
            String text = content.asText("");
            if (text.isBlank()) {
                throw new IOException("empty content in ollama response");
            }
            return LlmText.stripOuterFence(text);
        }
    }
}
