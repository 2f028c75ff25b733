package com.initialone.jyardify.llm;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/** Anthropic Messages API client. The system prompt travels in the top-level {@code system} field. */
public class AnthropicGenerator extends AbstractTextGenerator {

    private static final Logger log = LoggerFactory.getLogger(AnthropicGenerator.class);
    private static final MediaType JSON = MediaType.parse("application/json");
    static final String API_VERSION = "2023-06-01";

    private final OkHttpClient http;
    private final ObjectMapper om = new ObjectMapper();

    public AnthropicGenerator(ProviderConfig config) {
        super(config);
        if (config.apiKey == null || config.apiKey.isBlank()) {
            throw new IllegalStateException("[anthropic] ANTHROPIC_API_KEY missing");
        }
        int timeout = Math.max(1, config.timeoutSec);
        this.http = new OkHttpClient.Builder()
                .connectTimeout(30, TimeUnit.SECONDS)
                .writeTimeout(timeout, TimeUnit.SECONDS)
                .readTimeout(timeout, TimeUnit.SECONDS)
                .callTimeout(timeout + 30L, TimeUnit.SECONDS)
                .retryOnConnectionFailure(true)
                .build();
    }

    @Override
    protected String doGenerate(String userPrompt, String systemPrompt) throws GenerationException {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("model", config.model);
        payload.put("max_tokens", Math.max(1, config.maxTokens));
        payload.put("temperature", config.temperature);
        if (systemPrompt != null && !systemPrompt.isBlank()) {
            payload.put("system", systemPrompt);
        }
        payload.put("messages", List.of(Map.of("role", "user", "content", userPrompt)));

        Request req;
        try {
            req = new Request.Builder()
                    .url(messagesUrl(config.baseUrl))
                    .header("x-api-key", config.apiKey)
                    .header("anthropic-version", API_VERSION)
                    .header("Content-Type", "application/json")
                    .post(RequestBody.create(om.writeValueAsString(payload), JSON))
                    .build();
        } catch (IOException e) {
            throw new GenerationException("cannot encode request", e);
        }

        log.info("Sending request to Claude ({})", config.model);
        int attempts = 0;
        while (true) {
            attempts++;
            try (Response resp = http.newCall(req).execute()) {
                String body = resp.body() == null ? "" : resp.body().string();
                if (!resp.isSuccessful()) {
                    int code = resp.code();
                    if (OpenAiGenerator.shouldRetry(code) && attempts < OpenAiGenerator.MAX_ATTEMPTS) {
                        OpenAiGenerator.sleepBackoff(resp.headers(), attempts);
                        continue;
                    }
                    if (code == 429) {
                        throw new QuotaExceededException("Anthropic rate limit exceeded after " + attempts + " attempts");
                    }
                    throw new GenerationException("Anthropic error " + code + ": " + OpenAiGenerator.safeTrim(body));
                }
                return extractContent(body);
            } catch (IOException ioe) {
                if (attempts < OpenAiGenerator.MAX_ATTEMPTS) {
                    OpenAiGenerator.sleepBackoff(null, attempts);
                    continue;
                }
                throw new GenerationException("Anthropic IO error: " + ioe.getMessage(), ioe);
            }
        }
    }

    private String extractContent(String body) throws GenerationException {
        JsonNode root;
        try {
            root = om.readTree(body);
        } catch (IOException e) {
            throw new GenerationException("Unreadable Anthropic response: " + OpenAiGenerator.safeTrim(body), e);
        }
        String text = root.path("content").path(0).path("text").asText("");
        if (text.isBlank()) throw new GenerationException("Empty content in Anthropic response");
        JsonNode usage = root.path("usage");
        if (!usage.isMissingNode()) {
            log.info("Claude response: {} input tokens, {} output tokens",
                    usage.path("input_tokens").asInt(), usage.path("output_tokens").asInt());
        }
        return text;
    }

    static String messagesUrl(String baseUrl) {
        String base = baseUrl == null || baseUrl.isBlank() ? "https://api.anthropic.com" : baseUrl;
        if (base.endsWith("/")) base = base.substring(0, base.length() - 1);
        return base.endsWith("/v1") ? base + "/messages" : base + "/v1/messages";
    }
}
