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
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Google Gemini {@code generateContent} client. The system prompt is prepended to the user prompt,
 * and safety filtering is relaxed to high-only since source code trips the defaults.
 */
public class GeminiGenerator extends AbstractTextGenerator {

    private static final Logger log = LoggerFactory.getLogger(GeminiGenerator.class);
    private static final MediaType JSON = MediaType.parse("application/json");
    static final List<String> SAFETY_CATEGORIES = List.of(
            "HARM_CATEGORY_HARASSMENT",
            "HARM_CATEGORY_HATE_SPEECH",
            "HARM_CATEGORY_SEXUALLY_EXPLICIT",
            "HARM_CATEGORY_DANGEROUS_CONTENT");

    private final OkHttpClient http;
    private final ObjectMapper om = new ObjectMapper();

    public GeminiGenerator(ProviderConfig config) {
        super(config);
        if (config.apiKey == null || config.apiKey.isBlank()) {
            throw new IllegalStateException("[gemini] GEMINI_API_KEY missing");
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
        String fullPrompt = systemPrompt == null || systemPrompt.isBlank()
                ? userPrompt
                : systemPrompt + "\n\n" + userPrompt;

        Map<String, Object> generationConfig = new LinkedHashMap<>();
        generationConfig.put("maxOutputTokens", Math.max(1, config.maxTokens));
        generationConfig.put("temperature", config.temperature);

        List<Map<String, String>> safety = new ArrayList<>();
        for (String category : SAFETY_CATEGORIES) {
            safety.add(Map.of("category", category, "threshold", "BLOCK_ONLY_HIGH"));
        }

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("contents", List.of(Map.of(
                "role", "user",
                "parts", List.of(Map.of("text", fullPrompt)))));
        payload.put("generationConfig", generationConfig);
        payload.put("safetySettings", safety);

        Request req;
        try {
            req = new Request.Builder()
                    .url(generateUrl(config.baseUrl, config.model))
                    .header("x-goog-api-key", config.apiKey)
                    .header("Content-Type", "application/json")
                    .post(RequestBody.create(om.writeValueAsString(payload), JSON))
                    .build();
        } catch (IOException e) {
            throw new GenerationException("cannot encode request", e);
        }

        log.info("Sending request to Gemini ({})", config.model);
        int attempts = 0;
        while (true) {
            attempts++;
            try (Response resp = http.newCall(req).execute()) {
                String body = resp.body() == null ? "" : resp.body().string();
                if (!resp.isSuccessful()) {
                    int code = resp.code();
                    if (OpenAiGenerator.shouldRetry(code) && attempts < OpenAiGenerator.MAX_ATTEMPTS) {
                        log.warn("Gemini returned {}; retrying (attempt {}/{})", code, attempts, OpenAiGenerator.MAX_ATTEMPTS);
                        OpenAiGenerator.sleepBackoff(resp.headers(), attempts);
                        continue;
                    }
                    if (code == 429 || body.contains("RESOURCE_EXHAUSTED")) {
                        throw new QuotaExceededException("Gemini quota or rate limit exceeded after " + attempts
                                + " attempts (daily limit " + config.requestsPerDay + ")");
                    }
                    throw new GenerationException("Gemini error " + code + ": " + OpenAiGenerator.safeTrim(body));
                }
                return extractContent(body);
            } catch (IOException ioe) {
                if (attempts < OpenAiGenerator.MAX_ATTEMPTS) {
                    OpenAiGenerator.sleepBackoff(null, attempts);
                    continue;
                }
                throw new GenerationException("Gemini IO error: " + ioe.getMessage(), ioe);
            }
        }
    }

    private String extractContent(String body) throws GenerationException {
        JsonNode root;
        try {
            root = om.readTree(body);
        } catch (IOException e) {
            throw new GenerationException("Unreadable Gemini response: " + OpenAiGenerator.safeTrim(body), e);
        }
        JsonNode candidate = root.path("candidates").path(0);
        if (candidate.isMissingNode()) {
            String reason = root.path("promptFeedback").path("blockReason").asText("no candidates");
            throw new GenerationException("Gemini returned no content: " + reason);
        }
        StringBuilder sb = new StringBuilder();
        for (JsonNode part : candidate.path("content").path("parts")) {
            sb.append(part.path("text").asText(""));
        }
        if (sb.toString().isBlank()) {
            throw new GenerationException("Empty content in Gemini response (finishReason="
                    + candidate.path("finishReason").asText("unknown") + ")");
        }
        return sb.toString();
    }

    static String generateUrl(String baseUrl, String model) {
        String base = baseUrl == null || baseUrl.isBlank() ? "https://generativelanguage.googleapis.com" : baseUrl;
        if (base.endsWith("/")) base = base.substring(0, base.length() - 1);
        if (!base.endsWith("/v1beta") && !base.endsWith("/v1")) base = base + "/v1beta";
        return base + "/models/" + model + ":generateContent";
    }
}
