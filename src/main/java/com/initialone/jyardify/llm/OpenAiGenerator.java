package com.initialone.jyardify.llm;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import okhttp3.Headers;
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
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;

/**
 * Chat Completions client for OpenAI and OpenAI-compatible servers (DeepSeek, local gateways).
 *
 * <p>408/429/5xx and I/O errors are retried with exponential backoff, honoring {@code Retry-After}.
 * An {@code insufficient_quota} error is not retried.
 */
public class OpenAiGenerator extends AbstractTextGenerator {

    private static final Logger log = LoggerFactory.getLogger(OpenAiGenerator.class);
    private static final MediaType JSON = MediaType.parse("application/json");
    static final int MAX_ATTEMPTS = 3;

    private final OkHttpClient http;
    private final ObjectMapper om = new ObjectMapper();
    private final boolean keyRequired;

    public OpenAiGenerator(ProviderConfig config) {
        this(config, !"local".equals(config.name));
    }

    public OpenAiGenerator(ProviderConfig config, boolean keyRequired) {
        super(config);
        this.keyRequired = keyRequired;
        if (keyRequired && (config.apiKey == null || config.apiKey.isBlank())) {
            throw new IllegalStateException("[" + config.name + "] API key missing");
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
        List<Map<String, String>> messages = new ArrayList<>();
        if (systemPrompt != null && !systemPrompt.isBlank()) {
            messages.add(Map.of("role", "system", "content", systemPrompt));
        }
        messages.add(Map.of("role", "user", "content", userPrompt));

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("model", config.model);
        payload.put("temperature", config.temperature);
        payload.put("max_tokens", Math.max(1, config.maxTokens));
        payload.put("messages", messages);

        Request.Builder rb = new Request.Builder()
                .url(chatUrl(config.baseUrl))
                .header("Content-Type", "application/json")
                .header("Accept", "application/json");
        if (config.apiKey != null && !config.apiKey.isBlank()) {
            rb.header("Authorization", "Bearer " + config.apiKey);
        }
        Request req;
        try {
            req = rb.post(RequestBody.create(om.writeValueAsString(payload), JSON)).build();
        } catch (IOException e) {
            throw new GenerationException("cannot encode request", e);
        }

        log.info("Sending request to {} ({})", config.name, config.model);
        int attempts = 0;
        while (true) {
            attempts++;
            try (Response resp = http.newCall(req).execute()) {
                String body = resp.body() == null ? "" : resp.body().string();
                if (!resp.isSuccessful()) {
                    int code = resp.code();
                    if (body.contains("insufficient_quota")) {
                        throw new QuotaExceededException(config.name + " API quota exceeded. Please check your account balance.");
                    }
                    if (shouldRetry(code) && attempts < MAX_ATTEMPTS) {
                        sleepBackoff(resp.headers(), attempts);
                        continue;
                    }
                    if (code == 429) {
                        throw new QuotaExceededException(config.name + " rate limit exceeded after " + attempts + " attempts");
                    }
                    throw new GenerationException(config.name + " error " + code + ": " + safeTrim(body));
                }
                return extractContent(body);
            } catch (IOException ioe) {
                if (attempts < MAX_ATTEMPTS) {
                    sleepBackoff(null, attempts);
                    continue;
                }
                throw new GenerationException(config.name + " IO error: " + ioe.getMessage(), ioe);
            }
        }
    }

    private String extractContent(String body) throws GenerationException {
        try {
            JsonNode root = om.readTree(body);
            JsonNode content = root.path("choices").path(0).path("message").path("content");
            if (content.isMissingNode() || content.isNull()) {
                // some gateways still answer in the legacy completions shape
                content = root.path("choices").path(0).path("text");
            }
            String text = content.asText("");
            if (text.isBlank()) throw new GenerationException("Empty content in " + config.name + " response");
            return text;
        } catch (IOException e) {
            throw new GenerationException("Unreadable " + config.name + " response: " + safeTrim(body), e);
        }
    }

    /* ===== helpers ===== */

    static String chatUrl(String baseUrl) {
        String base = baseUrl == null || baseUrl.isBlank() ? "https://api.openai.com" : baseUrl;
        if (base.endsWith("/")) base = base.substring(0, base.length() - 1);
        return base.endsWith("/v1") ? base + "/chat/completions" : base + "/v1/chat/completions";
    }

    static boolean shouldRetry(int code) {
        return code == 408 || code == 429 || code >= 500;
    }

    static void sleepBackoff(Headers headers, int attempts) throws GenerationException {
        long delayMs = -1;
        if (headers != null) {
            String ra = headers.get("Retry-After");
            if (ra != null) {
                try {
                    delayMs = (long) (Double.parseDouble(ra) * 1000L);
                } catch (NumberFormatException e) {
                    log.debug("Ignoring non-numeric Retry-After: {}", ra);
                }
            }
        }
        if (delayMs < 0) {
            delayMs = (long) (500L * Math.pow(2, attempts - 1)) + ThreadLocalRandom.current().nextInt(250);
        }
        delayMs = Math.min(delayMs, 10_000L);
        try {
            Thread.sleep(delayMs);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new GenerationException("interrupted during retry backoff", ie);
        }
    }

    static String safeTrim(String s) {
        s = s == null ? "" : s.replaceAll("\\s+", " ");
        return s.length() > 300 ? s.substring(0, 300) + "..." : s;
    }

    boolean isKeyRequired() {
        return keyRequired;
    }
}
