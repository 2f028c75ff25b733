package com.initialone.jyardify.llm;

/**
 * Settings for one provider. The static factories carry each provider's defaults; {@link LlmOptions}
 * overrides them from the command line.
 */
public class ProviderConfig {
    public String name;
    public String model;
    public String apiKey;
    public String baseUrl;
    public int maxTokens = 4096;
    public double temperature = 0.0;
    public int timeoutSec = 180;

    /** 0 = unlimited */
    public int requestsPerMinute;
    /** 0 = unlimited */
    public int requestsPerDay;

    /** USD per million tokens; 0 disables cost tracking */
    public double costPer1mInput;
    public double costPer1mOutput;

    public static ProviderConfig openAi() {
        ProviderConfig c = new ProviderConfig();
        c.name = "openai";
        c.model = "gpt-4o-mini";
        c.apiKey = System.getenv("OPENAI_API_KEY");
        c.baseUrl = envOr("OPENAI_BASE_URL", "https://api.openai.com");
        c.maxTokens = 16384;
        c.requestsPerMinute = 400;
        c.costPer1mInput = 0.15;
        c.costPer1mOutput = 0.60;
        return c;
    }

    public static ProviderConfig anthropic() {
        ProviderConfig c = new ProviderConfig();
        c.name = "anthropic";
        c.model = "claude-3-haiku-20240307";
        c.apiKey = System.getenv("ANTHROPIC_API_KEY");
        c.baseUrl = envOr("ANTHROPIC_BASE_URL", "https://api.anthropic.com");
        c.maxTokens = 4096;
        c.requestsPerMinute = 50;
        c.costPer1mInput = 0.25;
        c.costPer1mOutput = 1.25;
        return c;
    }

    public static ProviderConfig deepSeek() {
        ProviderConfig c = new ProviderConfig();
        c.name = "deepseek";
        c.model = "deepseek-chat";
        c.apiKey = System.getenv("DEEPSEEK_API_KEY");
        c.baseUrl = envOr("DEEPSEEK_BASE_URL", "https://api.deepseek.com");
        c.maxTokens = 8192;
        c.requestsPerMinute = 60;
        c.costPer1mInput = 0.27;
        c.costPer1mOutput = 1.10;
        return c;
    }

    /** Free-tier limits; the published ones are higher but bursts near them get 429s. */
    public static ProviderConfig gemini() {
        ProviderConfig c = new ProviderConfig();
        c.name = "gemini";
        c.model = "gemini-2.0-flash-exp";
        c.apiKey = envOr("GEMINI_API_KEY", System.getenv("GOOGLE_API_KEY"));
        c.baseUrl = envOr("GEMINI_BASE_URL", "https://generativelanguage.googleapis.com");
        c.maxTokens = 8192;
        c.requestsPerMinute = 8;
        c.requestsPerDay = 150;
        return c;
    }

    /** Any OpenAI-compatible server (llama.cpp, vLLM, Ollama's /v1); key optional. */
    public static ProviderConfig local() {
        ProviderConfig c = new ProviderConfig();
        c.name = "local";
        c.model = "local-model";
        c.apiKey = System.getenv("LOCAL_LLM_API_KEY");
        c.baseUrl = "http://localhost:11434";
        c.maxTokens = 4096;
        return c;
    }

    public static ProviderConfig mock() {
        ProviderConfig c = new ProviderConfig();
        c.name = "mock";
        c.model = "mock-model";
        c.requestsPerDay = 1500;
        return c;
    }

    static String envOr(String key, String def) {
        String v = System.getenv(key);
        return (v == null || v.isBlank()) ? def : v;
    }
}
