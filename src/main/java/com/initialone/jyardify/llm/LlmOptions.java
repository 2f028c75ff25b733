package com.initialone.jyardify.llm;

import picocli.CommandLine;

// Mixed into every command that talks to a provider
public class LlmOptions {

    @CommandLine.Option(names = "--provider",
            description = "openai | anthropic | gemini | deepseek | local | mock (default: $LLM_PROVIDER or openai)")
    public String provider; // null -> LLM_PROVIDER

    @CommandLine.Option(names = "--model",
            description = "Model name; each provider has its own default")
    public String model;

    @CommandLine.Option(
            names = "--endpoint",
            description = "Override base URL, e.g. https://api.openai.com or http://localhost:11434"
    )
    public String endpoint;

    @CommandLine.Option(names = "--timeout-sec", defaultValue = "180",
            description = "HTTP read/call timeout seconds")
    public int timeoutSec;

    @CommandLine.Option(names = "--max-tokens",
            description = "Response token limit; provider default when absent")
    public Integer maxTokens;

    @CommandLine.Option(names = "--temperature", defaultValue = "0.0",
            description = "Sampling temperature")
    public double temperature;

    @CommandLine.Option(names = "--requests-per-minute",
            description = "Client-side request spacing; provider default when absent, 0 = unlimited")
    public Integer requestsPerMinute;

    /** Explicit option, then LLM_PROVIDER, then openai. */
    public String resolvedProvider() {
        if (provider != null && !provider.isBlank()) return provider.trim().toLowerCase();
        return ProviderConfig.envOr("LLM_PROVIDER", "openai").trim().toLowerCase();
    }
}
