package com.initialone.jyardify.llm;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

/** Picks a {@link TextGenerator} by provider name. Nothing downstream sees anything but the interface. */
public final class GeneratorFactory {

    private static final Logger log = LoggerFactory.getLogger(GeneratorFactory.class);

    private GeneratorFactory() {}

    /** Outcome of {@link #validateEnvironment}. */
    public static final class Validation {
        public final String provider;
        public final boolean valid;
        public final List<String> missing;
        public final List<String> warnings;

        Validation(String provider, boolean valid, List<String> missing, List<String> warnings) {
            this.provider = provider;
            this.valid = valid;
            this.missing = List.copyOf(missing);
            this.warnings = List.copyOf(warnings);
        }
    }

    public static TextGenerator create(LlmOptions opt) {
        String name = opt.resolvedProvider();
        ProviderConfig cfg = configFor(name);
        if (opt.model != null && !opt.model.isBlank()) cfg.model = opt.model;
        if (opt.endpoint != null && !opt.endpoint.isBlank()) cfg.baseUrl = opt.endpoint;
        if (opt.maxTokens != null) cfg.maxTokens = opt.maxTokens;
        if (opt.requestsPerMinute != null) cfg.requestsPerMinute = Math.max(0, opt.requestsPerMinute);
        cfg.timeoutSec = opt.timeoutSec;
        cfg.temperature = opt.temperature;

        log.info("Initializing {} provider ({})", name, cfg.model);
        switch (name) {
            case "openai":
            case "deepseek":
            case "local":
                return new OpenAiGenerator(cfg);
            case "anthropic":
                return new AnthropicGenerator(cfg);
            case "gemini":
                return new GeminiGenerator(cfg);
            case "mock":
                return new MockGenerator(cfg);
            default:
                throw new IllegalArgumentException("Unknown provider: " + name
                        + ". Supported providers: openai, anthropic, gemini, deepseek, local, mock");
        }
    }

    static ProviderConfig configFor(String name) {
        switch (name) {
            case "openai": return ProviderConfig.openAi();
            case "anthropic": return ProviderConfig.anthropic();
            case "gemini": return ProviderConfig.gemini();
            case "deepseek": return ProviderConfig.deepSeek();
            case "local": return ProviderConfig.local();
            case "mock": return ProviderConfig.mock();
            default: throw new IllegalArgumentException("Unknown provider: " + name);
        }
    }

    public static Validation validateEnvironment(String provider) {
        return validateEnvironment(provider, System::getenv);
    }

    static Validation validateEnvironment(String provider, Function<String, String> env) {
        String name = provider == null ? "openai" : provider.trim().toLowerCase();
        List<String> missing = new ArrayList<>();
        List<String> warnings = new ArrayList<>();
        boolean valid = false;
        switch (name) {
            case "openai":
                valid = require(env, "OPENAI_API_KEY", missing);
                if (valid) warnings.add("OpenAI will incur costs (~$0.50-2.00 per run)");
                break;
            case "anthropic":
                valid = require(env, "ANTHROPIC_API_KEY", missing);
                if (valid) warnings.add("Anthropic will incur costs (~$0.25-1.00 per run)");
                break;
            case "gemini":
                valid = present(env, "GEMINI_API_KEY") || present(env, "GOOGLE_API_KEY");
                if (valid) {
                    warnings.add("Gemini free tier allows about 150 requests per day at 8 per minute");
                } else {
                    missing.add("GEMINI_API_KEY");
                }
                break;
            case "deepseek":
                valid = require(env, "DEEPSEEK_API_KEY", missing);
                break;
            case "local":
                valid = true;
                break;
            case "mock":
                valid = true;
                warnings.add("Mock mode - no actual documentation will be generated");
                break;
            default:
                warnings.add("Unknown provider: " + name);
        }
        return new Validation(name, valid, missing, warnings);
    }

    private static boolean require(Function<String, String> env, String key, List<String> missing) {
        if (present(env, key)) return true;
        missing.add(key);
        return false;
    }

    private static boolean present(Function<String, String> env, String key) {
        String v = env.apply(key);
        return v != null && !v.isBlank();
    }

    /** Worker count matched to what each provider's rate limits tolerate. */
    public static int defaultWorkers(String provider) {
        if ("openai".equals(provider)) return 8;
        if ("anthropic".equals(provider)) return 4;
        return 1;
    }
}
