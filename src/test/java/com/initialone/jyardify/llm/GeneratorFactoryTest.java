package com.initialone.jyardify.llm;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class GeneratorFactoryTest {

    @Test
    void validationReportsMissingKeys() {
        GeneratorFactory.Validation v = GeneratorFactory.validateEnvironment("anthropic", k -> null);

        assertFalse(v.valid);
        assertEquals(java.util.List.of("ANTHROPIC_API_KEY"), v.missing);
    }

    @Test
    void validationWithKeyWarnsAboutCost() {
        GeneratorFactory.Validation v = GeneratorFactory.validateEnvironment("openai",
                Map.of("OPENAI_API_KEY", "sk-1")::get);

        assertTrue(v.valid);
        assertTrue(v.missing.isEmpty());
        assertEquals(1, v.warnings.size());
    }

    @Test
    void mockAndLocalNeedNoKey() {
        assertTrue(GeneratorFactory.validateEnvironment("mock", k -> null).valid);
        assertTrue(GeneratorFactory.validateEnvironment("LOCAL", k -> null).valid);
    }

    @Test
    void unknownProviderIsInvalid() {
        GeneratorFactory.Validation v = GeneratorFactory.validateEnvironment("Cohere", k -> null);

        assertFalse(v.valid);
        assertEquals("cohere", v.provider);
        assertTrue(v.warnings.get(0).contains("cohere"));
    }

    @Test
    void geminiAcceptsEitherKey() {
        GeneratorFactory.Validation none = GeneratorFactory.validateEnvironment("gemini", k -> null);
        assertFalse(none.valid);
        assertEquals(java.util.List.of("GEMINI_API_KEY"), none.missing);

        GeneratorFactory.Validation google = GeneratorFactory.validateEnvironment("gemini",
                Map.of("GOOGLE_API_KEY", "g-1")::get);
        assertTrue(google.valid);
        assertTrue(google.missing.isEmpty());
        assertEquals(1, google.warnings.size());
    }

    @Test
    void createsGeminiWithDailyCap() {
        LlmOptions opt = new LlmOptions();
        opt.provider = "gemini";
        opt.timeoutSec = 30;

        ProviderConfig cfg = GeneratorFactory.configFor("gemini");
        assertEquals(150, cfg.requestsPerDay);
        assertEquals(8, cfg.requestsPerMinute);
        if (cfg.apiKey == null || cfg.apiKey.isBlank()) {
            assertThrows(IllegalStateException.class, () -> GeneratorFactory.create(opt));
        } else {
            assertTrue(GeneratorFactory.create(opt) instanceof GeminiGenerator);
        }
    }

    @Test
    void createsMockWithOverrides() {
        LlmOptions opt = new LlmOptions();
        opt.provider = "mock";
        opt.model = "mock-2";
        opt.timeoutSec = 30;
        opt.requestsPerMinute = 0;

        TextGenerator g = GeneratorFactory.create(opt);

        assertTrue(g instanceof MockGenerator);
        assertEquals("mock", g.name());
        assertEquals("mock-2", g.stats().get("model"));
    }

    @Test
    void unknownProviderCannotBeCreated() {
        LlmOptions opt = new LlmOptions();
        opt.provider = "nope";

        assertThrows(IllegalArgumentException.class, () -> GeneratorFactory.create(opt));
    }

    @Test
    void defaultWorkersFollowProviderLimits() {
        assertEquals(8, GeneratorFactory.defaultWorkers("openai"));
        assertEquals(4, GeneratorFactory.defaultWorkers("anthropic"));
        assertEquals(1, GeneratorFactory.defaultWorkers("deepseek"));
        assertEquals(1, GeneratorFactory.defaultWorkers("gemini"));
        assertEquals(1, GeneratorFactory.defaultWorkers("mock"));
    }
}
