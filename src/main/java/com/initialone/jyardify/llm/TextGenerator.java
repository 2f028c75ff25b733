package com.initialone.jyardify.llm;

import java.util.Map;
import java.util.Optional;

/**
 * The text-generation collaborator: one prompt in, one free-form response out.
 *
 * <p>Retry, throttling and cost accounting are the implementation's business; callers treat any
 * {@link GenerationException} as "no directives obtained" for that file.
 */
public interface TextGenerator {

    String generate(String userPrompt, String systemPrompt) throws GenerationException;

    default String name() {
        return getClass().getSimpleName();
    }

    /** Request/cost counters for the run summary. */
    default Map<String, Object> stats() {
        return Map.of("provider", name());
    }

    /** Daily-quota check for a job of {@code requests} calls; empty when the provider has no daily cap. */
    default Optional<QuotaEstimate> estimateJob(int requests) {
        return Optional.empty();
    }
}
