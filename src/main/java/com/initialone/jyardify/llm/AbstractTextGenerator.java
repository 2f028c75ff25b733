package com.initialone.jyardify.llm;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.DoubleAdder;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Shared provider bookkeeping: requests-per-minute spacing, an optional daily cap, request counters
 * and a rough cost estimate (4 characters per token). Safe to call from many workers at once.
 */
public abstract class AbstractTextGenerator implements TextGenerator {

    private static final Logger log = LoggerFactory.getLogger(AbstractTextGenerator.class);

    protected final ProviderConfig config;

    private final ReentrantLock rateLimitLock = new ReentrantLock();
    private long lastRequestNanos;
    private long requestCount;
    private long dailyRequestCount;
    private final DoubleAdder estimatedCost = new DoubleAdder();

    protected AbstractTextGenerator(ProviderConfig config) {
        this.config = config;
    }

    @Override
    public final String generate(String userPrompt, String systemPrompt) throws GenerationException {
        enforceRateLimit();
        String out = doGenerate(userPrompt, systemPrompt);
        trackCost((systemPrompt == null ? "" : systemPrompt) + userPrompt, out == null ? "" : out);
        return out;
    }

    protected abstract String doGenerate(String userPrompt, String systemPrompt) throws GenerationException;

    @Override
    public String name() {
        return config.name;
    }

    @Override
    public Map<String, Object> stats() {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("provider", config.name);
        m.put("model", config.model);
        rateLimitLock.lock();
        try {
            m.put("requests", requestCount);
            m.put("daily_requests", dailyRequestCount);
        } finally {
            rateLimitLock.unlock();
        }
        double cost = estimatedCost.sum();
        m.put("estimated_cost", cost > 0 ? String.format(Locale.ROOT, "$%.4f", cost) : "N/A");
        return m;
    }

    @Override
    public Optional<QuotaEstimate> estimateJob(int requests) {
        if (config.requestsPerDay <= 0) return Optional.empty();
        long remaining;
        rateLimitLock.lock();
        try {
            remaining = Math.max(0, config.requestsPerDay - dailyRequestCount);
        } finally {
            rateLimitLock.unlock();
        }
        double minutes = config.requestsPerMinute > 0 ? (double) requests / config.requestsPerMinute : 0;
        return Optional.of(new QuotaEstimate(requests, remaining, minutes));
    }

    public void resetDailyCounter() {
        rateLimitLock.lock();
        try {
            dailyRequestCount = 0;
        } finally {
            rateLimitLock.unlock();
        }
        log.info("Reset daily counter for {}", config.name);
    }

    private void enforceRateLimit() throws GenerationException {
        rateLimitLock.lock();
        try {
            if (config.requestsPerDay > 0 && dailyRequestCount >= config.requestsPerDay) {
                throw new QuotaExceededException("Daily request limit (" + config.requestsPerDay + ") reached");
            }
            if (config.requestsPerMinute > 0 && lastRequestNanos != 0) {
                long spacing = 60_000_000_000L / config.requestsPerMinute;
                long wait = spacing - (System.nanoTime() - lastRequestNanos);
                if (wait > 0) {
                    log.debug("Rate limiting: sleeping for {} ms", wait / 1_000_000);
                    Thread.sleep(wait / 1_000_000, (int) (wait % 1_000_000));
                }
            }
            lastRequestNanos = System.nanoTime();
            requestCount++;
            dailyRequestCount++;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new GenerationException("interrupted while rate limiting", e);
        } finally {
            rateLimitLock.unlock();
        }
    }

    private void trackCost(String input, String output) {
        if (config.costPer1mInput <= 0 || config.costPer1mOutput <= 0) return;
        double cost = estimateTokens(input) * config.costPer1mInput / 1_000_000
                + estimateTokens(output) * config.costPer1mOutput / 1_000_000;
        estimatedCost.add(cost);
        log.debug("Request cost: ${} (total ${})", String.format(Locale.ROOT, "%.4f", cost),
                String.format(Locale.ROOT, "%.4f", estimatedCost.sum()));
    }

    static int estimateTokens(String text) {
        return text.length() / 4;
    }
}
