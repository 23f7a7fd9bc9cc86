package com.trending.tracker.crawl.http;

import com.trending.tracker.config.CrawlerProperties;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.ThreadLocalRandom;

public class RandomRequestPacingPolicy implements RequestPacingPolicy {
    static final double MIN_JITTER = 0.5;
    static final double MAX_JITTER = 1.5;

    private final long minDelayMs;
    private final long maxDelayMs;
    private final List<String> userAgents;

    public RandomRequestPacingPolicy(CrawlerProperties properties) {
        this(properties.getMinDelayMs(), properties.getMaxDelayMs(), properties.getUserAgents());
    }

    public RandomRequestPacingPolicy(long minDelayMs, long maxDelayMs, List<String> userAgents) {
        this.minDelayMs = Math.max(0, minDelayMs);
        this.maxDelayMs = Math.max(this.minDelayMs, maxDelayMs);
        this.userAgents = CrawlerProperties.normalizeUserAgents(userAgents);
    }

    @Override
    public Duration preRequestDelay() {
        if (maxDelayMs == minDelayMs) {
            return Duration.ofMillis(minDelayMs);
        }
        return Duration.ofMillis(ThreadLocalRandom.current().nextLong(minDelayMs, maxDelayMs + 1));
    }

    @Override
    public String userAgent() {
        return userAgents.get(ThreadLocalRandom.current().nextInt(userAgents.size()));
    }

    @Override
    public double backoffJitter() {
        return ThreadLocalRandom.current().nextDouble(MIN_JITTER, MAX_JITTER);
    }
}
