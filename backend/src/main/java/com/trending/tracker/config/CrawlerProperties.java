package com.trending.tracker.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

@ConfigurationProperties(prefix = "crawler")
public class CrawlerProperties {
    private static final String DEFAULT_BASE_URL = "https://github.com";
    private static final List<String> DEFAULT_USER_AGENTS = List.of(
        "Mozilla/5.0 (Macintosh; Intel Mac OS X 10_15_7) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/120.0.0.0 Safari/537.36",
        "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/120.0.0.0 Safari/537.36",
        "Mozilla/5.0 (Macintosh; Intel Mac OS X 10_15_7) AppleWebKit/605.1.15 (KHTML, like Gecko) Version/17.1 Safari/605.1.15",
        "Mozilla/5.0 (Windows NT 10.0; Win64; x64; rv:109.0) Gecko/20100101 Firefox/121.0",
        "Mozilla/5.0 (X11; Linux x86_64) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/120.0.0.0 Safari/537.36"
    );

    private String baseUrl = DEFAULT_BASE_URL;
    private String trendingUrl;
    private int requestTimeoutSeconds = 30;
    private int requestMaxAttempts = 3;
    private int requestRetryBaseDelayMs = 5000;
    private int requestRetryMaxDelayMs = 60000;
    private int minDelayMs = 3000;
    private int maxDelayMs = 8000;
    private int maxBodyBytes = 5 * 1024 * 1024;
    private int httpThreads = 4;
    private List<String> userAgents = new ArrayList<>(DEFAULT_USER_AGENTS);
    private Api api = new Api();

    public String getBaseUrl() {
        return stripTrailingSlash(baseUrl == null || baseUrl.isBlank() ? DEFAULT_BASE_URL : baseUrl.trim());
    }

    public void setBaseUrl(String baseUrl) {
        this.baseUrl = baseUrl;
    }

    public String getTrendingUrl() {
        if (trendingUrl == null || trendingUrl.isBlank()) {
            return getBaseUrl() + "/trending";
        }
        return stripTrailingSlash(trendingUrl.trim());
    }

    public void setTrendingUrl(String trendingUrl) {
        this.trendingUrl = trendingUrl;
    }

    public int getRequestTimeoutSeconds() {
        return Math.max(1, requestTimeoutSeconds);
    }

    public void setRequestTimeoutSeconds(int requestTimeoutSeconds) {
        this.requestTimeoutSeconds = Math.max(1, requestTimeoutSeconds);
    }

    public int getRequestMaxAttempts() {
        return Math.max(1, requestMaxAttempts);
    }

    public void setRequestMaxAttempts(int requestMaxAttempts) {
        this.requestMaxAttempts = Math.max(1, requestMaxAttempts);
    }

    public int getRequestRetryBaseDelayMs() {
        return Math.max(0, requestRetryBaseDelayMs);
    }

    public void setRequestRetryBaseDelayMs(int requestRetryBaseDelayMs) {
        this.requestRetryBaseDelayMs = Math.max(0, requestRetryBaseDelayMs);
    }

    public int getRequestRetryMaxDelayMs() {
        return requestRetryMaxDelayMs;
    }

    public void setRequestRetryMaxDelayMs(int requestRetryMaxDelayMs) {
        this.requestRetryMaxDelayMs = requestRetryMaxDelayMs;
    }

    public int getMinDelayMs() {
        return Math.max(0, minDelayMs);
    }

    public void setMinDelayMs(int minDelayMs) {
        this.minDelayMs = Math.max(0, minDelayMs);
    }

    public int getMaxDelayMs() {
        return Math.max(getMinDelayMs(), maxDelayMs);
    }

    public void setMaxDelayMs(int maxDelayMs) {
        this.maxDelayMs = Math.max(0, maxDelayMs);
    }

    public int getMaxBodyBytes() {
        return Math.max(1024, maxBodyBytes);
    }

    public void setMaxBodyBytes(int maxBodyBytes) {
        this.maxBodyBytes = Math.max(1024, maxBodyBytes);
    }

    public int getHttpThreads() {
        return Math.max(1, httpThreads);
    }

    public void setHttpThreads(int httpThreads) {
        this.httpThreads = Math.max(1, httpThreads);
    }

    public List<String> getUserAgents() {
        return normalizeUserAgents(userAgents);
    }

    public void setUserAgents(List<String> userAgents) {
        this.userAgents = userAgents == null ? new ArrayList<>() : new ArrayList<>(userAgents);
    }

    public Api getApi() {
        return api;
    }

    public void setApi(Api api) {
        this.api = api;
    }

    public static List<String> normalizeUserAgents(List<String> candidates) {
        List<String> normalized = new ArrayList<>();
        if (candidates != null) {
            for (String candidate : candidates) {
                if (candidate != null && !candidate.isBlank()) {
                    normalized.add(candidate.trim());
                }
            }
        }
        if (normalized.isEmpty()) {
            return DEFAULT_USER_AGENTS;
        }
        return List.copyOf(normalized);
    }

    private static String stripTrailingSlash(String url) {
        String value = url;
        while (value.endsWith("/")) {
            value = value.substring(0, value.length() - 1);
        }
        return value;
    }

    public static class Api {
        private int defaultLimit = 25;
        private int maxLimit = 100;
        private String version = "1.0.0";

        public int getDefaultLimit() {
            return Math.max(1, Math.min(defaultLimit, getMaxLimit()));
        }

        public void setDefaultLimit(int defaultLimit) {
            this.defaultLimit = Math.max(1, defaultLimit);
        }

        public int getMaxLimit() {
            return Math.max(1, maxLimit);
        }

        public void setMaxLimit(int maxLimit) {
            this.maxLimit = Math.max(1, maxLimit);
        }

        public String getVersion() {
            return version;
        }

        public void setVersion(String version) {
            this.version = version;
        }
    }
}
