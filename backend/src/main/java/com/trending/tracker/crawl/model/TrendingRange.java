package com.trending.tracker.crawl.model;

import java.util.Locale;

public enum TrendingRange {
    DAILY("daily"),
    WEEKLY("weekly"),
    MONTHLY("monthly");

    private final String queryValue;

    TrendingRange(String queryValue) {
        this.queryValue = queryValue;
    }

    public String queryValue() {
        return queryValue;
    }

    public static TrendingRange fromQueryValue(String raw) {
        if (raw == null || raw.isBlank()) {
            return DAILY;
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        for (TrendingRange range : values()) {
            if (range.queryValue.equals(normalized)) {
                return range;
            }
        }
        throw new IllegalArgumentException("since must be one of daily, weekly, monthly: " + raw);
    }
}
