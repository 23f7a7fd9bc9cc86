package com.trending.tracker.crawl.model;

import java.time.Instant;
import java.util.List;

public record TrendingResponse(
    boolean success,
    List<TrendingRepository> repositories,
    int totalCount,
    String language,
    String since,
    boolean degraded,
    Instant crawledAt
) {}
