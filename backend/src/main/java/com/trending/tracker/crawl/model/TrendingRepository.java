package com.trending.tracker.crawl.model;

import java.time.Instant;

public record TrendingRepository(
    String name,
    String url,
    String description,
    int stars,
    int forks,
    String language,
    String languageColor,
    int starsToday,
    int periodStars,
    String owner,
    String repoName,
    String avatarUrl,
    Instant crawledAt
) {}
