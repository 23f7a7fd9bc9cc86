package com.trending.tracker.crawl.model;

import java.time.Instant;

public record HealthResponse(
    String status,
    Instant timestamp,
    String version,
    double uptimeSeconds,
    boolean githubAccessible,
    String detail
) {}
