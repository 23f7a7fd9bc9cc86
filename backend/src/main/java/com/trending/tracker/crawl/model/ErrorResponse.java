package com.trending.tracker.crawl.model;

import java.time.Instant;

public record ErrorResponse(
    boolean success,
    String error,
    String message,
    String detail,
    Instant timestamp
) {}
