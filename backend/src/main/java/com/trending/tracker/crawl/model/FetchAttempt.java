package com.trending.tracker.crawl.model;

import java.time.Duration;

public record FetchAttempt(
    int attempt,
    int statusCode,
    String errorCode,
    String errorMessage,
    Duration backoff
) {}
