package com.trending.tracker.crawl.model;

public record CrawlFailure(
    String reasonCode,
    int statusCode,
    String errorCode,
    String message
) {}
