package com.trending.tracker.crawl.model;

public enum CrawlStatus {
    OK,
    STRUCTURE_CHANGED,
    FAILED
}
