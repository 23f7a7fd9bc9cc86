package com.trending.tracker.crawl.model;

import java.util.List;

public record TrendingCrawlResult(
    CrawlStatus status,
    String requestUrl,
    List<TrendingRepository> repositories,
    int attempts,
    int skippedEntries,
    CrawlFailure failure
) {
    public TrendingCrawlResult {
        repositories = repositories == null ? List.of() : List.copyOf(repositories);
    }

    public static TrendingCrawlResult ok(String requestUrl, List<TrendingRepository> repositories, int attempts, int skippedEntries) {
        return new TrendingCrawlResult(CrawlStatus.OK, requestUrl, repositories, attempts, skippedEntries, null);
    }

    public static TrendingCrawlResult structureChanged(String requestUrl, int attempts) {
        return new TrendingCrawlResult(CrawlStatus.STRUCTURE_CHANGED, requestUrl, List.of(), attempts, 0, null);
    }

    public static TrendingCrawlResult failed(String requestUrl, int attempts, CrawlFailure failure) {
        return new TrendingCrawlResult(CrawlStatus.FAILED, requestUrl, List.of(), attempts, 0, failure);
    }

    public boolean isFailed() {
        return status == CrawlStatus.FAILED;
    }

    public boolean isDegraded() {
        return status == CrawlStatus.STRUCTURE_CHANGED;
    }
}
