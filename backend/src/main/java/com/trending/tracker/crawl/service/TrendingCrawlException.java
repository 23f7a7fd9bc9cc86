package com.trending.tracker.crawl.service;

import com.trending.tracker.crawl.model.TrendingCrawlResult;

public class TrendingCrawlException extends RuntimeException {
    private final TrendingCrawlResult result;

    public TrendingCrawlException(TrendingCrawlResult result) {
        super("Failed to fetch trending data from " + result.requestUrl());
        this.result = result;
    }

    public TrendingCrawlResult getResult() {
        return result;
    }
}
