package com.trending.tracker.crawl.model;

public record TrendingQuery(String language, String since, Integer limit) {}
