package com.trending.tracker.crawl.model;

import java.time.Duration;

public record ProbeResult(boolean reachable, String detail, int statusCode, Duration latency) {}
