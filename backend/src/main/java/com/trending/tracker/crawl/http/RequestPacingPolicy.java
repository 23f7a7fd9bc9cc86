package com.trending.tracker.crawl.http;

import java.time.Duration;

/**
 * Source of the randomized choices made while fetching: the pause before each request,
 * the user agent sent with it, and the jitter factor applied to retry backoff.
 */
public interface RequestPacingPolicy {

    Duration preRequestDelay();

    String userAgent();

    /**
     * @return a multiplier for the retry backoff, expected in {@code [0.5, 1.5]}
     */
    double backoffJitter();
}
