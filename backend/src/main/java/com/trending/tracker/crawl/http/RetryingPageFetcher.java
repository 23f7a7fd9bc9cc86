package com.trending.tracker.crawl.http;

import com.trending.tracker.config.CrawlerProperties;
import com.trending.tracker.crawl.model.FetchAttempt;
import com.trending.tracker.crawl.model.FetchOutcome;
import com.trending.tracker.crawl.model.HttpFetchResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

@Service
public class RetryingPageFetcher {
    private static final Logger log = LoggerFactory.getLogger(RetryingPageFetcher.class);

    private final CrawlerProperties properties;
    private final PageFetcher pageFetcher;
    private final RequestPacingPolicy pacingPolicy;
    private final Sleeper sleeper;

    public RetryingPageFetcher(
        CrawlerProperties properties,
        PageFetcher pageFetcher,
        RequestPacingPolicy pacingPolicy,
        Sleeper sleeper
    ) {
        this.properties = properties;
        this.pageFetcher = pageFetcher;
        this.pacingPolicy = pacingPolicy;
        this.sleeper = sleeper;
    }

    /**
     * Fetches {@code url}, retrying failed attempts with exponential backoff.
     * The outcome holds either the successful result or the last failure once attempts run out.
     */
    public FetchOutcome fetch(String url) {
        int maxAttempts = properties.getRequestMaxAttempts();
        List<FetchAttempt> failures = new ArrayList<>();
        HttpFetchResult lastResult = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            lastResult = pageFetcher.fetchOnce(url);
            if (lastResult.isSuccessful()) {
                if (attempt > 1) {
                    log.info("Fetched {} on attempt {}/{}", url, attempt, maxAttempts);
                }
                return new FetchOutcome(lastResult, failures);
            }
            boolean retryable = shouldRetry(lastResult) && attempt < maxAttempts;
            if (!retryable) {
                failures.add(toAttempt(attempt, lastResult, Duration.ZERO));
                log.error(
                    "Giving up on {} after attempt {}/{}: {}",
                    url,
                    attempt,
                    maxAttempts,
                    lastResult.describeFailure()
                );
                return new FetchOutcome(lastResult, failures);
            }
            Duration backoff = backoffFor(attempt - 1);
            failures.add(toAttempt(attempt, lastResult, backoff));
            log.warn(
                "Fetch of {} failed (attempt {}/{}): {}; retrying in {} ms",
                url,
                attempt,
                maxAttempts,
                lastResult.describeFailure(),
                backoff.toMillis()
            );
            try {
                sleeper.sleep(backoff);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Interrupted while backing off from {}", url);
                return new FetchOutcome(interruptedResult(url, lastResult), failures);
            }
        }
        return new FetchOutcome(lastResult, failures);
    }

    /**
     * {@code base * 2^attemptIndex * jitter}, capped by the configured maximum when it is positive.
     */
    Duration backoffFor(int attemptIndex) {
        long baseDelayMs = properties.getRequestRetryBaseDelayMs();
        if (baseDelayMs <= 0) {
            return Duration.ZERO;
        }
        double delay = baseDelayMs * Math.pow(2, Math.max(0, attemptIndex)) * pacingPolicy.backoffJitter();
        int maxDelayMs = properties.getRequestRetryMaxDelayMs();
        if (maxDelayMs > 0) {
            delay = Math.min(delay, maxDelayMs);
        }
        return Duration.ofMillis(Math.max(0L, (long) delay));
    }

    private boolean shouldRetry(HttpFetchResult result) {
        String errorCode = result.errorCode();
        if (errorCode != null && !errorCode.isBlank()) {
            return !errorCode.equals("invalid_url") && !errorCode.equals("interrupted");
        }
        return true;
    }

    private HttpFetchResult interruptedResult(String url, HttpFetchResult previous) {
        return new HttpFetchResult(
            url,
            null,
            0,
            null,
            null,
            null,
            Instant.now(),
            previous.duration(),
            "interrupted",
            "interrupted while backing off after " + previous.describeFailure()
        );
    }

    private FetchAttempt toAttempt(int attempt, HttpFetchResult result, Duration backoff) {
        return new FetchAttempt(attempt, result.statusCode(), result.errorCode(), result.errorMessage(), backoff);
    }
}
