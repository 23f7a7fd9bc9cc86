package com.trending.tracker.crawl.model;

import java.util.List;

public record FetchOutcome(HttpFetchResult result, List<FetchAttempt> failures) {
    public FetchOutcome {
        failures = failures == null ? List.of() : List.copyOf(failures);
    }

    public boolean isSuccessful() {
        return result != null && result.isSuccessful();
    }

    public int attempts() {
        return isSuccessful() ? failures.size() + 1 : failures.size();
    }
}
