package com.trending.tracker.crawl.trending;

/**
 * Thrown when a single ranked entry lacks what a record needs; the entry is skipped.
 */
public class MalformedEntryException extends RuntimeException {
    public MalformedEntryException(String message) {
        super(message);
    }
}
