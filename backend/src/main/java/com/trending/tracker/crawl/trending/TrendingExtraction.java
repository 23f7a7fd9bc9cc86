package com.trending.tracker.crawl.trending;

import com.trending.tracker.crawl.model.TrendingRepository;

import java.util.List;

public record TrendingExtraction(List<TrendingRepository> repositories, boolean structureFound, int skippedEntries) {
    public TrendingExtraction {
        repositories = repositories == null ? List.of() : List.copyOf(repositories);
    }

    static TrendingExtraction missingStructure() {
        return new TrendingExtraction(List.of(), false, 0);
    }
}
