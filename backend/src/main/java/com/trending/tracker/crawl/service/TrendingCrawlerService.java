package com.trending.tracker.crawl.service;

import com.trending.tracker.config.CrawlerProperties;
import com.trending.tracker.crawl.http.PageFetcher;
import com.trending.tracker.crawl.http.RetryingPageFetcher;
import com.trending.tracker.crawl.model.CrawlFailure;
import com.trending.tracker.crawl.model.FetchOutcome;
import com.trending.tracker.crawl.model.HttpFetchResult;
import com.trending.tracker.crawl.model.ProbeResult;
import com.trending.tracker.crawl.model.TrendingCrawlResult;
import com.trending.tracker.crawl.model.TrendingRange;
import com.trending.tracker.crawl.model.TrendingRepository;
import com.trending.tracker.crawl.trending.TrendingExtraction;
import com.trending.tracker.crawl.trending.TrendingPageExtractor;
import com.trending.tracker.crawl.util.ReasonCodeClassifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Locale;

@Service
public class TrendingCrawlerService {
    private static final Logger log = LoggerFactory.getLogger(TrendingCrawlerService.class);

    private static final List<String> SUPPORTED_LANGUAGES = List.of(
        "python", "javascript", "java", "typescript", "c++", "c", "c#",
        "go", "rust", "php", "ruby", "swift", "kotlin", "dart", "scala",
        "r", "matlab", "shell", "powershell", "html", "css", "vue",
        "react", "angular", "node.js", "express", "django", "flask",
        "spring", "laravel", "rails", "asp.net"
    );

    private final CrawlerProperties properties;
    private final RetryingPageFetcher retryingPageFetcher;
    private final PageFetcher pageFetcher;
    private final TrendingPageExtractor extractor;

    public TrendingCrawlerService(
        CrawlerProperties properties,
        RetryingPageFetcher retryingPageFetcher,
        PageFetcher pageFetcher,
        TrendingPageExtractor extractor
    ) {
        this.properties = properties;
        this.retryingPageFetcher = retryingPageFetcher;
        this.pageFetcher = pageFetcher;
        this.extractor = extractor;
    }

    /**
     * Fetches the trending page for {@code language} (any language when blank) and returns at most
     * {@code limit} repositories in ranking order.
     *
     * @throws IllegalArgumentException when {@code limit} is outside {@code [1, api.maxLimit]}
     */
    public TrendingCrawlResult fetch(String language, TrendingRange since, int limit) {
        int maxLimit = properties.getApi().getMaxLimit();
        if (limit < 1 || limit > maxLimit) {
            throw new IllegalArgumentException("limit must be between 1 and " + maxLimit + ": " + limit);
        }
        TrendingRange range = since == null ? TrendingRange.DAILY : since;
        String url = buildTrendingUrl(language, range);
        log.info("Crawling trending page {} (limit={})", url, limit);

        FetchOutcome outcome = retryingPageFetcher.fetch(url);
        if (!outcome.isSuccessful()) {
            HttpFetchResult last = outcome.result();
            CrawlFailure failure = new CrawlFailure(
                ReasonCodeClassifier.classify(last),
                last == null ? 0 : last.statusCode(),
                last == null ? null : last.errorCode(),
                last == null ? "no response" : last.describeFailure()
            );
            log.error("Trending crawl of {} failed after {} attempts: {}", url, outcome.attempts(), failure.message());
            return TrendingCrawlResult.failed(url, outcome.attempts(), failure);
        }

        TrendingExtraction extraction = extractor.extract(outcome.result().body());
        if (!extraction.structureFound()) {
            log.warn("Trending page {} returned no repository list; reporting degraded result", url);
            return TrendingCrawlResult.structureChanged(url, outcome.attempts());
        }

        List<TrendingRepository> repositories = extraction.repositories();
        if (repositories.size() > limit) {
            repositories = repositories.subList(0, limit);
        }
        log.info("Crawled {} repositories from {}", repositories.size(), url);
        return TrendingCrawlResult.ok(url, repositories, outcome.attempts(), extraction.skippedEntries());
    }

    public String buildTrendingUrl(String language, TrendingRange since) {
        StringBuilder url = new StringBuilder(properties.getTrendingUrl());
        if (language != null && !language.isBlank()) {
            url.append('/').append(encodePathSegment(language.trim().toLowerCase(Locale.ROOT)));
        }
        TrendingRange range = since == null ? TrendingRange.DAILY : since;
        url.append("?since=").append(range.queryValue());
        return url.toString();
    }

    /**
     * One unpaced request to the base address. Never retries and never throws.
     */
    public ProbeResult probe() {
        String url = properties.getBaseUrl();
        try {
            HttpFetchResult result = pageFetcher.probe(url);
            if (result.isSuccessful()) {
                return new ProbeResult(true, null, result.statusCode(), result.duration());
            }
            log.warn("Probe of {} failed: {}", url, result.describeFailure());
            return new ProbeResult(false, result.describeFailure(), result.statusCode(), result.duration());
        } catch (RuntimeException e) {
            log.warn("Probe of {} failed", url, e);
            String detail = e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
            return new ProbeResult(false, detail, 0, Duration.ZERO);
        }
    }

    public List<String> supportedLanguages() {
        return SUPPORTED_LANGUAGES;
    }

    private static String encodePathSegment(String segment) {
        return URLEncoder.encode(segment, StandardCharsets.UTF_8).replace("+", "%20");
    }
}
