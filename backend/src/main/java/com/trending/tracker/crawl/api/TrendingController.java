package com.trending.tracker.crawl.api;

import com.trending.tracker.config.CrawlerProperties;
import com.trending.tracker.crawl.model.HealthResponse;
import com.trending.tracker.crawl.model.ProbeResult;
import com.trending.tracker.crawl.model.TrendingCrawlResult;
import com.trending.tracker.crawl.model.TrendingQuery;
import com.trending.tracker.crawl.model.TrendingRange;
import com.trending.tracker.crawl.model.TrendingResponse;
import com.trending.tracker.crawl.service.TrendingCrawlException;
import com.trending.tracker.crawl.service.TrendingCrawlerService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

@RestController
@RequestMapping("/api/trending")
public class TrendingController {
    private final TrendingCrawlerService crawlerService;
    private final CrawlerProperties crawlerProperties;
    private final Clock clock;
    private final Instant startedAt;

    public TrendingController(
        TrendingCrawlerService crawlerService,
        CrawlerProperties crawlerProperties,
        Clock clock
    ) {
        this.crawlerService = crawlerService;
        this.crawlerProperties = crawlerProperties;
        this.clock = clock;
        this.startedAt = clock.instant();
    }

    @GetMapping
    public TrendingResponse getTrending(
        @RequestParam(name = "language", required = false) String language,
        @RequestParam(name = "since", required = false, defaultValue = "daily") String since,
        @RequestParam(name = "limit", required = false) Integer limit
    ) {
        return crawl(language, since, limit);
    }

    @GetMapping("/languages/supported")
    public List<String> supportedLanguages() {
        return crawlerService.supportedLanguages();
    }

    @GetMapping("/health")
    public HealthResponse health() {
        ProbeResult probe = crawlerService.probe();
        Instant now = clock.instant();
        double uptimeSeconds = Duration.between(startedAt, now).toMillis() / 1000.0;
        return new HealthResponse(
            probe.reachable() ? "healthy" : "unhealthy",
            now,
            crawlerProperties.getApi().getVersion(),
            uptimeSeconds,
            probe.reachable(),
            probe.detail()
        );
    }

    @PostMapping("/refresh")
    public TrendingResponse refresh(@RequestBody(required = false) TrendingQuery query) {
        if (query == null) {
            return crawl(null, null, null);
        }
        return crawl(query.language(), query.since(), query.limit());
    }

    @GetMapping("/{language}")
    public TrendingResponse getTrendingByLanguage(
        @PathVariable("language") String language,
        @RequestParam(name = "since", required = false, defaultValue = "daily") String since,
        @RequestParam(name = "limit", required = false) Integer limit
    ) {
        return crawl(language, since, limit);
    }

    private TrendingResponse crawl(String language, String since, Integer limit) {
        TrendingRange range = TrendingRange.fromQueryValue(since);
        int safeLimit = limit == null ? crawlerProperties.getApi().getDefaultLimit() : limit;
        TrendingCrawlResult result = crawlerService.fetch(language, range, safeLimit);
        if (result.isFailed()) {
            throw new TrendingCrawlException(result);
        }
        return new TrendingResponse(
            true,
            result.repositories(),
            result.repositories().size(),
            language == null || language.isBlank() ? null : language,
            range.queryValue(),
            result.isDegraded(),
            clock.instant()
        );
    }
}
