package com.trending.tracker.crawl.service;

import com.trending.tracker.config.CrawlerProperties;
import com.trending.tracker.crawl.http.FixedRequestPacingPolicy;
import com.trending.tracker.crawl.http.PageFetcher;
import com.trending.tracker.crawl.http.RecordingSleeper;
import com.trending.tracker.crawl.http.RetryingPageFetcher;
import com.trending.tracker.crawl.model.CrawlStatus;
import com.trending.tracker.crawl.model.ProbeResult;
import com.trending.tracker.crawl.model.TrendingCrawlResult;
import com.trending.tracker.crawl.model.TrendingRange;
import com.trending.tracker.crawl.model.TrendingRepository;
import com.trending.tracker.crawl.trending.TrendingPageExtractor;
import com.trending.tracker.crawl.trending.TrendingPageFixtures;
import com.trending.tracker.crawl.util.ReasonCodeClassifier;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TrendingCrawlerServiceTest {
    private MockWebServer server;
    private ExecutorService executor;
    private CrawlerProperties properties;
    private TrendingCrawlerService service;

    @BeforeEach
    void setUp() throws Exception {
        server = new MockWebServer();
        server.start();
        executor = Executors.newFixedThreadPool(1);

        properties = new CrawlerProperties();
        properties.setBaseUrl(server.url("/").toString());
        properties.setRequestTimeoutSeconds(5);
        properties.setRequestMaxAttempts(3);
        properties.setRequestRetryBaseDelayMs(0);
        service = newService(properties);
    }

    @AfterEach
    void tearDown() throws Exception {
        if (server != null) {
            server.shutdown();
        }
        if (executor != null) {
            executor.shutdownNow();
        }
    }

    @Test
    void buildsLowerCasedLanguageUrlWithSinceQuery() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(200).setBody(TrendingPageFixtures.pageWithEntries(3)));

        TrendingCrawlResult result = service.fetch("Go", TrendingRange.WEEKLY, 10);

        RecordedRequest request = server.takeRequest(5, TimeUnit.SECONDS);
        assertThat(request).isNotNull();
        assertThat(request.getPath()).isEqualTo("/trending/go?since=weekly");
        assertThat(result.requestUrl()).endsWith("/trending/go?since=weekly");
        assertThat(result.status()).isEqualTo(CrawlStatus.OK);
        assertThat(result.repositories()).hasSize(3);
    }

    @Test
    void omitsLanguageSegmentWhenBlankAndEncodesSymbols() {
        String base = properties.getTrendingUrl();

        assertThat(service.buildTrendingUrl(null, TrendingRange.DAILY)).isEqualTo(base + "?since=daily");
        assertThat(service.buildTrendingUrl("  ", TrendingRange.MONTHLY)).isEqualTo(base + "?since=monthly");
        assertThat(service.buildTrendingUrl("C#", TrendingRange.DAILY)).isEqualTo(base + "/c%23?since=daily");
        assertThat(service.buildTrendingUrl("C++", null)).isEqualTo(base + "/c%2B%2B?since=daily");
    }

    @Test
    void truncatesToLimitInRankingOrder() {
        server.enqueue(new MockResponse().setResponseCode(200).setBody(TrendingPageFixtures.pageWithEntries(20)));

        TrendingCrawlResult result = service.fetch(null, TrendingRange.DAILY, 5);

        assertThat(result.status()).isEqualTo(CrawlStatus.OK);
        assertThat(result.repositories())
            .extracting(TrendingRepository::name)
            .containsExactly("owner-1/repo-1", "owner-2/repo-2", "owner-3/repo-3", "owner-4/repo-4", "owner-5/repo-5");
        assertThat(result.attempts()).isEqualTo(1);
    }

    @Test
    void reportsStructureChangeWithoutRetrying() {
        server.enqueue(new MockResponse().setResponseCode(200).setBody(TrendingPageFixtures.pageWithoutEntries()));

        TrendingCrawlResult result = service.fetch(null, TrendingRange.DAILY, 25);

        assertThat(result.isDegraded()).isTrue();
        assertThat(result.isFailed()).isFalse();
        assertThat(result.repositories()).isEmpty();
        assertThat(server.getRequestCount()).isEqualTo(1);
    }

    @Test
    void failsAfterRetriesAreExhausted() {
        for (int i = 0; i < 3; i++) {
            server.enqueue(new MockResponse().setResponseCode(502).setBody("bad gateway"));
        }

        TrendingCrawlResult result = service.fetch("rust", TrendingRange.DAILY, 25);

        assertThat(result.isFailed()).isTrue();
        assertThat(result.attempts()).isEqualTo(3);
        assertThat(server.getRequestCount()).isEqualTo(3);
        assertThat(result.failure().reasonCode()).isEqualTo(ReasonCodeClassifier.HTTP_5XX);
        assertThat(result.failure().statusCode()).isEqualTo(502);
        assertThat(result.failure().message()).contains("502");
    }

    @Test
    void rejectsLimitOutsideAllowedRange() {
        assertThatThrownBy(() -> service.fetch(null, TrendingRange.DAILY, 0))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> service.fetch(null, TrendingRange.DAILY, 101))
            .isInstanceOf(IllegalArgumentException.class);
        assertThat(server.getRequestCount()).isZero();
    }

    @Test
    void probeReportsReachableBaseAddress() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(200).setBody("<html></html>"));

        ProbeResult probe = service.probe();

        assertThat(probe.reachable()).isTrue();
        assertThat(probe.statusCode()).isEqualTo(200);
        assertThat(server.takeRequest(5, TimeUnit.SECONDS).getPath()).isEqualTo("/");
    }

    @Test
    void probeNeverThrowsOrRetriesForUnreachableAddress() throws Exception {
        server.shutdown();
        server = null;

        ProbeResult probe = service.probe();

        assertThat(probe.reachable()).isFalse();
        assertThat(probe.detail()).isNotBlank();
    }

    @Test
    void probeReportsErrorStatusAsUnreachable() {
        server.enqueue(new MockResponse().setResponseCode(503));
        server.enqueue(new MockResponse().setResponseCode(200));

        ProbeResult probe = service.probe();

        assertThat(probe.reachable()).isFalse();
        assertThat(probe.detail()).startsWith("HTTP 503");
        assertThat(server.getRequestCount()).isEqualTo(1);
    }

    @Test
    void supportedLanguagesIsAFixedCatalog() {
        assertThat(service.supportedLanguages()).contains("python", "go", "rust", "c++", "c#").hasSize(32);
        assertThatThrownBy(() -> service.supportedLanguages().add("cobol"))
            .isInstanceOf(UnsupportedOperationException.class);
    }

    private TrendingCrawlerService newService(CrawlerProperties crawlerProperties) {
        RecordingSleeper sleeper = new RecordingSleeper();
        FixedRequestPacingPolicy policy = FixedRequestPacingPolicy.noDelay();
        PageFetcher pageFetcher = new PageFetcher(crawlerProperties, executor, policy, sleeper);
        RetryingPageFetcher retrying = new RetryingPageFetcher(crawlerProperties, pageFetcher, policy, sleeper);
        TrendingPageExtractor extractor = new TrendingPageExtractor(crawlerProperties, Clock.systemUTC());
        return new TrendingCrawlerService(crawlerProperties, retrying, pageFetcher, extractor);
    }
}
