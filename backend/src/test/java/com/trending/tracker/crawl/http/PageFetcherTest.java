package com.trending.tracker.crawl.http;

import com.trending.tracker.config.CrawlerProperties;
import com.trending.tracker.crawl.model.HttpFetchResult;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import okio.Buffer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.zip.GZIPOutputStream;

import static org.assertj.core.api.Assertions.assertThat;

class PageFetcherTest {
    private MockWebServer server;
    private ExecutorService executor;
    private RecordingSleeper sleeper;
    private CrawlerProperties properties;

    @BeforeEach
    void setUp() throws Exception {
        server = new MockWebServer();
        server.start();
        executor = Executors.newFixedThreadPool(1);
        sleeper = new RecordingSleeper();
        properties = new CrawlerProperties();
        properties.setRequestTimeoutSeconds(5);
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
    void pacesThenSendsBrowserLikeHeaders() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(200).setBody("<html>ok</html>"));
        RequestPacingPolicy policy = new FixedRequestPacingPolicy(Duration.ofMillis(3500), "agent-under-test", 1.0);
        PageFetcher fetcher = new PageFetcher(properties, executor, policy, sleeper);

        HttpFetchResult result = fetcher.fetchOnce(server.url("/trending?since=daily").toString());

        assertThat(result.isSuccessful()).isTrue();
        assertThat(result.body()).isEqualTo("<html>ok</html>");
        assertThat(sleeper.sleeps()).containsExactly(Duration.ofMillis(3500));

        RecordedRequest request = server.takeRequest(5, TimeUnit.SECONDS);
        assertThat(request).isNotNull();
        assertThat(request.getPath()).isEqualTo("/trending?since=daily");
        assertThat(request.getHeader("User-Agent")).isEqualTo("agent-under-test");
        assertThat(request.getHeader("Accept")).startsWith("text/html");
        assertThat(request.getHeader("Accept-Encoding")).isEqualTo("gzip");
        assertThat(request.getHeader("Accept-Language")).isNotBlank();
    }

    @Test
    void reportsNonOkStatusAsFailure() {
        server.enqueue(new MockResponse().setResponseCode(503).setBody("unavailable"));
        PageFetcher fetcher = new PageFetcher(properties, executor, FixedRequestPacingPolicy.noDelay(), sleeper);

        HttpFetchResult result = fetcher.fetchOnce(server.url("/trending").toString());

        assertThat(result.isSuccessful()).isFalse();
        assertThat(result.statusCode()).isEqualTo(503);
        assertThat(result.errorCode()).isNull();
        assertThat(result.describeFailure()).isEqualTo("HTTP 503: unavailable");
    }

    @Test
    void decodesGzipBodies() throws Exception {
        ByteArrayOutputStream compressed = new ByteArrayOutputStream();
        try (GZIPOutputStream gzip = new GZIPOutputStream(compressed)) {
            gzip.write("<html>compressed</html>".getBytes(StandardCharsets.UTF_8));
        }
        server.enqueue(new MockResponse()
            .setResponseCode(200)
            .setHeader("Content-Encoding", "gzip")
            .setBody(new Buffer().write(compressed.toByteArray())));
        PageFetcher fetcher = new PageFetcher(properties, executor, FixedRequestPacingPolicy.noDelay(), sleeper);

        HttpFetchResult result = fetcher.fetchOnce(server.url("/trending").toString());

        assertThat(result.isSuccessful()).isTrue();
        assertThat(result.body()).isEqualTo("<html>compressed</html>");
    }

    @Test
    void rejectsBodiesOverTheLimit() {
        properties.setMaxBodyBytes(1024);
        server.enqueue(new MockResponse().setResponseCode(200).setBody("a".repeat(5000)));
        PageFetcher fetcher = new PageFetcher(properties, executor, FixedRequestPacingPolicy.noDelay(), sleeper);

        HttpFetchResult result = fetcher.fetchOnce(server.url("/big").toString());

        assertThat(result.errorCode()).isEqualTo("body_too_large");
        assertThat(result.body()).isNull();
        assertThat(server.getRequestCount()).isEqualTo(1);
    }

    @Test
    void reportsTransportFailureWithoutThrowing() throws Exception {
        String url = server.url("/gone").toString();
        server.shutdown();
        server = null;
        PageFetcher fetcher = new PageFetcher(properties, executor, FixedRequestPacingPolicy.noDelay(), sleeper);

        HttpFetchResult result = fetcher.probe(url);

        assertThat(result.isSuccessful()).isFalse();
        assertThat(result.errorCode()).isIn("io_error", "timeout");
        assertThat(sleeper.sleeps()).isEmpty();
    }

    @Test
    void rejectsMalformedUrls() {
        PageFetcher fetcher = new PageFetcher(properties, executor, FixedRequestPacingPolicy.noDelay(), sleeper);

        HttpFetchResult result = fetcher.fetchOnce("http://");

        assertThat(result.errorCode()).isEqualTo("invalid_url");
        assertThat(result.statusCode()).isZero();
    }
}
