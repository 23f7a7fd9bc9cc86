package com.trending.tracker.crawl.http;

import com.trending.tracker.config.CrawlerProperties;
import com.trending.tracker.crawl.model.HttpFetchResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.Locale;
import java.util.concurrent.ExecutorService;
import java.util.zip.GZIPInputStream;

/**
 * Issues single GET requests against the trending site with browser-like headers.
 * Never throws for network or HTTP problems; failures come back as an {@link HttpFetchResult}
 * carrying either a non-200 status or an error code.
 */
@Service
public class PageFetcher {
    private static final Logger log = LoggerFactory.getLogger(PageFetcher.class);
    private static final int ERROR_EXCERPT_CHARS = 200;

    private final CrawlerProperties properties;
    private final HttpClient client;
    private final RequestPacingPolicy pacingPolicy;
    private final Sleeper sleeper;

    public PageFetcher(
        CrawlerProperties properties,
        @Qualifier("httpExecutor") ExecutorService httpExecutor,
        RequestPacingPolicy pacingPolicy,
        Sleeper sleeper
    ) {
        this.properties = properties;
        this.client = HttpClient.newBuilder()
            .followRedirects(HttpClient.Redirect.NORMAL)
            .connectTimeout(Duration.ofSeconds(properties.getRequestTimeoutSeconds()))
            .version(HttpClient.Version.HTTP_1_1)
            .executor(httpExecutor)
            .build();
        this.pacingPolicy = pacingPolicy;
        this.sleeper = sleeper;
    }

    /**
     * Waits the pacing delay, then performs one GET.
     */
    public HttpFetchResult fetchOnce(String url) {
        Instant startedAt = Instant.now();
        Duration delay = pacingPolicy.preRequestDelay();
        log.debug("Waiting {} ms before requesting {}", delay.toMillis(), url);
        try {
            sleeper.sleep(delay);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return errorResult(url, startedAt, "interrupted", "interrupted while pacing");
        }
        return execute(url);
    }

    /**
     * One GET without the pacing delay, used for reachability checks.
     */
    public HttpFetchResult probe(String url) {
        return execute(url);
    }

    private HttpFetchResult execute(String url) {
        Instant startedAt = Instant.now();
        URI uri = normalizeUri(url);
        if (uri == null || uri.getHost() == null) {
            return errorResult(url, startedAt, "invalid_url", "URL missing host or malformed");
        }

        try {
            HttpRequest request = HttpRequest.newBuilder(uri)
                .timeout(Duration.ofSeconds(properties.getRequestTimeoutSeconds()))
                .header("User-Agent", pacingPolicy.userAgent())
                .header("Accept", "text/html,application/xhtml+xml,application/xml;q=0.9,image/webp,*/*;q=0.8")
                .header("Accept-Language", "en-US,en;q=0.9")
                .header("Accept-Encoding", "gzip")
                .header("Cache-Control", "max-age=0")
                .header("Upgrade-Insecure-Requests", "1")
                .header("Sec-Fetch-Dest", "document")
                .header("Sec-Fetch-Mode", "navigate")
                .header("Sec-Fetch-Site", "none")
                .GET()
                .build();

            HttpResponse<InputStream> response = client.send(request, HttpResponse.BodyHandlers.ofInputStream());
            String contentEncoding = response.headers().firstValue("Content-Encoding").orElse(null);
            byte[] bytes = readBody(response.body(), contentEncoding);
            if (bytes == null) {
                return errorResult(url, startedAt, "body_too_large", "response exceeded " + properties.getMaxBodyBytes() + " bytes");
            }
            String body = new String(bytes, StandardCharsets.UTF_8);
            int status = response.statusCode();
            HttpFetchResult result = new HttpFetchResult(
                url,
                response.uri(),
                status,
                body,
                response.headers().firstValue("Content-Type").orElse(null),
                contentEncoding,
                Instant.now(),
                Duration.between(startedAt, Instant.now()),
                null,
                status == 200 ? null : excerpt(body)
            );
            log.debug("GET {} -> {} ({} chars, {} ms)", url, status, body.length(), result.duration().toMillis());
            return result;
        } catch (HttpTimeoutException e) {
            return errorResult(url, startedAt, "timeout", e.getMessage());
        } catch (IOException e) {
            return errorResult(url, startedAt, "io_error", describe(e));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return errorResult(url, startedAt, "interrupted", e.getMessage());
        } catch (Exception e) {
            return errorResult(url, startedAt, "http_error", describe(e));
        }
    }

    private byte[] readBody(InputStream stream, String contentEncoding) throws IOException {
        int maxBytes = properties.getMaxBodyBytes();
        byte[] raw;
        try (InputStream in = stream) {
            raw = in.readNBytes(maxBytes + 1);
        }
        if (raw.length > maxBytes) {
            return null;
        }
        if (!isGzip(contentEncoding, raw)) {
            return raw;
        }
        try (GZIPInputStream gzip = new GZIPInputStream(new ByteArrayInputStream(raw))) {
            byte[] decoded = gzip.readNBytes(maxBytes + 1);
            return decoded.length > maxBytes ? null : decoded;
        }
    }

    private boolean isGzip(String contentEncoding, byte[] raw) {
        if (contentEncoding != null && contentEncoding.toLowerCase(Locale.ROOT).contains("gzip")) {
            return true;
        }
        return raw.length >= 2
            && (raw[0] & 0xFF) == 0x1f
            && (raw[1] & 0xFF) == 0x8b;
    }

    private String excerpt(String body) {
        if (body == null) {
            return null;
        }
        String trimmed = body.strip();
        return trimmed.length() <= ERROR_EXCERPT_CHARS ? trimmed : trimmed.substring(0, ERROR_EXCERPT_CHARS);
    }

    private String describe(Exception e) {
        String message = e.getMessage();
        if ((message == null || message.isBlank()) && e.getCause() != null) {
            message = e.getCause().getClass().getSimpleName();
        }
        return message == null || message.isBlank() ? e.getClass().getSimpleName() : e.getClass().getSimpleName() + ": " + message;
    }

    private HttpFetchResult errorResult(String url, Instant startedAt, String code, String message) {
        return new HttpFetchResult(
            url,
            null,
            0,
            null,
            null,
            null,
            Instant.now(),
            Duration.between(startedAt, Instant.now()),
            code,
            message
        );
    }

    private URI normalizeUri(String input) {
        if (input == null || input.isBlank()) {
            return null;
        }
        String value = input.trim();
        if (!value.startsWith("http://") && !value.startsWith("https://")) {
            value = "https://" + value;
        }
        try {
            return new URI(value);
        } catch (URISyntaxException e) {
            return null;
        }
    }
}
