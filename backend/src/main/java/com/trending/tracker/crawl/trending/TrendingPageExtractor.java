package com.trending.tracker.crawl.trending;

import com.trending.tracker.config.CrawlerProperties;
import com.trending.tracker.crawl.model.TrendingRepository;
import com.trending.tracker.crawl.util.CountParser;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.select.Elements;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.net.URISyntaxException;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads ranked repository entries out of a trending page.
 *
 * <p>Each {@code article.Box-row} is mapped on its own. An entry that cannot produce a valid
 * {@code owner/repo} identity is skipped and counted; it never fails the whole page. When no
 * entry container exists at all the extraction reports {@code structureFound = false}.
 */
@Component
public class TrendingPageExtractor {
    private static final Logger log = LoggerFactory.getLogger(TrendingPageExtractor.class);

    private static final String ENTRY_SELECTOR = "article.Box-row";
    private static final Pattern BACKGROUND_COLOR = Pattern.compile("background-color:\\s*([^;]+)");
    private static final Pattern STARS_TODAY = Pattern.compile("(\\d+(?:,\\d+)*)\\s+stars?\\s+today");

    private final String baseUrl;
    private final Clock clock;

    public TrendingPageExtractor(CrawlerProperties properties, Clock clock) {
        this.baseUrl = properties.getBaseUrl();
        this.clock = clock;
    }

    public TrendingExtraction extract(String html) {
        if (html == null || html.isBlank()) {
            log.warn("Empty trending page; page structure may have changed");
            return TrendingExtraction.missingStructure();
        }
        return extract(Jsoup.parse(html, baseUrl));
    }

    public TrendingExtraction extract(Document document) {
        Elements entries = document.select(ENTRY_SELECTOR);
        if (entries.isEmpty()) {
            log.warn("No {} entries found; page structure may have changed", ENTRY_SELECTOR);
            return TrendingExtraction.missingStructure();
        }

        Instant observedAt = clock.instant();
        List<TrendingRepository> repositories = new ArrayList<>(entries.size());
        int skipped = 0;
        int position = 0;
        for (Element entry : entries) {
            position++;
            try {
                repositories.add(parseEntry(entry, observedAt));
            } catch (MalformedEntryException e) {
                skipped++;
                log.debug("Skipping trending entry #{}: {}", position, e.getMessage());
            } catch (RuntimeException e) {
                skipped++;
                log.warn("Failed to parse trending entry #{}", position, e);
            }
        }
        log.info("Extracted {} repositories ({} skipped)", repositories.size(), skipped);
        return new TrendingExtraction(repositories, true, skipped);
    }

    TrendingRepository parseEntry(Element entry, Instant observedAt) {
        Element heading = entry.selectFirst("h2");
        if (heading == null) {
            throw new MalformedEntryException("missing title heading");
        }
        Element link = heading.selectFirst("a[href]");
        if (link == null) {
            throw new MalformedEntryException("missing title link");
        }
        String href = link.attr("href").trim();
        if (href.isEmpty()) {
            throw new MalformedEntryException("empty title link");
        }
        URI repoUri = resolve(href);
        if (repoUri == null) {
            throw new MalformedEntryException("unresolvable title link: " + href);
        }
        String path = repoUri.getPath() == null ? "" : stripSlashes(repoUri.getPath());
        String[] segments = path.split("/", -1);
        if (segments.length != 2 || segments[0].isBlank() || segments[1].isBlank()) {
            throw new MalformedEntryException("title link is not owner/repo: " + href);
        }
        String owner = segments[0];
        String repoName = segments[1];

        String description = null;
        Element descriptionElement = entry.selectFirst("p.col-9");
        if (descriptionElement != null && !descriptionElement.text().isBlank()) {
            description = descriptionElement.text().trim();
        }

        String language = null;
        String languageColor = null;
        Element languageElement = entry.selectFirst("span[itemprop=programmingLanguage]");
        if (languageElement != null && !languageElement.text().isBlank()) {
            language = languageElement.text().trim();
            languageColor = languageColor(entry, languageElement);
        }

        int stars = 0;
        int forks = 0;
        boolean starsSeen = false;
        boolean forksSeen = false;
        String stargazersPath = owner + "/" + repoName + "/stargazers";
        String forksPath = owner + "/" + repoName + "/forks";
        for (Element anchor : entry.select("a[href]")) {
            String target = linkPath(anchor.attr("href"));
            if (!starsSeen && target.equals(stargazersPath)) {
                stars = CountParser.parse(anchor.text());
                starsSeen = true;
            } else if (!forksSeen && target.equals(forksPath)) {
                forks = CountParser.parse(anchor.text());
                forksSeen = true;
            }
        }

        int starsToday = starsToday(entry);

        String avatarUrl = null;
        Element avatar = entry.selectFirst("img.avatar[src]");
        if (avatar != null) {
            URI avatarUri = resolve(avatar.attr("src").trim());
            avatarUrl = avatarUri == null ? null : avatarUri.toString();
        }

        return new TrendingRepository(
            owner + "/" + repoName,
            repoUri.toString(),
            description,
            stars,
            forks,
            language,
            languageColor,
            starsToday,
            starsToday,
            owner,
            repoName,
            avatarUrl,
            observedAt
        );
    }

    private String languageColor(Element entry, Element languageElement) {
        Element marker = null;
        for (Element sibling : languageElement.previousElementSiblings()) {
            if (sibling.hasClass("repo-language-color")) {
                marker = sibling;
                break;
            }
        }
        if (marker == null) {
            marker = entry.selectFirst("span.repo-language-color");
        }
        if (marker == null) {
            return null;
        }
        Matcher matcher = BACKGROUND_COLOR.matcher(marker.attr("style"));
        return matcher.find() ? matcher.group(1).trim() : null;
    }

    // The label reads "stars today" whatever range was requested.
    private int starsToday(Element entry) {
        Element counter = entry.selectFirst("span.d-inline-block.float-sm-right");
        if (counter == null) {
            return 0;
        }
        Matcher matcher = STARS_TODAY.matcher(counter.text());
        return matcher.find() ? CountParser.parse(matcher.group(1)) : 0;
    }

    private URI resolve(String href) {
        if (href == null || href.isBlank()) {
            return null;
        }
        try {
            URI resolved = new URI(baseUrl + "/").resolve(new URI(href));
            return resolved.getHost() == null ? null : resolved;
        } catch (URISyntaxException | IllegalArgumentException e) {
            return null;
        }
    }

    // Path of a link without surrounding slashes, or "" when it does not resolve.
    private String linkPath(String href) {
        URI uri = resolve(href == null ? null : href.trim());
        return uri == null || uri.getPath() == null ? "" : stripSlashes(uri.getPath());
    }

    private static String stripSlashes(String path) {
        int start = 0;
        int end = path.length();
        while (start < end && path.charAt(start) == '/') {
            start++;
        }
        while (end > start && path.charAt(end - 1) == '/') {
            end--;
        }
        return path.substring(start, end);
    }
}
