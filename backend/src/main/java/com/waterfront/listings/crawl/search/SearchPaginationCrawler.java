package com.waterfront.listings.crawl.search;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.waterfront.listings.config.CrawlerProperties;
import com.waterfront.listings.crawl.http.BoundedFetcher;
import com.waterfront.listings.crawl.model.FetchResult;
import com.waterfront.listings.crawl.persistence.DedupIndex;
import com.waterfront.listings.crawl.util.ListingUrls;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Walks search-result pages and collects listing URLs that are neither repeated within the walk
 * nor already stored.
 *
 * <p>A page that yields no URLs, or that fails to fetch, extends the empty streak. A page whose
 * URLs were all seen before only extends it past {@code emptyPageGrace}, since adjacent pages
 * routinely repeat boundary listings. Any new URL resets the streak.
 */
@Service
public class SearchPaginationCrawler {
    private static final Logger log = LoggerFactory.getLogger(SearchPaginationCrawler.class);

    private final BoundedFetcher fetcher;
    private final SearchResultUrlExtractor extractor;
    private final SearchPageUrls pageUrls;
    private final long pageDelayMs;
    private final PageDelay pageDelay;

    @Autowired
    public SearchPaginationCrawler(
        BoundedFetcher fetcher,
        SearchResultUrlExtractor extractor,
        ObjectMapper objectMapper,
        CrawlerProperties properties
    ) {
        this(fetcher, extractor, objectMapper, properties.getSearch().getPageDelayMs(), Thread::sleep);
    }

    SearchPaginationCrawler(
        BoundedFetcher fetcher,
        SearchResultUrlExtractor extractor,
        ObjectMapper objectMapper,
        long pageDelayMs,
        PageDelay pageDelay
    ) {
        this.fetcher = fetcher;
        this.extractor = extractor;
        this.pageUrls = new SearchPageUrls(objectMapper);
        this.pageDelayMs = Math.max(0, pageDelayMs);
        this.pageDelay = pageDelay;
    }

    public CrawlFrontierResult crawl(String searchUrl, CrawlLimits limits, DedupIndex index) {
        List<String> discovered = new ArrayList<>();
        Set<String> seenUrls = new HashSet<>();
        Set<String> seenZpids = new HashSet<>();
        int pagesVisited = 0;
        int knownSkipped = 0;
        int emptyStreak = 0;
        int page = 1;

        log.info("Search crawl starting: {} (maxPages={}, maxProperties={})",
            searchUrl, limits.maxPages(), limits.maxProperties());

        while (true) {
            if (limits.pageLimitReached(pagesVisited)) {
                return finish(discovered, pagesVisited, knownSkipped, StopReason.PAGE_LIMIT);
            }
            if (emptyStreak >= limits.maxEmptyPages()) {
                return finish(discovered, pagesVisited, knownSkipped, StopReason.EMPTY_STREAK);
            }
            if (Thread.currentThread().isInterrupted() || !pauseBetweenPages(page)) {
                return finish(discovered, pagesVisited, knownSkipped, StopReason.INTERRUPTED);
            }

            String pageUrl = pageUrls.pageUrl(searchUrl, page);
            FetchResult result = fetcher.fetch(pageUrl);
            pagesVisited++;
            if (!result.isSuccessful()) {
                emptyStreak++;
                log.warn("Search page {} failed ({}): {}", page, result.errorCode(), result.errorMessage());
                page++;
                continue;
            }

            SearchResultUrlExtractor.ExtractedUrls extracted = extractor.extract(result.content());
            if (extracted.urls().isEmpty()) {
                emptyStreak++;
                log.info("Search page {} had no listing URLs (empty streak {}/{})", page, emptyStreak, limits.maxEmptyPages());
                page++;
                continue;
            }

            int fresh = 0;
            for (String url : extracted.urls()) {
                if (!seenUrls.add(url)) {
                    continue;
                }
                String zpid = ListingUrls.zpidOf(url);
                if (zpid != null && !seenZpids.add(zpid)) {
                    continue;
                }
                if (index.contains(zpid)) {
                    knownSkipped++;
                    continue;
                }
                discovered.add(url);
                fresh++;
                if (limits.propertyLimitReached(discovered.size())) {
                    return finish(discovered, pagesVisited, knownSkipped, StopReason.PROPERTY_LIMIT);
                }
            }

            if (fresh > 0) {
                emptyStreak = 0;
            } else if (page > limits.emptyPageGrace()) {
                emptyStreak++;
            }
            log.info("Search page {}: {} URLs via {}, {} new, {} total (empty streak {})",
                page, extracted.urls().size(), extracted.tier(), fresh, discovered.size(), emptyStreak);
            page++;
        }
    }

    private boolean pauseBetweenPages(int page) {
        if (page <= 1 || pageDelayMs == 0) {
            return true;
        }
        try {
            pageDelay.pause(pageDelayMs);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private CrawlFrontierResult finish(List<String> discovered, int pagesVisited, int knownSkipped, StopReason reason) {
        log.info("Search crawl stopped ({}): {} pages, {} new URLs, {} already stored",
            reason, pagesVisited, discovered.size(), knownSkipped);
        return new CrawlFrontierResult(discovered, pagesVisited, knownSkipped, reason);
    }

    @FunctionalInterface
    interface PageDelay {
        void pause(long millis) throws InterruptedException;
    }
}
