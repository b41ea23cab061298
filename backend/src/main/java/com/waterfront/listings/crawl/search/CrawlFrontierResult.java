package com.waterfront.listings.crawl.search;

import java.util.List;

/**
 * Outcome of walking one search: new detail URLs in discovery order, how many pages were
 * fetched and why the walk stopped.
 */
public record CrawlFrontierResult(
    List<String> urls,
    int pagesVisited,
    int knownSkipped,
    StopReason stopReason
) {
    public CrawlFrontierResult {
        urls = urls == null ? List.of() : List.copyOf(urls);
    }
}
