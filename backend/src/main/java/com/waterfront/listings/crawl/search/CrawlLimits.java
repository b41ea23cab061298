package com.waterfront.listings.crawl.search;

import com.waterfront.listings.config.CrawlerProperties;

/**
 * Bounds of one search crawl. A {@code maxPages} or {@code maxProperties} of 0 means unbounded.
 */
public record CrawlLimits(int maxPages, int maxProperties, int maxEmptyPages, int emptyPageGrace) {

    public CrawlLimits {
        maxPages = Math.max(0, maxPages);
        maxProperties = Math.max(0, maxProperties);
        maxEmptyPages = Math.max(1, maxEmptyPages);
        emptyPageGrace = Math.max(0, emptyPageGrace);
    }

    public static CrawlLimits from(CrawlerProperties.Search search) {
        return new CrawlLimits(
            search.getMaxPages(),
            search.getMaxProperties(),
            search.getMaxEmptyPages(),
            search.getEmptyPageGrace()
        );
    }

    public CrawlLimits withOverrides(Integer overrideMaxPages, Integer overrideMaxProperties) {
        return new CrawlLimits(
            overrideMaxPages == null ? maxPages : overrideMaxPages,
            overrideMaxProperties == null ? maxProperties : overrideMaxProperties,
            maxEmptyPages,
            emptyPageGrace
        );
    }

    public boolean pageLimitReached(int pagesVisited) {
        return maxPages > 0 && pagesVisited >= maxPages;
    }

    public boolean propertyLimitReached(int discovered) {
        return maxProperties > 0 && discovered >= maxProperties;
    }
}
