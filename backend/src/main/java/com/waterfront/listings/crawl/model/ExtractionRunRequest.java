package com.waterfront.listings.crawl.model;

import java.util.List;

/**
 * What to extract: a search to paginate, explicit detail URLs, or both. With
 * {@code reprocessCache} set, stored cache snapshots are rebuilt instead and nothing is fetched.
 */
public record ExtractionRunRequest(
    String searchUrl,
    List<String> urls,
    Integer maxPages,
    Integer maxProperties,
    Boolean reprocessCache
) {
    public ExtractionRunRequest {
        urls = urls == null ? List.of() : List.copyOf(urls);
    }

    public boolean reprocessRequested() {
        return Boolean.TRUE.equals(reprocessCache);
    }

    public boolean hasSearchUrl() {
        return searchUrl != null && !searchUrl.isBlank();
    }
}
