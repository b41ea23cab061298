package com.waterfront.listings.crawl.resolve;

/**
 * Where a field value came from, in resolver precedence order. {@link #FACTS_BLOCK} and
 * {@link #TOP_LEVEL} are set by the record builder before the resolver is consulted.
 */
public enum ResolutionSource {
    FACTS_BLOCK,
    TOP_LEVEL,
    KNOWN_PATH,
    RECURSIVE_SEARCH,
    CLEANED_TEXT,
    RAW_TEXT,
    PAGE_TEXT,
    DERIVED,
    NONE;

    public boolean isTextFallback() {
        return this == CLEANED_TEXT || this == RAW_TEXT || this == PAGE_TEXT;
    }
}
