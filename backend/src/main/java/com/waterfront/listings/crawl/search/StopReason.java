package com.waterfront.listings.crawl.search;

public enum StopReason {
    PAGE_LIMIT,
    PROPERTY_LIMIT,
    EMPTY_STREAK,
    INTERRUPTED
}
