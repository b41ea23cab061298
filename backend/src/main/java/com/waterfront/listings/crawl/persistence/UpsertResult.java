package com.waterfront.listings.crawl.persistence;

public record UpsertResult(
    String zpid,
    UpsertAction action,
    int satellitesWritten,
    int photosWritten
) {
}
