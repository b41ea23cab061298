package com.waterfront.listings.crawl.service;

import com.waterfront.listings.crawl.model.ListingOutcome;
import com.waterfront.listings.crawl.model.ListingRecord;

/**
 * Outcome of one listing task; {@code record} is null unless the listing was stored.
 */
public record ProcessedListing(ListingOutcome outcome, ListingRecord record) {

    public static ProcessedListing of(ListingOutcome outcome) {
        return new ProcessedListing(outcome, null);
    }
}
