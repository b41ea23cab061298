package com.waterfront.listings.crawl.resolve;

import com.waterfront.listings.crawl.payload.ListingPayload;

import java.util.Optional;

/**
 * One step of the resolver cascade. Implementations return empty rather than an empty value.
 */
public interface ResolutionStrategy {

    ResolutionSource source();

    Optional<FieldValue> attempt(NameVariants variants, ListingPayload payload);

    /**
     * This strategy restricted to keys that equal a strong variant. Strategies that never match
     * loosely return themselves.
     */
    default ResolutionStrategy exactKeys() {
        return this;
    }
}
