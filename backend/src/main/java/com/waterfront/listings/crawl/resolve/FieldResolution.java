package com.waterfront.listings.crawl.resolve;

import java.util.Optional;

public record FieldResolution(String field, FieldValue value, ResolutionSource source) {

    public static FieldResolution miss(String field) {
        return new FieldResolution(field, null, ResolutionSource.NONE);
    }

    public boolean found() {
        return value != null && source != ResolutionSource.NONE;
    }

    public Optional<FieldValue> optionalValue() {
        return Optional.ofNullable(value);
    }
}
