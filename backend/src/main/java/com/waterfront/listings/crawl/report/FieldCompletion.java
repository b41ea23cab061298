package com.waterfront.listings.crawl.report;

import com.waterfront.listings.crawl.resolve.ResolutionSource;

import java.util.Map;

public record FieldCompletion(
    String field,
    long found,
    long total,
    double percent,
    CompletionBucket bucket,
    Map<ResolutionSource, Long> sources
) {
    public FieldCompletion {
        sources = sources == null ? Map.of() : Map.copyOf(sources);
    }
}
