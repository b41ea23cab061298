package com.waterfront.listings.crawl.api;

import java.util.List;

public record ExtractionApiRunRequest(
    String searchUrl,
    List<String> urls,
    Integer maxPages,
    Integer maxProperties,
    Boolean reprocessCache
) {
}
