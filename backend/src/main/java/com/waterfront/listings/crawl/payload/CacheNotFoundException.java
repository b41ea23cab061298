package com.waterfront.listings.crawl.payload;

public class CacheNotFoundException extends PayloadExtractionException {

    public CacheNotFoundException(String message) {
        super(message);
    }

    public CacheNotFoundException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public String reasonCode() {
        return "cache_not_found";
    }
}
