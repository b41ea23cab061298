package com.waterfront.listings.crawl.model;

import java.time.Duration;
import java.time.Instant;

public record FetchResult(
    String requestedUrl,
    int statusCode,
    String content,
    Instant fetchedAt,
    Duration duration,
    String errorCode,
    String errorMessage
) {
    public static FetchResult success(String url, int statusCode, String content, Instant startedAt) {
        return new FetchResult(url, statusCode, content, Instant.now(), Duration.between(startedAt, Instant.now()), null, null);
    }

    public static FetchResult error(String url, Instant startedAt, String errorCode, String errorMessage) {
        return new FetchResult(url, 0, null, Instant.now(), Duration.between(startedAt, Instant.now()), errorCode, errorMessage);
    }

    public boolean isSuccessful() {
        return statusCode >= 200 && statusCode < 300 && errorCode == null;
    }
}
