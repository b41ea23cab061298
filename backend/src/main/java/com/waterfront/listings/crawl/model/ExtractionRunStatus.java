package com.waterfront.listings.crawl.model;

public enum ExtractionRunStatus {
    RUNNING,
    COMPLETED,
    ABORTED
}
