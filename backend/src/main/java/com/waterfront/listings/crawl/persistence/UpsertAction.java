package com.waterfront.listings.crawl.persistence;

public enum UpsertAction {
    INSERT,
    UPDATE,
    NO_CHANGE
}
