package com.waterfront.listings.crawl.persistence;

/**
 * The store rejected a write. Runs stop at the first one instead of counting it as a per-listing
 * failure.
 */
public class ListingPersistenceException extends RuntimeException {
    private final String zpid;

    public ListingPersistenceException(String zpid, String message, Throwable cause) {
        super(message, cause);
        this.zpid = zpid;
    }

    public String getZpid() {
        return zpid;
    }
}
