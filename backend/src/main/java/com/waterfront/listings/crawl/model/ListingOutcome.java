package com.waterfront.listings.crawl.model;

public record ListingOutcome(
    String url,
    String zpid,
    Status status,
    String reason,
    boolean waterfront
) {
    public static ListingOutcome failed(String url, String reason) {
        return new ListingOutcome(url, null, Status.FAILED, reason, false);
    }

    public static ListingOutcome skipped(String url, String zpid, String reason) {
        return new ListingOutcome(url, zpid, Status.SKIPPED, reason, false);
    }

    public enum Status {
        INSERTED,
        UPDATED,
        UNCHANGED,
        FAILED,
        SKIPPED
    }
}
