package com.waterfront.listings.crawl.report;

public enum CompletionBucket {
    EXCELLENT(90.0, "90-100%"),
    GOOD(70.0, "70-89%"),
    FAIR(50.0, "50-69%"),
    POOR(30.0, "30-49%"),
    MISSING(0.0, "0-29%");

    private final double minPercent;
    private final String label;

    CompletionBucket(double minPercent, String label) {
        this.minPercent = minPercent;
        this.label = label;
    }

    public static CompletionBucket forPercent(double percent) {
        for (CompletionBucket bucket : values()) {
            if (percent >= bucket.minPercent) {
                return bucket;
            }
        }
        return MISSING;
    }

    public String label() {
        return label;
    }
}
