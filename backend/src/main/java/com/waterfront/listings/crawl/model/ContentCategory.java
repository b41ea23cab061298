package com.waterfront.listings.crawl.model;

public enum ContentCategory {
    DESCRIPTION("description", 500),
    RESO_FACTS("reso_facts", 200),
    PHOTOS("photos", 200),
    PRICE_HISTORY("price_history", 200),
    TAX_HISTORY("tax_history", 200),
    SCHOOLS("schools", 200);

    private final String dbKey;
    private final int previewLength;

    ContentCategory(String dbKey, int previewLength) {
        this.dbKey = dbKey;
        this.previewLength = previewLength;
    }

    public String dbKey() {
        return dbKey;
    }

    public int previewLength() {
        return previewLength;
    }
}
