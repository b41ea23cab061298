package com.waterfront.listings.crawl.model;

/**
 * Large or schema-variable listing content stored by (zpid, category).
 */
public record SatelliteContent(ContentCategory category, String content) {

    public String preview() {
        if (content == null) {
            return null;
        }
        int limit = category.previewLength();
        return content.length() <= limit ? content : content.substring(0, limit);
    }
}
