package com.waterfront.listings.crawl.payload;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.MissingNode;

import java.util.Iterator;

/**
 * The decoded embedded payload of one listing page.
 *
 * @param nextData    the whole {@code __NEXT_DATA__} tree, missing for cache snapshots
 * @param cache       the listing cache object
 * @param rawText     the cache as it appeared in the page
 * @param cleanedText {@code rawText} with escaped quotes and backslashes unescaped
 * @param pageText    the full page content, null for cache snapshots
 */
public record ListingPayload(
    JsonNode nextData,
    JsonNode cache,
    String rawText,
    String cleanedText,
    String pageText
) {
    public ListingPayload {
        nextData = nextData == null ? MissingNode.getInstance() : nextData;
        cache = cache == null ? MissingNode.getInstance() : cache;
    }

    /**
     * The {@code property} object of the first cache entry that carries one.
     */
    public JsonNode propertyNode() {
        if (!cache.isObject()) {
            return MissingNode.getInstance();
        }
        JsonNode direct = cache.get("property");
        if (direct != null && direct.isObject()) {
            return direct;
        }
        Iterator<JsonNode> values = cache.elements();
        while (values.hasNext()) {
            JsonNode value = values.next();
            if (value != null && value.isObject()) {
                JsonNode property = value.get("property");
                if (property != null && property.isObject()) {
                    return property;
                }
            }
        }
        return MissingNode.getInstance();
    }
}
