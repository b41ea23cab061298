package com.waterfront.listings.crawl.model;

import com.waterfront.listings.crawl.resolve.FieldResolution;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * One normalized listing: both projections, satellite content and how each tracked field was
 * resolved.
 */
public record ListingRecord(
    ListingSummary summary,
    ListingDetail detail,
    List<SatelliteContent> satellites,
    List<PropertyPhoto> photos,
    Map<String, FieldResolution> resolutions,
    String sourceUrl,
    Instant extractedAt
) {
    public ListingRecord {
        satellites = satellites == null ? List.of() : List.copyOf(satellites);
        photos = photos == null ? List.of() : List.copyOf(photos);
        resolutions = resolutions == null ? Map.of() : Map.copyOf(resolutions);
    }

    public String zpid() {
        return summary.zpid();
    }
}
