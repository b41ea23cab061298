package com.waterfront.listings.crawl.resolve;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Versioned field-variant and lookup-path tables used by {@link FieldResolver} and the record
 * builder. Bump {@link #version()} whenever a synonym or section changes so persisted
 * completion reports can be compared across table revisions.
 */
public final class FieldDefinitions {
    public static final String DEFAULT_VERSION = "2025.1";
    public static final int DEFAULT_MAX_SEARCH_DEPTH = 5;

    private static final Map<String, List<String>> DEFAULT_SYNONYMS = defaultSynonyms();

    private static final List<String> DEFAULT_KNOWN_SECTIONS = List.of(
        "property",
        "listing",
        "address",
        "resoFacts",
        "facts",
        "propertyDetails",
        "listingDetails",
        "propertyInfo"
    );

    private static final List<String> DEFAULT_TRACKED_FIELDS = List.of(
        "zpid",
        "address",
        "city",
        "state",
        "zipcode",
        "county",
        "price",
        "bedrooms",
        "bathrooms",
        "home_size_sqft",
        "lot_size",
        "year_built",
        "home_type",
        "home_status",
        "days_on_zillow",
        "mls_id",
        "price_per_sqft",
        "latitude",
        "longitude",
        "parcel_number",
        "description",
        "waterfront_features",
        "water_view",
        "water_body_name",
        "dock_info",
        "bridge_height",
        "water_depth",
        "canal_info",
        "ocean_access"
    );

    private static final List<String> DEFAULT_DESCRIPTION_KEYWORDS = List.of(
        "waterfront",
        "ocean",
        "intracoastal",
        "canal",
        "river",
        "lake",
        "bay",
        "dock"
    );

    // Single words too generic to stand in for a multi-word field name.
    private static final List<String> DEFAULT_WEAK_STOP_WORDS = List.of(
        "info",
        "id",
        "per",
        "type",
        "name",
        "size",
        "count",
        "height",
        "features",
        "details",
        "sqft",
        "number",
        "status",
        "date",
        "on",
        "of"
    );

    private final String version;
    private final Map<String, List<String>> synonyms;
    private final List<String> knownSections;
    private final List<String> trackedFields;
    private final List<String> descriptionKeywords;
    private final List<String> weakStopWords;
    private final int maxSearchDepth;

    public FieldDefinitions(
        String version,
        Map<String, List<String>> synonyms,
        List<String> knownSections,
        List<String> trackedFields,
        List<String> descriptionKeywords,
        List<String> weakStopWords,
        int maxSearchDepth
    ) {
        this.version = version == null || version.isBlank() ? DEFAULT_VERSION : version;
        this.synonyms = synonyms == null ? Map.of() : Map.copyOf(synonyms);
        this.knownSections = knownSections == null ? List.of() : List.copyOf(knownSections);
        this.trackedFields = trackedFields == null ? List.of() : List.copyOf(trackedFields);
        this.descriptionKeywords = descriptionKeywords == null ? List.of() : List.copyOf(descriptionKeywords);
        this.weakStopWords = weakStopWords == null ? List.of() : List.copyOf(weakStopWords);
        this.maxSearchDepth = Math.max(1, maxSearchDepth);
    }

    public static FieldDefinitions defaults() {
        return new FieldDefinitions(
            DEFAULT_VERSION,
            DEFAULT_SYNONYMS,
            DEFAULT_KNOWN_SECTIONS,
            DEFAULT_TRACKED_FIELDS,
            DEFAULT_DESCRIPTION_KEYWORDS,
            DEFAULT_WEAK_STOP_WORDS,
            DEFAULT_MAX_SEARCH_DEPTH
        );
    }

    public FieldDefinitions withSynonyms(Map<String, List<String>> replacement) {
        return new FieldDefinitions(version, replacement, knownSections, trackedFields, descriptionKeywords, weakStopWords, maxSearchDepth);
    }

    public FieldDefinitions withKnownSections(List<String> replacement) {
        return new FieldDefinitions(version, synonyms, replacement, trackedFields, descriptionKeywords, weakStopWords, maxSearchDepth);
    }

    public FieldDefinitions withTrackedFields(List<String> replacement) {
        return new FieldDefinitions(version, synonyms, knownSections, replacement, descriptionKeywords, weakStopWords, maxSearchDepth);
    }

    public String version() {
        return version;
    }

    public List<String> synonymsFor(String field) {
        if (field == null) {
            return List.of();
        }
        return synonyms.getOrDefault(field.toLowerCase(Locale.ROOT), List.of());
    }

    public List<String> knownSections() {
        return knownSections;
    }

    public List<String> trackedFields() {
        return trackedFields;
    }

    public List<String> descriptionKeywords() {
        return descriptionKeywords;
    }

    public boolean isWeakStopWord(String word) {
        return word != null && weakStopWords.contains(word.toLowerCase(Locale.ROOT));
    }

    public int maxSearchDepth() {
        return maxSearchDepth;
    }

    private static Map<String, List<String>> defaultSynonyms() {
        Map<String, List<String>> synonyms = new LinkedHashMap<>();
        synonyms.put("year_built", List.of("yearBuilt", "Year Built", "constructionYear"));
        synonyms.put("mls_id", List.of("mlsId", "mlsID", "mls_number", "mlsNumber"));
        synonyms.put("price_history", List.of("priceHistory", "priceHistoryData"));
        synonyms.put("price_per_sqft", List.of("pricePerSqft", "pricePerSquareFoot", "pricePerSqFt", "pricePerSquareFeet"));
        synonyms.put("lot_size", List.of("lotSize", "lotSizeAcres", "lotSizeSqFt"));
        synonyms.put("home_size_sqft", List.of("livingArea", "homeSize", "home_size", "squareFootage"));
        synonyms.put("bedrooms", List.of("beds", "bedRooms", "bed_count"));
        synonyms.put("bathrooms", List.of("baths", "bathRooms", "bath_count"));
        synonyms.put("dock_info", List.of("dockInfo", "dockDetails", "dockFeatures"));
        synonyms.put("bridge_height", List.of("bridgeHeight", "bridgeClearance", "bridgeInfo"));
        synonyms.put("water_depth", List.of("waterDepth", "depth", "waterLevel"));
        synonyms.put("canal_info", List.of("canalInfo", "canalDetails", "canalFeatures"));
        synonyms.put("ocean_access", List.of("oceanAccess", "oceanView", "oceanFront"));
        synonyms.put("waterfront_features", List.of("waterfrontFeatures", "waterfrontInfo"));
        synonyms.put("water_view", List.of("waterView", "waterfrontView", "waterViewType"));
        synonyms.put("water_body_name", List.of("waterBodyName", "waterBody"));
        synonyms.put("days_on_zillow", List.of("daysOnZillow", "timeOnZillow"));
        synonyms.put("home_status", List.of("homeStatus", "listingStatus"));
        synonyms.put("parcel_number", List.of("parcelNumber", "parcelId", "apn"));
        synonyms.put("zipcode", List.of("zipcode", "zipCode", "postalCode"));
        synonyms.put("street_address", List.of("streetAddress", "address1"));
        synonyms.put("county", List.of("countyName", "cnty"));
        return synonyms;
    }
}
