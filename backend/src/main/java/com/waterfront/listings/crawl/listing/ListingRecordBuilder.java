package com.waterfront.listings.crawl.listing;

import com.fasterxml.jackson.databind.JsonNode;
import com.waterfront.listings.crawl.model.ContentCategory;
import com.waterfront.listings.crawl.model.ListingDetail;
import com.waterfront.listings.crawl.model.ListingRecord;
import com.waterfront.listings.crawl.model.ListingSummary;
import com.waterfront.listings.crawl.model.PropertyPhoto;
import com.waterfront.listings.crawl.model.SatelliteContent;
import com.waterfront.listings.crawl.model.WaterfrontMeasurements;
import com.waterfront.listings.crawl.payload.CacheNotFoundException;
import com.waterfront.listings.crawl.payload.ListingPayload;
import com.waterfront.listings.crawl.resolve.FieldDefinitions;
import com.waterfront.listings.crawl.resolve.FieldResolution;
import com.waterfront.listings.crawl.resolve.FieldResolver;
import com.waterfront.listings.crawl.resolve.FieldValue;
import com.waterfront.listings.crawl.resolve.NameVariants;
import com.waterfront.listings.crawl.resolve.ResolutionSource;
import com.waterfront.listings.crawl.util.ListingUrls;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Assembles a {@link ListingRecord} from a located payload.
 *
 * <p>Each fact is taken from the facts block first, then from the top-level property object, and
 * only then from {@link FieldResolver}. The first non-null value wins. The fields that decide
 * {@code is_waterfront} are resolved by exact key only and never from a bare number.
 */
@Component
public class ListingRecordBuilder {
    static final int MAX_DESCRIPTION_CHARS = 10_000;
    static final int MAX_PHOTOS = 10;
    private static final int MIN_META_DESCRIPTION_CHARS = 20;

    private final FieldResolver resolver;
    private final FieldDefinitions definitions;
    private final WaterfrontClassifier classifier;
    private final WaterfrontTextParser textParser;

    public ListingRecordBuilder(FieldResolver resolver) {
        this.resolver = resolver;
        this.definitions = resolver.definitions();
        this.classifier = new WaterfrontClassifier(definitions.descriptionKeywords());
        this.textParser = new WaterfrontTextParser();
    }

    public ListingRecord build(ListingPayload payload, String sourceUrl) {
        JsonNode property = payload.propertyNode();
        ResoFacts facts = ResoFacts.read(property.path("resoFacts"));
        Resolutions resolutions = new Resolutions(payload);

        String zpid = resolveZpid(property, sourceUrl, resolutions);
        JsonNode address = property.path("address");
        JsonNode attribution = property.path("attributionInfo");

        String description = resolutions.text(
            "description",
            "description",
            facts.first("description"),
            top(property, "description")
        );
        if (description == null) {
            description = metaDescription(payload.pageText());
            if (description != null) {
                resolutions.record("description", FieldValue.text(description), ResolutionSource.DERIVED);
            }
        }
        if (description != null && description.length() > MAX_DESCRIPTION_CHARS) {
            description = description.substring(0, MAX_DESCRIPTION_CHARS);
        }

        String waterfrontFeatures = resolutions.signal(
            "waterfront_features",
            facts.first("waterfrontFeatures", "waterfront"),
            top(property, "waterfrontFeatures")
        );
        String waterView = resolutions.signal(
            "water_view",
            facts.first("waterView", "waterViewYN"),
            top(property, "waterView")
        );
        String waterBodyName = resolutions.signal(
            "water_body_name",
            facts.first("waterBodyName"),
            top(property, "waterBodyName")
        );
        String dockInfo = resolutions.display("dock_info", "dock_info", facts.first("dockInfo", "dock"), Optional.empty());
        String bridgeHeight = resolutions.display("bridge_height", "bridge_height", facts.first("bridgeHeight"), Optional.empty());
        String waterDepth = resolutions.display("water_depth", "water_depth", facts.first("waterDepth"), Optional.empty());
        String canalInfo = resolutions.display("canal_info", "canal_info", facts.first("canalInfo"), Optional.empty());
        String oceanAccess = resolutions.display("ocean_access", "ocean_access", facts.first("oceanAccess"), Optional.empty());

        WaterfrontClassifier.Classification classification =
            classifier.classify(waterfrontFeatures, waterView, waterBodyName, description);
        WaterfrontMeasurements measurements = measurements(description, dockInfo, bridgeHeight, waterDepth, canalInfo, waterfrontFeatures);

        ListingSummary summary = ListingSummary.builder(zpid)
            .url(listingUrl(property, sourceUrl))
            .address(resolutions.text("address", "street_address", Optional.empty(), top(address, "streetAddress")))
            .city(resolutions.text("city", "city", Optional.empty(), top(address, "city")))
            .state(resolutions.text("state", "state", Optional.empty(), top(address, "state")))
            .zipcode(resolutions.text("zipcode", "zipcode", Optional.empty(), top(address, "zipcode")))
            .county(resolutions.text("county", "county", facts.first("county", "countyName"), top(property, "county")))
            .price(resolutions.value("price", "price", Optional.empty(), top(property, "price"), ValueCoercion::toLong))
            .bedrooms(resolutions.value("bedrooms", "bedrooms", facts.first("bedrooms"), top(property, "bedrooms"), ValueCoercion::toInteger))
            .bathrooms(resolutions.value("bathrooms", "bathrooms", facts.first("bathrooms", "bathroomsFloat"), top(property, "bathrooms"), ValueCoercion::toDecimal))
            .homeSizeSqft(resolutions.value("home_size_sqft", "home_size_sqft", facts.first("livingArea", "livingAreaValue"), top(property, "livingArea"), ValueCoercion::toInteger))
            .lotSize(resolutions.value("lot_size", "lot_size", facts.first("lotSize"), top(property, "lotAreaValue"), ValueCoercion::toDecimal))
            .lotSizeUnits(ValueCoercion.toText(top(property, "lotAreaUnits").orElse(null)))
            .homeType(resolutions.text("home_type", "home_type", facts.first("homeType"), top(property, "homeType")))
            .propertyType(ValueCoercion.toText(top(property, "propertyTypeDimension").orElse(null)))
            .yearBuilt(resolutions.value("year_built", "year_built", facts.first("yearBuilt"), top(property, "yearBuilt"), ValueCoercion::toInteger))
            .homeStatus(resolutions.text("home_status", "home_status", Optional.empty(), top(property, "homeStatus")))
            .contingentListingType(ValueCoercion.toText(top(property, "contingentListingType").orElse(null)))
            .listingProvider(listingProvider(property))
            .daysOnZillow(resolutions.value("days_on_zillow", "days_on_zillow", Optional.empty(), top(property, "daysOnZillow"), ValueCoercion::toInteger))
            .pageViewCount(ValueCoercion.toInteger(top(property, "pageViewCount").orElse(null)))
            .favoriteCount(ValueCoercion.toInteger(top(property, "favoriteCount").orElse(null)))
            .zestimate(ValueCoercion.toLong(top(property, "zestimate").orElse(null)))
            .rentZestimate(ValueCoercion.toLong(top(property, "rentZestimate").orElse(null)))
            .monthlyHoaFee(ValueCoercion.toDecimal(facts.first("hoaFee", "associationFee").or(() -> top(property, "monthlyHoaFee")).orElse(null)))
            .latitude(resolutions.value("latitude", "latitude", Optional.empty(), top(property, "latitude"), ValueCoercion::toDouble))
            .longitude(resolutions.value("longitude", "longitude", Optional.empty(), top(property, "longitude"), ValueCoercion::toDouble))
            .mlsId(resolutions.text("mls_id", "mls_id", facts.first("mlsId"), top(attribution, "mlsId")))
            .mlsName(ValueCoercion.toText(top(attribution, "mlsName").orElse(null)))
            .agentName(ValueCoercion.toText(top(attribution, "agentName").orElse(null)))
            .brokerName(ValueCoercion.toText(top(attribution, "brokerName").orElse(null)))
            .agentPhone(ValueCoercion.toText(top(attribution, "agentPhoneNumber").orElse(null)))
            .waterfront(classification.waterfront())
            .waterfrontType(classification.type())
            .build();

        ListingDetail.Builder detail = ListingDetail.builder(zpid)
            .descriptionRaw(description)
            .waterfrontFeatures(waterfrontFeatures)
            .waterView(waterView)
            .waterBodyName(waterBodyName)
            .onMarketDate(ValueCoercion.toText(facts.first("onMarketDate").or(() -> top(property, "datePostedString")).orElse(null)))
            .ownershipType(ValueCoercion.toText(facts.first("ownershipType", "ownership").orElse(null)))
            .parcelNumber(resolutions.text("parcel_number", "parcel_number", facts.first("parcelNumber"), top(property, "parcelId")))
            .livingArea(ValueCoercion.toDisplayText(facts.node("livingArea").flatMap(FieldValue::fromJson).orElse(null)))
            .viewDescription(ValueCoercion.toDisplayText(facts.first("view").orElse(null)))
            .pricePerSqft(resolutions.value("price_per_sqft", "price_per_sqft", facts.first("pricePerSquareFoot"), top(property, "pricePerSquareFoot"), ValueCoercion::toDecimal))
            .dockInfo(dockInfo)
            .bridgeHeight(bridgeHeight)
            .waterDepth(waterDepth)
            .canalInfo(canalInfo)
            .oceanAccess(oceanAccess)
            .measurements(measurements);

        extractedFields(detail, resolutions, facts);

        return new ListingRecord(
            summary,
            detail.build(),
            satellites(property, description),
            photos(property),
            resolutions.all(),
            sourceUrl,
            Instant.now()
        );
    }

    private String resolveZpid(JsonNode property, String sourceUrl, Resolutions resolutions) {
        String zpid = resolutions.text("zpid", "zpid", Optional.empty(), top(property, "zpid"));
        if (zpid == null) {
            zpid = ListingUrls.zpidOf(sourceUrl);
            if (zpid != null) {
                resolutions.record("zpid", FieldValue.text(zpid), ResolutionSource.DERIVED);
            }
        }
        if (zpid == null || zpid.isBlank()) {
            throw new CacheNotFoundException("Listing identifier not found in payload for " + sourceUrl);
        }
        // "12345.0" from a numeric node
        return zpid.endsWith(".0") ? zpid.substring(0, zpid.length() - 2) : zpid;
    }

    private String listingUrl(JsonNode property, String sourceUrl) {
        String url = ValueCoercion.toText(top(property, "hdpUrl").or(() -> top(property, "url")).orElse(null));
        if (url == null) {
            return sourceUrl;
        }
        return ListingUrls.absolutize(url);
    }

    private String listingProvider(JsonNode property) {
        JsonNode provider = property.path("listingProvider");
        if (provider.isObject()) {
            return ValueCoercion.toText(top(provider, "title").or(() -> top(provider, "name")).orElse(null));
        }
        return ValueCoercion.toText(FieldValue.fromJson(provider).orElse(null));
    }

    private WaterfrontMeasurements measurements(String description, String... structured) {
        StringBuilder text = new StringBuilder();
        if (description != null) {
            text.append(description);
        }
        for (String part : structured) {
            if (part != null && !part.isBlank()) {
                text.append(". ").append(part);
            }
        }
        return textParser.parse(text.toString());
    }

    private void extractedFields(ListingDetail.Builder detail, Resolutions resolutions, ResoFacts facts) {
        for (String field : List.of("waterfront_features", "water_view", "dock_info", "bridge_height", "water_depth", "canal_info", "ocean_access")) {
            resolutions.get(field).ifPresent(value -> detail.extractedField(field, value));
        }
        facts.remaining().forEach((key, node) ->
            FieldValue.fromJson(node).ifPresent(value -> detail.extractedField("reso_" + NameVariants.camelToSnake(key), value))
        );
    }

    private List<SatelliteContent> satellites(JsonNode property, String description) {
        List<SatelliteContent> satellites = new ArrayList<>();
        if (description != null && !description.isBlank()) {
            satellites.add(new SatelliteContent(ContentCategory.DESCRIPTION, description));
        }
        addJson(satellites, ContentCategory.RESO_FACTS, property.path("resoFacts"));
        addJson(satellites, ContentCategory.PHOTOS, property.path("responsivePhotos"));
        addJson(satellites, ContentCategory.PRICE_HISTORY, property.path("priceHistory"));
        addJson(satellites, ContentCategory.TAX_HISTORY, property.path("taxHistory"));
        addJson(satellites, ContentCategory.SCHOOLS, property.path("schools"));
        return satellites;
    }

    private void addJson(List<SatelliteContent> satellites, ContentCategory category, JsonNode node) {
        if (node.isContainerNode() && !node.isEmpty()) {
            satellites.add(new SatelliteContent(category, node.toString()));
        }
    }

    private List<PropertyPhoto> photos(JsonNode property) {
        JsonNode photos = property.path("responsivePhotos");
        if (!photos.isArray()) {
            photos = property.path("photos");
        }
        List<PropertyPhoto> result = new ArrayList<>();
        if (!photos.isArray()) {
            return result;
        }
        for (JsonNode photo : photos) {
            if (result.size() >= MAX_PHOTOS) {
                break;
            }
            String url = photoUrl(photo);
            if (url == null) {
                continue;
            }
            String caption = ValueCoercion.toText(top(photo, "caption").orElse(null));
            result.add(new PropertyPhoto(result.size(), url, caption));
        }
        return result;
    }

    private String photoUrl(JsonNode photo) {
        String url = ValueCoercion.toText(top(photo, "url").orElse(null));
        if (url != null) {
            return url;
        }
        JsonNode jpegs = photo.path("mixedSources").path("jpeg");
        if (jpegs.isArray() && !jpegs.isEmpty()) {
            return ValueCoercion.toText(top(jpegs.get(jpegs.size() - 1), "url").orElse(null));
        }
        return null;
    }

    private String metaDescription(String pageText) {
        if (pageText == null || pageText.isBlank()) {
            return null;
        }
        Document document = Jsoup.parse(pageText);
        for (Element meta : document.select("meta[property=og:description], meta[name=description], meta[name=twitter:description]")) {
            String content = meta.attr("content").trim();
            if (content.length() > MIN_META_DESCRIPTION_CHARS) {
                return content;
            }
        }
        return null;
    }

    private static Optional<FieldValue> top(JsonNode node, String key) {
        if (node == null || !node.isObject()) {
            return Optional.empty();
        }
        return FieldValue.fromJson(node.get(key)).filter(value -> !value.isEmpty());
    }

    /**
     * Per-listing record of which source satisfied each field.
     */
    private final class Resolutions {
        private final ListingPayload payload;
        private final Map<String, FieldResolution> byField = new LinkedHashMap<>();

        private Resolutions(ListingPayload payload) {
            this.payload = payload;
        }

        <T> T value(
            String field,
            String resolverField,
            Optional<FieldValue> fromFacts,
            Optional<FieldValue> fromTop,
            Function<FieldValue, T> coercion
        ) {
            return firstOf(field, fromFacts, fromTop, coercion, () -> resolver.resolve(resolverField, payload));
        }

        String signal(String field, Optional<FieldValue> fromFacts, Optional<FieldValue> fromTop) {
            return firstOf(field, fromFacts, fromTop, ValueCoercion::toSignalText, () -> resolver.resolveExact(field, payload));
        }

        private <T> T firstOf(
            String field,
            Optional<FieldValue> fromFacts,
            Optional<FieldValue> fromTop,
            Function<FieldValue, T> coercion,
            Supplier<FieldResolution> fallback
        ) {
            T coerced = coerce(field, fromFacts, ResolutionSource.FACTS_BLOCK, coercion);
            if (coerced != null) {
                return coerced;
            }
            coerced = coerce(field, fromTop, ResolutionSource.TOP_LEVEL, coercion);
            if (coerced != null) {
                return coerced;
            }
            FieldResolution resolution = fallback.get();
            if (resolution.found()) {
                T value = coercion.apply(resolution.value());
                if (value != null) {
                    record(field, resolution.value(), resolution.source());
                    return value;
                }
            }
            byField.putIfAbsent(field, FieldResolution.miss(field));
            return null;
        }

        String text(String field, String resolverField, Optional<FieldValue> fromFacts, Optional<FieldValue> fromTop) {
            return value(field, resolverField, fromFacts, fromTop, ValueCoercion::toText);
        }

        String display(String field, String resolverField, Optional<FieldValue> fromFacts, Optional<FieldValue> fromTop) {
            return value(field, resolverField, fromFacts, fromTop, ValueCoercion::toDisplayText);
        }

        void record(String field, FieldValue value, ResolutionSource source) {
            byField.put(field, new FieldResolution(field, value, source));
        }

        Optional<FieldValue> get(String field) {
            FieldResolution resolution = byField.get(field);
            return resolution == null ? Optional.empty() : resolution.optionalValue();
        }

        Map<String, FieldResolution> all() {
            Map<String, FieldResolution> complete = new LinkedHashMap<>(byField);
            for (String field : definitions.trackedFields()) {
                complete.putIfAbsent(field, FieldResolution.miss(field));
            }
            return complete;
        }

        private <T> T coerce(String field, Optional<FieldValue> candidate, ResolutionSource source, Function<FieldValue, T> coercion) {
            if (candidate.isEmpty() || candidate.get().isEmpty()) {
                return null;
            }
            T value = coercion.apply(candidate.get());
            if (value != null) {
                record(field, candidate.get(), source);
            }
            return value;
        }
    }
}
