package com.waterfront.listings.crawl.model;

import com.waterfront.listings.crawl.resolve.FieldValue;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Free-text and waterfront projection stored in {@code listings_detail}. Keys of
 * {@code extractedFields} are snake_case; facts-block leftovers carry a {@code reso_} prefix.
 */
public record ListingDetail(
    String zpid,
    String descriptionRaw,
    String waterfrontFeatures,
    String waterView,
    String waterBodyName,
    String onMarketDate,
    String ownershipType,
    String parcelNumber,
    String livingArea,
    String viewDescription,
    BigDecimal pricePerSqft,
    String dockInfo,
    String bridgeHeight,
    String waterDepth,
    String canalInfo,
    String oceanAccess,
    WaterfrontMeasurements measurements,
    Map<String, FieldValue> extractedFields
) {
    public ListingDetail {
        measurements = measurements == null ? WaterfrontMeasurements.none() : measurements;
        extractedFields = extractedFields == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(extractedFields));
    }

    public static Builder builder(String zpid) {
        return new Builder(zpid);
    }

    public static final class Builder {
        private final String zpid;
        private String descriptionRaw;
        private String waterfrontFeatures;
        private String waterView;
        private String waterBodyName;
        private String onMarketDate;
        private String ownershipType;
        private String parcelNumber;
        private String livingArea;
        private String viewDescription;
        private BigDecimal pricePerSqft;
        private String dockInfo;
        private String bridgeHeight;
        private String waterDepth;
        private String canalInfo;
        private String oceanAccess;
        private WaterfrontMeasurements measurements;
        private final Map<String, FieldValue> extractedFields = new LinkedHashMap<>();

        private Builder(String zpid) {
            this.zpid = zpid;
        }

        public Builder descriptionRaw(String descriptionRaw) {
            this.descriptionRaw = descriptionRaw;
            return this;
        }

        public Builder waterfrontFeatures(String waterfrontFeatures) {
            this.waterfrontFeatures = waterfrontFeatures;
            return this;
        }

        public Builder waterView(String waterView) {
            this.waterView = waterView;
            return this;
        }

        public Builder waterBodyName(String waterBodyName) {
            this.waterBodyName = waterBodyName;
            return this;
        }

        public Builder onMarketDate(String onMarketDate) {
            this.onMarketDate = onMarketDate;
            return this;
        }

        public Builder ownershipType(String ownershipType) {
            this.ownershipType = ownershipType;
            return this;
        }

        public Builder parcelNumber(String parcelNumber) {
            this.parcelNumber = parcelNumber;
            return this;
        }

        public Builder livingArea(String livingArea) {
            this.livingArea = livingArea;
            return this;
        }

        public Builder viewDescription(String viewDescription) {
            this.viewDescription = viewDescription;
            return this;
        }

        public Builder pricePerSqft(BigDecimal pricePerSqft) {
            this.pricePerSqft = pricePerSqft;
            return this;
        }

        public Builder dockInfo(String dockInfo) {
            this.dockInfo = dockInfo;
            return this;
        }

        public Builder bridgeHeight(String bridgeHeight) {
            this.bridgeHeight = bridgeHeight;
            return this;
        }

        public Builder waterDepth(String waterDepth) {
            this.waterDepth = waterDepth;
            return this;
        }

        public Builder canalInfo(String canalInfo) {
            this.canalInfo = canalInfo;
            return this;
        }

        public Builder oceanAccess(String oceanAccess) {
            this.oceanAccess = oceanAccess;
            return this;
        }

        public Builder measurements(WaterfrontMeasurements measurements) {
            this.measurements = measurements;
            return this;
        }

        public Builder extractedField(String key, FieldValue value) {
            if (key != null && value != null && !value.isEmpty()) {
                extractedFields.putIfAbsent(key, value);
            }
            return this;
        }

        public ListingDetail build() {
            return new ListingDetail(
                zpid,
                descriptionRaw,
                waterfrontFeatures,
                waterView,
                waterBodyName,
                onMarketDate,
                ownershipType,
                parcelNumber,
                livingArea,
                viewDescription,
                pricePerSqft,
                dockInfo,
                bridgeHeight,
                waterDepth,
                canalInfo,
                oceanAccess,
                measurements,
                extractedFields
            );
        }
    }
}
