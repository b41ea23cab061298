package com.waterfront.listings.crawl.model;

import java.math.BigDecimal;

/**
 * Fixed-column projection stored in {@code listings_summary}.
 */
public record ListingSummary(
    String zpid,
    String url,
    String address,
    String city,
    String state,
    String zipcode,
    String county,
    Long price,
    Integer bedrooms,
    BigDecimal bathrooms,
    Integer homeSizeSqft,
    BigDecimal lotSize,
    String lotSizeUnits,
    String homeType,
    String propertyType,
    Integer yearBuilt,
    String homeStatus,
    String contingentListingType,
    String listingProvider,
    Integer daysOnZillow,
    Integer pageViewCount,
    Integer favoriteCount,
    Long zestimate,
    Long rentZestimate,
    BigDecimal monthlyHoaFee,
    Double latitude,
    Double longitude,
    String mlsId,
    String mlsName,
    String agentName,
    String brokerName,
    String agentPhone,
    boolean waterfront,
    String waterfrontType
) {
    public ListingKeyFields keyFields() {
        return new ListingKeyFields(price, bedrooms, bathrooms, homeSizeSqft, homeStatus, daysOnZillow);
    }

    public static Builder builder(String zpid) {
        return new Builder(zpid);
    }

    public static final class Builder {
        private final String zpid;
        private String url;
        private String address;
        private String city;
        private String state;
        private String zipcode;
        private String county;
        private Long price;
        private Integer bedrooms;
        private BigDecimal bathrooms;
        private Integer homeSizeSqft;
        private BigDecimal lotSize;
        private String lotSizeUnits;
        private String homeType;
        private String propertyType;
        private Integer yearBuilt;
        private String homeStatus;
        private String contingentListingType;
        private String listingProvider;
        private Integer daysOnZillow;
        private Integer pageViewCount;
        private Integer favoriteCount;
        private Long zestimate;
        private Long rentZestimate;
        private BigDecimal monthlyHoaFee;
        private Double latitude;
        private Double longitude;
        private String mlsId;
        private String mlsName;
        private String agentName;
        private String brokerName;
        private String agentPhone;
        private boolean waterfront;
        private String waterfrontType;

        private Builder(String zpid) {
            this.zpid = zpid;
        }

        public Builder url(String url) {
            this.url = url;
            return this;
        }

        public Builder address(String address) {
            this.address = address;
            return this;
        }

        public Builder city(String city) {
            this.city = city;
            return this;
        }

        public Builder state(String state) {
            this.state = state;
            return this;
        }

        public Builder zipcode(String zipcode) {
            this.zipcode = zipcode;
            return this;
        }

        public Builder county(String county) {
            this.county = county;
            return this;
        }

        public Builder price(Long price) {
            this.price = price;
            return this;
        }

        public Builder bedrooms(Integer bedrooms) {
            this.bedrooms = bedrooms;
            return this;
        }

        public Builder bathrooms(BigDecimal bathrooms) {
            this.bathrooms = bathrooms;
            return this;
        }

        public Builder homeSizeSqft(Integer homeSizeSqft) {
            this.homeSizeSqft = homeSizeSqft;
            return this;
        }

        public Builder lotSize(BigDecimal lotSize) {
            this.lotSize = lotSize;
            return this;
        }

        public Builder lotSizeUnits(String lotSizeUnits) {
            this.lotSizeUnits = lotSizeUnits;
            return this;
        }

        public Builder homeType(String homeType) {
            this.homeType = homeType;
            return this;
        }

        public Builder propertyType(String propertyType) {
            this.propertyType = propertyType;
            return this;
        }

        public Builder yearBuilt(Integer yearBuilt) {
            this.yearBuilt = yearBuilt;
            return this;
        }

        public Builder homeStatus(String homeStatus) {
            this.homeStatus = homeStatus;
            return this;
        }

        public Builder contingentListingType(String contingentListingType) {
            this.contingentListingType = contingentListingType;
            return this;
        }

        public Builder listingProvider(String listingProvider) {
            this.listingProvider = listingProvider;
            return this;
        }

        public Builder daysOnZillow(Integer daysOnZillow) {
            this.daysOnZillow = daysOnZillow;
            return this;
        }

        public Builder pageViewCount(Integer pageViewCount) {
            this.pageViewCount = pageViewCount;
            return this;
        }

        public Builder favoriteCount(Integer favoriteCount) {
            this.favoriteCount = favoriteCount;
            return this;
        }

        public Builder zestimate(Long zestimate) {
            this.zestimate = zestimate;
            return this;
        }

        public Builder rentZestimate(Long rentZestimate) {
            this.rentZestimate = rentZestimate;
            return this;
        }

        public Builder monthlyHoaFee(BigDecimal monthlyHoaFee) {
            this.monthlyHoaFee = monthlyHoaFee;
            return this;
        }

        public Builder latitude(Double latitude) {
            this.latitude = latitude;
            return this;
        }

        public Builder longitude(Double longitude) {
            this.longitude = longitude;
            return this;
        }

        public Builder mlsId(String mlsId) {
            this.mlsId = mlsId;
            return this;
        }

        public Builder mlsName(String mlsName) {
            this.mlsName = mlsName;
            return this;
        }

        public Builder agentName(String agentName) {
            this.agentName = agentName;
            return this;
        }

        public Builder brokerName(String brokerName) {
            this.brokerName = brokerName;
            return this;
        }

        public Builder agentPhone(String agentPhone) {
            this.agentPhone = agentPhone;
            return this;
        }

        public Builder waterfront(boolean waterfront) {
            this.waterfront = waterfront;
            return this;
        }

        public Builder waterfrontType(String waterfrontType) {
            this.waterfrontType = waterfrontType;
            return this;
        }

        public ListingSummary build() {
            return new ListingSummary(
                zpid,
                url,
                address,
                city,
                state,
                zipcode,
                county,
                price,
                bedrooms,
                bathrooms,
                homeSizeSqft,
                lotSize,
                lotSizeUnits,
                homeType,
                propertyType,
                yearBuilt,
                homeStatus,
                contingentListingType,
                listingProvider,
                daysOnZillow,
                pageViewCount,
                favoriteCount,
                zestimate,
                rentZestimate,
                monthlyHoaFee,
                latitude,
                longitude,
                mlsId,
                mlsName,
                agentName,
                brokerName,
                agentPhone,
                waterfront,
                waterfrontType
            );
        }
    }
}
