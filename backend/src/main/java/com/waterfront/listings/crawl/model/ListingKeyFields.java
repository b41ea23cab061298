package com.waterfront.listings.crawl.model;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * The volatile summary fields whose change turns an upsert into an update.
 */
public record ListingKeyFields(
    Long price,
    Integer bedrooms,
    BigDecimal bathrooms,
    Integer homeSizeSqft,
    String homeStatus,
    Integer daysOnZillow
) {
    public boolean sameAs(ListingKeyFields other) {
        if (other == null) {
            return false;
        }
        return Objects.equals(price, other.price)
            && Objects.equals(bedrooms, other.bedrooms)
            && decimalEquals(bathrooms, other.bathrooms)
            && Objects.equals(homeSizeSqft, other.homeSizeSqft)
            && Objects.equals(homeStatus, other.homeStatus)
            && Objects.equals(daysOnZillow, other.daysOnZillow);
    }

    private static boolean decimalEquals(BigDecimal left, BigDecimal right) {
        if (left == null || right == null) {
            return left == right;
        }
        return left.compareTo(right) == 0;
    }
}
