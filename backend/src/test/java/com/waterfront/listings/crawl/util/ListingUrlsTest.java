package com.waterfront.listings.crawl.util;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ListingUrlsTest {

    @Test
    void extractsListingIdFromDetailUrl() {
        assertThat(ListingUrls.zpidOf("https://www.zillow.com/homedetails/12-Bay-Dr-Naples-FL/43210_zpid/")).isEqualTo("43210");
        assertThat(ListingUrls.zpidOf("/homedetails/43210_zpid/?utm=1")).isEqualTo("43210");
        assertThat(ListingUrls.zpidOf("https://www.zillow.com/naples-fl/")).isNull();
        assertThat(ListingUrls.zpidOf(" ")).isNull();
    }

    @Test
    void canonicalUrlIsAbsoluteWithoutQueryOrFragment() {
        assertThat(ListingUrls.canonicalDetailUrl("/homedetails/43210_zpid/?fromHomePage=true#photos"))
            .isEqualTo("https://www.zillow.com/homedetails/43210_zpid/");
        assertThat(ListingUrls.canonicalDetailUrl("//www.zillow.com/homedetails/43210_zpid/"))
            .isEqualTo("https://www.zillow.com/homedetails/43210_zpid/");
        assertThat(ListingUrls.canonicalDetailUrl("https://www.zillow.com/homedetails/43210_zpid/"))
            .isEqualTo("https://www.zillow.com/homedetails/43210_zpid/");
        assertThat(ListingUrls.canonicalDetailUrl(null)).isNull();
    }

    @Test
    void recognizesDetailUrls() {
        assertThat(ListingUrls.isDetailUrl("https://www.zillow.com/HomeDetails/43210_zpid/")).isTrue();
        assertThat(ListingUrls.isDetailUrl("https://www.zillow.com/naples-fl/2_p/")).isFalse();
        assertThat(ListingUrls.isDetailUrl(null)).isFalse();
    }
}
