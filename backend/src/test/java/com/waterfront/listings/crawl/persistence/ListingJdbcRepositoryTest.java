package com.waterfront.listings.crawl.persistence;

import com.waterfront.listings.crawl.model.ListingRecord;
import com.waterfront.listings.crawl.model.ListingSummary;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;
import java.util.UUID;

import static com.waterfront.listings.crawl.ListingRecordFixtures.listing;
import static com.waterfront.listings.crawl.ListingRecordFixtures.waterfrontListing;
import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
@ActiveProfiles("test")
@Transactional
class ListingJdbcRepositoryTest {

    @Autowired
    private ListingJdbcRepository repository;

    @Autowired
    private NamedParameterJdbcTemplate jdbc;

    @Test
    void repeatedUpsertOfSameListingIsNoChangeAndWritesNoDuplicates() {
        String zpid = newZpid();
        ListingRecord record = waterfrontListing(zpid, 1_100_000L);

        UpsertResult first = repository.upsert(record);
        UpsertResult second = repository.upsert(record);

        assertThat(first.action()).isEqualTo(UpsertAction.INSERT);
        assertThat(second.action()).isEqualTo(UpsertAction.NO_CHANGE);
        assertThat(first.satellitesWritten()).isEqualTo(2);
        assertThat(first.photosWritten()).isEqualTo(2);
        assertThat(count("listings_summary", zpid)).isEqualTo(1);
        assertThat(count("listings_detail", zpid)).isEqualTo(1);
        assertThat(count("listing_text_content", zpid)).isEqualTo(2);
        assertThat(count("property_photos", zpid)).isEqualTo(2);
    }

    @Test
    void changedKeyFieldIsReportedAsUpdate() {
        String zpid = newZpid();
        repository.upsert(waterfrontListing(zpid, 1_100_000L));

        UpsertResult result = repository.upsert(waterfrontListing(zpid, 995_000L));

        assertThat(result.action()).isEqualTo(UpsertAction.UPDATE);
        Optional<ListingSummary> stored = repository.findSummary(zpid);
        assertThat(stored).isPresent();
        assertThat(stored.get().price()).isEqualTo(995_000L);
        assertThat(stored.get().waterfront()).isTrue();
        assertThat(stored.get().waterfrontType()).isEqualTo("canal");
        assertThat(stored.get().bathrooms()).isEqualByComparingTo("2.5");
    }

    @Test
    void photosAreReplacedRatherThanAppended() {
        String zpid = newZpid();
        repository.upsert(listing(zpid, 700_000L, true, 4));

        UpsertResult result = repository.upsert(listing(zpid, 700_000L, true, 1));

        assertThat(result.photosWritten()).isEqualTo(1);
        assertThat(count("property_photos", zpid)).isEqualTo(1);
    }

    @Test
    void storesMeasurementsAndExtractedFieldsAsJson() {
        String zpid = newZpid();
        repository.upsert(waterfrontListing(zpid, 850_000L));

        MapSqlParameterSource params = new MapSqlParameterSource("zpid", zpid);
        Integer frontage = jdbc.queryForObject(
            "SELECT waterfront_linear_ft FROM listings_detail WHERE zpid = :zpid", params, Integer.class);
        String extracted = jdbc.queryForObject(
            "SELECT extracted_fields FROM listings_detail WHERE zpid = :zpid", params, String.class);
        String preview = jdbc.queryForObject(
            "SELECT content_preview FROM listing_text_content WHERE zpid = :zpid AND content_type = 'description'",
            params,
            String.class);

        assertThat(frontage).isEqualTo(80);
        assertThat(extracted).contains("\"reso_has_dock\":true");
        assertThat(preview).startsWith("Canal home");
    }

    @Test
    void existingIdsAndCountsReflectStoredListings() {
        String waterfront = newZpid();
        String inland = newZpid();
        long listingsBefore = repository.countListings();
        long waterfrontBefore = repository.countWaterfrontListings();

        repository.upsert(waterfrontListing(waterfront, 600_000L));
        repository.upsert(listing(inland, 400_000L, false, 0));

        assertThat(repository.findExistingZpids()).contains(waterfront, inland);
        assertThat(repository.countListings()).isEqualTo(listingsBefore + 2);
        assertThat(repository.countWaterfrontListings()).isEqualTo(waterfrontBefore + 1);
        assertThat(repository.findKeyFields(inland)).isPresent();
        assertThat(repository.findKeyFields(newZpid())).isEmpty();
    }

    private int count(String table, String zpid) {
        Integer rows = jdbc.queryForObject(
            "SELECT COUNT(*) FROM " + table + " WHERE zpid = :zpid",
            new MapSqlParameterSource("zpid", zpid),
            Integer.class
        );
        return rows == null ? 0 : rows;
    }

    private static String newZpid() {
        return Long.toString(Math.abs(UUID.randomUUID().getMostSignificantBits() % 1_000_000_000L));
    }
}
