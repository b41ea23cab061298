package com.waterfront.listings.crawl.persistence;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.waterfront.listings.crawl.model.ListingDetail;
import com.waterfront.listings.crawl.model.ListingKeyFields;
import com.waterfront.listings.crawl.model.ListingRecord;
import com.waterfront.listings.crawl.model.ListingSummary;
import com.waterfront.listings.crawl.model.PropertyPhoto;
import com.waterfront.listings.crawl.model.SatelliteContent;
import com.waterfront.listings.crawl.model.WaterfrontMeasurements;
import com.waterfront.listings.crawl.resolve.FieldValue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

@Repository
public class ListingJdbcRepository {
    private static final Logger log = LoggerFactory.getLogger(ListingJdbcRepository.class);

    private static final List<String> SUMMARY_COLUMNS = List.of(
        "zpid",
        "url",
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
        "lot_size_units",
        "home_type",
        "property_type",
        "year_built",
        "home_status",
        "contingent_listing_type",
        "listing_provider",
        "days_on_zillow",
        "page_view_count",
        "favorite_count",
        "zestimate",
        "rent_zestimate",
        "monthly_hoa_fee",
        "latitude",
        "longitude",
        "mls_id",
        "mls_name",
        "agent_name",
        "broker_name",
        "agent_phone",
        "is_waterfront",
        "waterfront_type",
        "source_url"
    );

    private static final List<String> DETAIL_COLUMNS = List.of(
        "zpid",
        "description_raw",
        "waterfront_features",
        "water_view",
        "water_body_name",
        "on_market_date",
        "ownership_type",
        "parcel_number",
        "living_area",
        "view_description",
        "price_per_sqft",
        "dock_info",
        "bridge_height",
        "water_depth",
        "canal_info",
        "ocean_access",
        "waterfront_linear_ft",
        "dock_linear_ft",
        "slip_count",
        "depth_at_mlw_ft",
        "bridge_clearance_ft",
        "canal_width_ft",
        "no_fixed_bridges",
        "extracted_fields"
    );

    private static final List<String> TEXT_CONTENT_COLUMNS = List.of(
        "zpid",
        "content_type",
        "content_full",
        "content_preview"
    );

    private final NamedParameterJdbcTemplate jdbc;
    private final TransactionTemplate transactionTemplate;
    private final ObjectMapper objectMapper;
    private final boolean postgres;
    private final String summaryUpsertSql;
    private final String detailUpsertSql;
    private final String textContentUpsertSql;

    public ListingJdbcRepository(
        NamedParameterJdbcTemplate jdbc,
        PlatformTransactionManager transactionManager,
        ObjectMapper objectMapper
    ) {
        this.jdbc = jdbc;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.objectMapper = objectMapper;
        this.postgres = detectPostgres(jdbc);
        this.summaryUpsertSql = upsertSql("listings_summary", List.of("zpid"), SUMMARY_COLUMNS);
        this.detailUpsertSql = upsertSql("listings_detail", List.of("zpid"), DETAIL_COLUMNS);
        this.textContentUpsertSql = upsertSql("listing_text_content", List.of("zpid", "content_type"), TEXT_CONTENT_COLUMNS);
    }

    /**
     * Writes both projections, satellite content and photos for one listing as a single unit.
     * The returned action compares the volatile summary fields against what was stored before.
     */
    public UpsertResult upsert(ListingRecord record) {
        String zpid = record.zpid();
        try {
            UpsertResult result = transactionTemplate.execute(status -> writeListing(record));
            if (result == null) {
                throw new ListingPersistenceException(zpid, "Upsert returned no result for zpid " + zpid, null);
            }
            return result;
        } catch (DataAccessException | TransactionException e) {
            throw new ListingPersistenceException(zpid, "Failed to persist listing " + zpid + ": " + e.getMessage(), e);
        }
    }

    public Optional<ListingKeyFields> findKeyFields(String zpid) {
        List<ListingKeyFields> rows = jdbc.query(
            """
                SELECT price, bedrooms, bathrooms, home_size_sqft, home_status, days_on_zillow
                FROM listings_summary
                WHERE zpid = :zpid
                """,
            new MapSqlParameterSource("zpid", zpid),
            (rs, rowNum) -> new ListingKeyFields(
                rs.getObject("price") == null ? null : rs.getLong("price"),
                rs.getObject("bedrooms") == null ? null : rs.getInt("bedrooms"),
                rs.getBigDecimal("bathrooms"),
                rs.getObject("home_size_sqft") == null ? null : rs.getInt("home_size_sqft"),
                rs.getString("home_status"),
                rs.getObject("days_on_zillow") == null ? null : rs.getInt("days_on_zillow")
            )
        );
        return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
    }

    public Optional<ListingSummary> findSummary(String zpid) {
        List<ListingSummary> rows = jdbc.query(
            """
                SELECT *
                FROM listings_summary
                WHERE zpid = :zpid
                """,
            new MapSqlParameterSource("zpid", zpid),
            (rs, rowNum) -> ListingSummary.builder(rs.getString("zpid"))
                .url(rs.getString("url"))
                .address(rs.getString("address"))
                .city(rs.getString("city"))
                .state(rs.getString("state"))
                .zipcode(rs.getString("zipcode"))
                .county(rs.getString("county"))
                .price(rs.getObject("price") == null ? null : rs.getLong("price"))
                .bedrooms(rs.getObject("bedrooms") == null ? null : rs.getInt("bedrooms"))
                .bathrooms(rs.getBigDecimal("bathrooms"))
                .homeSizeSqft(rs.getObject("home_size_sqft") == null ? null : rs.getInt("home_size_sqft"))
                .lotSize(rs.getBigDecimal("lot_size"))
                .lotSizeUnits(rs.getString("lot_size_units"))
                .homeType(rs.getString("home_type"))
                .propertyType(rs.getString("property_type"))
                .yearBuilt(rs.getObject("year_built") == null ? null : rs.getInt("year_built"))
                .homeStatus(rs.getString("home_status"))
                .daysOnZillow(rs.getObject("days_on_zillow") == null ? null : rs.getInt("days_on_zillow"))
                .latitude(rs.getObject("latitude") == null ? null : rs.getDouble("latitude"))
                .longitude(rs.getObject("longitude") == null ? null : rs.getDouble("longitude"))
                .mlsId(rs.getString("mls_id"))
                .waterfront(rs.getBoolean("is_waterfront"))
                .waterfrontType(rs.getString("waterfront_type"))
                .build()
        );
        return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
    }

    public Set<String> findExistingZpids() {
        List<String> zpids = jdbc.getJdbcTemplate().queryForList("SELECT zpid FROM listings_summary", String.class);
        return new LinkedHashSet<>(zpids);
    }

    public long countListings() {
        Long count = jdbc.getJdbcTemplate().queryForObject("SELECT COUNT(*) FROM listings_summary", Long.class);
        return count == null ? 0L : count;
    }

    public long countWaterfrontListings() {
        Long count = jdbc.getJdbcTemplate().queryForObject(
            "SELECT COUNT(*) FROM listings_summary WHERE is_waterfront = TRUE",
            Long.class
        );
        return count == null ? 0L : count;
    }

    private UpsertResult writeListing(ListingRecord record) {
        ListingSummary summary = record.summary();
        Optional<ListingKeyFields> existing = findKeyFields(summary.zpid());
        UpsertAction action;
        if (existing.isEmpty()) {
            action = UpsertAction.INSERT;
        } else if (existing.get().sameAs(summary.keyFields())) {
            action = UpsertAction.NO_CHANGE;
        } else {
            action = UpsertAction.UPDATE;
        }

        jdbc.update(summaryUpsertSql, summaryParams(summary, record.sourceUrl()));
        jdbc.update(detailUpsertSql, detailParams(record.detail()));

        int satellites = 0;
        for (SatelliteContent satellite : record.satellites()) {
            if (satellite.content() == null || satellite.content().isBlank()) {
                continue;
            }
            jdbc.update(
                textContentUpsertSql,
                new MapSqlParameterSource()
                    .addValue("zpid", summary.zpid())
                    .addValue("content_type", satellite.category().dbKey())
                    .addValue("content_full", satellite.content())
                    .addValue("content_preview", satellite.preview())
            );
            satellites++;
        }

        int photos = replacePhotos(summary.zpid(), record.photos());
        log.debug("Upserted listing {} action={} satellites={} photos={}", summary.zpid(), action, satellites, photos);
        return new UpsertResult(summary.zpid(), action, satellites, photos);
    }

    private int replacePhotos(String zpid, List<PropertyPhoto> photos) {
        jdbc.update("DELETE FROM property_photos WHERE zpid = :zpid", new MapSqlParameterSource("zpid", zpid));
        if (photos.isEmpty()) {
            return 0;
        }
        List<MapSqlParameterSource> batch = new ArrayList<>();
        Set<Integer> positions = new LinkedHashSet<>();
        for (PropertyPhoto photo : photos) {
            if (photo.url() == null || !positions.add(photo.position())) {
                continue;
            }
            batch.add(new MapSqlParameterSource()
                .addValue("zpid", zpid)
                .addValue("photoIndex", photo.position())
                .addValue("url", photo.url())
                .addValue("caption", photo.caption()));
        }
        jdbc.batchUpdate(
            """
                INSERT INTO property_photos (zpid, photo_index, url, caption)
                VALUES (:zpid, :photoIndex, :url, :caption)
                """,
            batch.toArray(new MapSqlParameterSource[0])
        );
        return batch.size();
    }

    private MapSqlParameterSource summaryParams(ListingSummary summary, String sourceUrl) {
        return new MapSqlParameterSource()
            .addValue("zpid", summary.zpid())
            .addValue("url", summary.url())
            .addValue("address", summary.address())
            .addValue("city", summary.city())
            .addValue("state", summary.state())
            .addValue("zipcode", summary.zipcode())
            .addValue("county", summary.county())
            .addValue("price", summary.price())
            .addValue("bedrooms", summary.bedrooms())
            .addValue("bathrooms", summary.bathrooms())
            .addValue("home_size_sqft", summary.homeSizeSqft())
            .addValue("lot_size", summary.lotSize())
            .addValue("lot_size_units", summary.lotSizeUnits())
            .addValue("home_type", summary.homeType())
            .addValue("property_type", summary.propertyType())
            .addValue("year_built", summary.yearBuilt())
            .addValue("home_status", summary.homeStatus())
            .addValue("contingent_listing_type", summary.contingentListingType())
            .addValue("listing_provider", summary.listingProvider())
            .addValue("days_on_zillow", summary.daysOnZillow())
            .addValue("page_view_count", summary.pageViewCount())
            .addValue("favorite_count", summary.favoriteCount())
            .addValue("zestimate", summary.zestimate())
            .addValue("rent_zestimate", summary.rentZestimate())
            .addValue("monthly_hoa_fee", summary.monthlyHoaFee())
            .addValue("latitude", summary.latitude())
            .addValue("longitude", summary.longitude())
            .addValue("mls_id", summary.mlsId())
            .addValue("mls_name", summary.mlsName())
            .addValue("agent_name", summary.agentName())
            .addValue("broker_name", summary.brokerName())
            .addValue("agent_phone", summary.agentPhone())
            .addValue("is_waterfront", summary.waterfront())
            .addValue("waterfront_type", summary.waterfrontType())
            .addValue("source_url", sourceUrl);
    }

    private MapSqlParameterSource detailParams(ListingDetail detail) {
        WaterfrontMeasurements measurements = detail.measurements();
        return new MapSqlParameterSource()
            .addValue("zpid", detail.zpid())
            .addValue("description_raw", detail.descriptionRaw())
            .addValue("waterfront_features", detail.waterfrontFeatures())
            .addValue("water_view", detail.waterView())
            .addValue("water_body_name", detail.waterBodyName())
            .addValue("on_market_date", detail.onMarketDate())
            .addValue("ownership_type", detail.ownershipType())
            .addValue("parcel_number", detail.parcelNumber())
            .addValue("living_area", detail.livingArea())
            .addValue("view_description", detail.viewDescription())
            .addValue("price_per_sqft", detail.pricePerSqft())
            .addValue("dock_info", detail.dockInfo())
            .addValue("bridge_height", detail.bridgeHeight())
            .addValue("water_depth", detail.waterDepth())
            .addValue("canal_info", detail.canalInfo())
            .addValue("ocean_access", detail.oceanAccess())
            .addValue("waterfront_linear_ft", measurements.waterfrontLinearFt())
            .addValue("dock_linear_ft", measurements.dockLinearFt())
            .addValue("slip_count", measurements.slipCount())
            .addValue("depth_at_mlw_ft", measurements.depthAtMlwFt())
            .addValue("bridge_clearance_ft", measurements.bridgeClearanceFt())
            .addValue("canal_width_ft", measurements.canalWidthFt())
            .addValue("no_fixed_bridges", measurements.noFixedBridges())
            .addValue("extracted_fields", extractedFieldsJson(detail.extractedFields()));
    }

    private String extractedFieldsJson(Map<String, FieldValue> fields) {
        if (fields.isEmpty()) {
            return null;
        }
        ObjectNode node = objectMapper.createObjectNode();
        fields.forEach((key, value) -> node.set(key, value.toJson()));
        try {
            return objectMapper.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unable to serialize extracted fields", e);
        }
    }

    private String upsertSql(String table, List<String> keyColumns, List<String> columns) {
        StringBuilder columnList = new StringBuilder();
        StringBuilder valueList = new StringBuilder();
        for (String column : columns) {
            if (columnList.length() > 0) {
                columnList.append(", ");
                valueList.append(", ");
            }
            columnList.append(column);
            valueList.append(':').append(column);
        }
        columnList.append(", updated_at");
        valueList.append(postgres ? ", NOW()" : ", CURRENT_TIMESTAMP()");

        if (!postgres) {
            return "MERGE INTO " + table + " (" + columnList + ") KEY(" + String.join(", ", keyColumns)
                + ") VALUES (" + valueList + ")";
        }

        StringBuilder updates = new StringBuilder();
        for (String column : columns) {
            if (keyColumns.contains(column)) {
                continue;
            }
            if (updates.length() > 0) {
                updates.append(", ");
            }
            updates.append(column).append(" = EXCLUDED.").append(column);
        }
        updates.append(", updated_at = NOW()");
        return "INSERT INTO " + table + " (" + columnList + ") VALUES (" + valueList + ") ON CONFLICT ("
            + String.join(", ", keyColumns) + ") DO UPDATE SET " + updates;
    }

    private boolean detectPostgres(NamedParameterJdbcTemplate jdbcTemplate) {
        if (jdbcTemplate.getJdbcTemplate().getDataSource() == null) {
            return false;
        }
        try (Connection connection = jdbcTemplate.getJdbcTemplate().getDataSource().getConnection()) {
            DatabaseMetaData metaData = connection.getMetaData();
            String productName = metaData == null ? null : metaData.getDatabaseProductName();
            String url = metaData == null ? null : metaData.getURL();
            if (url != null && url.toLowerCase(Locale.ROOT).startsWith("jdbc:h2:")) {
                return false;
            }
            return productName != null && productName.toLowerCase(Locale.ROOT).contains("postgres");
        } catch (Exception e) {
            log.warn("Unable to detect database product; defaulting to MERGE upserts", e);
            return false;
        }
    }
}
