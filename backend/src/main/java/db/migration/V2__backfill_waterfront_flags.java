package db.migration;

import java.sql.Statement;
import org.flywaydb.core.api.migration.BaseJavaMigration;
import org.flywaydb.core.api.migration.Context;

/**
 * Marks summary rows as waterfront when their detail row already carries a waterfront signal.
 * Rows written before the flag was derived at extraction time stay consistent with new ones.
 */
public class V2__backfill_waterfront_flags extends BaseJavaMigration {
  private static final String[] DESCRIPTION_KEYWORDS = {
    "waterfront", "ocean", "intracoastal", "canal", "river", "lake", "bay", "dock"
  };

  @Override
  public void migrate(Context context) throws Exception {
    StringBuilder descriptionMatch = new StringBuilder();
    for (String keyword : DESCRIPTION_KEYWORDS) {
      if (descriptionMatch.length() > 0) {
        descriptionMatch.append(" OR ");
      }
      descriptionMatch.append("LOWER(d.description_raw) LIKE '%").append(keyword).append("%'");
    }

    try (Statement statement = context.getConnection().createStatement()) {
      statement.executeUpdate(
          "UPDATE listings_summary SET is_waterfront = TRUE "
              + "WHERE is_waterfront = FALSE AND zpid IN ("
              + "SELECT d.zpid FROM listings_detail d "
              + "WHERE (d.waterfront_features IS NOT NULL AND d.waterfront_features <> '' "
              + "AND d.waterfront_features <> '[]') "
              + "OR (d.water_view IS NOT NULL AND d.water_view <> '' AND LOWER(d.water_view) <> 'none') "
              + "OR (d.water_body_name IS NOT NULL AND d.water_body_name <> '') "
              + "OR (d.description_raw IS NOT NULL AND ("
              + descriptionMatch
              + ")))");
    }

    try (Statement statement = context.getConnection().createStatement()) {
      statement.executeUpdate(
          "UPDATE listings_summary SET waterfront_type = 'waterfront' "
              + "WHERE is_waterfront = TRUE AND waterfront_type IS NULL");
    }
  }
}
