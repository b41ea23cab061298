package com.waterfront.listings.crawl.listing;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Derives the "on the water" flag and a coarse waterfront type from listing signals.
 */
public class WaterfrontClassifier {
    public static final String TYPE_WATER_VIEW = "water-view";
    public static final String TYPE_ACCESS_ONLY = "access-only";
    public static final String TYPE_GENERIC = "waterfront";

    // Most specific first.
    private static final List<String> WATER_TYPES = List.of(
        "intracoastal",
        "ocean",
        "canal",
        "bay",
        "river",
        "lake"
    );
    private static final Pattern ACCESS_ONLY = Pattern.compile("\\b(water|boat|beach|deeded)\\s+access\\b");
    private static final List<String> NEGATIVE_VIEW_VALUES = List.of("none", "no", "n/a", "false");

    private final List<Pattern> descriptionKeywords;

    public WaterfrontClassifier(List<String> descriptionKeywords) {
        List<Pattern> patterns = new ArrayList<>();
        for (String keyword : descriptionKeywords) {
            patterns.add(wordPattern(keyword));
        }
        this.descriptionKeywords = List.copyOf(patterns);
    }

    public Classification classify(String waterfrontFeatures, String waterView, String waterBodyName, String description) {
        boolean hasFeatures = present(waterfrontFeatures);
        boolean hasView = present(waterView) && !NEGATIVE_VIEW_VALUES.contains(waterView.trim().toLowerCase(Locale.ROOT));
        boolean hasWaterBody = present(waterBodyName);
        String descriptionLower = description == null ? "" : description.toLowerCase(Locale.ROOT);
        boolean descriptionHit = descriptionKeywords.stream().anyMatch(p -> p.matcher(descriptionLower).find());

        boolean waterfront = hasFeatures || hasView || hasWaterBody || descriptionHit;
        if (!waterfront) {
            return new Classification(false, null);
        }

        String structured = String.join(" ",
            lower(waterfrontFeatures),
            lower(waterBodyName),
            hasView ? lower(waterView) : ""
        );
        String type = waterType(structured);
        if (type == null) {
            type = waterType(descriptionLower);
        }
        if (type == null && hasView && !hasFeatures && !hasWaterBody) {
            type = TYPE_WATER_VIEW;
        }
        if (type == null && (ACCESS_ONLY.matcher(structured).find() || ACCESS_ONLY.matcher(descriptionLower).find())) {
            type = TYPE_ACCESS_ONLY;
        }
        return new Classification(true, type == null ? TYPE_GENERIC : type);
    }

    private String waterType(String text) {
        if (text == null || text.isBlank()) {
            return null;
        }
        for (String type : WATER_TYPES) {
            if (wordPattern(type).matcher(text).find()) {
                return type;
            }
        }
        return null;
    }

    private static Pattern wordPattern(String keyword) {
        return Pattern.compile("\\b" + Pattern.quote(keyword.toLowerCase(Locale.ROOT)) + "\\b");
    }

    private static boolean present(String value) {
        if (value == null) {
            return false;
        }
        String trimmed = value.trim();
        return !trimmed.isEmpty() && !trimmed.equals("[]") && !trimmed.equalsIgnoreCase("null");
    }

    private static String lower(String value) {
        return value == null ? "" : value.toLowerCase(Locale.ROOT);
    }

    public record Classification(boolean waterfront, String type) {
    }
}
