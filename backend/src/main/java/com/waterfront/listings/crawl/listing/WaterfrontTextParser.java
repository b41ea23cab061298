package com.waterfront.listings.crawl.listing;

import com.waterfront.listings.crawl.model.WaterfrontMeasurements;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads dock length, frontage, slips, depth, bridge clearance and canal width out of listing free
 * text. When a measurement appears more than once the largest value wins.
 */
public class WaterfrontTextParser {
    private static final String FEET = "(?:'|ft\\b\\.?|feet\\b|foot\\b|lf\\b)";

    private static final Pattern LENGTH_RE = Pattern.compile(
        "(?<![\\d.])(\\d{2,4})\\s*" + FEET,
        Pattern.CASE_INSENSITIVE
    );
    private static final Pattern LABEL_RE = Pattern.compile(
        "\\b(dock\\s*length|dock\\s*size|water\\s*frontage|waterfront\\s*(?:length|footage)|frontage|seawall\\s*length)"
            + "\\s*[:\\-]?\\s*(\\d{2,4})",
        Pattern.CASE_INSENSITIVE
    );
    private static final Pattern DOCK_WORDS = Pattern.compile(
        "\\b(dock|dockage|t-?dock|u-?dock|boat\\s*slip|slips?|finger\\s+pier|pier)\\b",
        Pattern.CASE_INSENSITIVE
    );
    private static final Pattern FRONTAGE_WORDS = Pattern.compile(
        "\\b(waterfront|water\\s*front|frontage|wf|seawall|sea\\s+wall|bulkhead)\\b",
        Pattern.CASE_INSENSITIVE
    );
    // Lengths immediately followed by these words are depths, clearances, widths or boat sizes.
    private static final Pattern NOT_A_LENGTH = Pattern.compile(
        "^\\s*(?:of\\s+)?(?:water\\s+)?(?:deep|depth|at\\s+mlw|mlw|mean\\s+low|low\\s+tide|clearance|bridge\\s+clearance"
            + "|wide|width|beam|boat\\b|vessel|yacht)",
        Pattern.CASE_INSENSITIVE
    );
    private static final Pattern SLIP_COUNT_RE = Pattern.compile(
        "\\b(\\d{1,2})\\s+(?:boat\\s+)?slips?\\b",
        Pattern.CASE_INSENSITIVE
    );
    private static final Pattern DEPTH_RE = Pattern.compile(
        "(\\d{1,2}(?:\\.\\d+)?)\\s*" + FEET
            + "\\s*(?:of\\s+water\\s+)?(?:deep\\b|depth\\b|(?:at\\s+)?(?:mlw|mean\\s+low\\s+water|low\\s+tide))",
        Pattern.CASE_INSENSITIVE
    );
    private static final Pattern DEPTH_LABEL_RE = Pattern.compile(
        "\\bdepth\\s*(?:at\\s+mlw)?\\s*[:\\-]?\\s*(\\d{1,2}(?:\\.\\d+)?)\\s*" + FEET,
        Pattern.CASE_INSENSITIVE
    );
    private static final Pattern BRIDGE_CLEARANCE_RE = Pattern.compile(
        "(\\d{1,3})\\s*" + FEET + "\\s*(?:of\\s+)?(?:bridge\\s+)?clearance",
        Pattern.CASE_INSENSITIVE
    );
    private static final Pattern BRIDGE_CLEARANCE_LABEL_RE = Pattern.compile(
        "\\bclearance\\s*(?:of|:|-)?\\s*(\\d{1,3})\\s*" + FEET,
        Pattern.CASE_INSENSITIVE
    );
    private static final Pattern CANAL_WIDTH_RE = Pattern.compile(
        "(\\d{2,3})\\s*" + FEET + "\\s*(?:wide\\s+canal|canal\\s+width|wide)",
        Pattern.CASE_INSENSITIVE
    );
    private static final Pattern CANAL_WIDTH_LABEL_RE = Pattern.compile(
        "\\bcanal\\s+width\\s*[:\\-]?\\s*(\\d{2,3})",
        Pattern.CASE_INSENSITIVE
    );
    private static final Pattern NO_FIXED_BRIDGES_RE = Pattern.compile(
        "\\bno\\b.{0,6}\\bfixed\\s+bridges?\\b",
        Pattern.CASE_INSENSITIVE
    );

    private static final int AFTER_WINDOW = 30;
    private static final int BEFORE_WINDOW = 40;

    public WaterfrontMeasurements parse(String text) {
        if (text == null || text.isBlank()) {
            return WaterfrontMeasurements.none();
        }
        String normalized = text
            .replace('\u2019', '\'')
            .replace('\u2032', '\'')
            .replace('`', '\'');

        Integer dock = null;
        Integer frontage = null;

        Matcher label = LABEL_RE.matcher(normalized);
        while (label.find()) {
            Integer value = ValueCoercion.parseInteger(label.group(2));
            if (label.group(1).toLowerCase(Locale.ROOT).startsWith("dock")) {
                dock = max(dock, value);
            } else {
                frontage = max(frontage, value);
            }
        }

        Matcher length = LENGTH_RE.matcher(normalized);
        while (length.find()) {
            String after = normalized.substring(length.end(), Math.min(normalized.length(), length.end() + AFTER_WINDOW));
            if (NOT_A_LENGTH.matcher(after).find()) {
                continue;
            }
            String before = normalized.substring(Math.max(0, length.start() - BEFORE_WINDOW), length.start());
            Category category = earliest(after);
            if (category == null) {
                category = latest(before);
            }
            Integer value = ValueCoercion.parseInteger(length.group(1));
            if (category == Category.DOCK) {
                dock = max(dock, value);
            } else if (category == Category.FRONTAGE) {
                frontage = max(frontage, value);
            }
        }

        Integer slips = null;
        Matcher slipMatcher = SLIP_COUNT_RE.matcher(normalized);
        while (slipMatcher.find()) {
            slips = max(slips, ValueCoercion.parseInteger(slipMatcher.group(1)));
        }

        Integer depth = maxRounded(DEPTH_RE, normalized, null);
        depth = maxRounded(DEPTH_LABEL_RE, normalized, depth);
        Integer clearance = maxRounded(BRIDGE_CLEARANCE_RE, normalized, null);
        clearance = maxRounded(BRIDGE_CLEARANCE_LABEL_RE, normalized, clearance);
        Integer canalWidth = maxRounded(CANAL_WIDTH_RE, normalized, null);
        canalWidth = maxRounded(CANAL_WIDTH_LABEL_RE, normalized, canalWidth);

        boolean noFixedBridges = NO_FIXED_BRIDGES_RE.matcher(normalized).find();
        return new WaterfrontMeasurements(frontage, dock, slips, depth, clearance, canalWidth, noFixedBridges);
    }

    private Category earliest(String window) {
        Matcher dock = DOCK_WORDS.matcher(window);
        Matcher frontage = FRONTAGE_WORDS.matcher(window);
        int dockAt = dock.find() ? dock.start() : Integer.MAX_VALUE;
        int frontageAt = frontage.find() ? frontage.start() : Integer.MAX_VALUE;
        if (dockAt == Integer.MAX_VALUE && frontageAt == Integer.MAX_VALUE) {
            return null;
        }
        return dockAt <= frontageAt ? Category.DOCK : Category.FRONTAGE;
    }

    private Category latest(String window) {
        int dockAt = lastStart(DOCK_WORDS, window);
        int frontageAt = lastStart(FRONTAGE_WORDS, window);
        if (dockAt < 0 && frontageAt < 0) {
            return null;
        }
        return dockAt >= frontageAt ? Category.DOCK : Category.FRONTAGE;
    }

    private int lastStart(Pattern pattern, String window) {
        Matcher matcher = pattern.matcher(window);
        int last = -1;
        while (matcher.find()) {
            last = matcher.start();
        }
        return last;
    }

    private Integer maxRounded(Pattern pattern, String text, Integer current) {
        Matcher matcher = pattern.matcher(text);
        Integer best = current;
        while (matcher.find()) {
            int value = new BigDecimal(matcher.group(1)).setScale(0, RoundingMode.HALF_UP).intValue();
            best = max(best, value);
        }
        return best;
    }

    private static Integer max(Integer current, Integer candidate) {
        if (candidate == null) {
            return current;
        }
        if (current == null) {
            return candidate;
        }
        return Math.max(current, candidate);
    }

    private enum Category {
        DOCK,
        FRONTAGE
    }
}
