package com.waterfront.listings.crawl.util;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Lenient numeric parsing for marketplace strings such as "$1,250,000", "2,400 sqft" or "0.5 Acres".
 */
public final class NumberParsing {
    private static final String[] UNIT_SUFFIXES = {"sqft", "sq", "ft", "'", "acre", "%", "/"};
    private static final Pattern LEADING_NUMBER = Pattern.compile("^-?\\d+(?:\\.\\d+)?");

    private NumberParsing() {
    }

    public static Optional<BigDecimal> parseDecimal(String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        String cleaned = raw.trim()
            .replace("$", "")
            .replace(",", "")
            .replace("\"", "")
            .trim();
        if (cleaned.isEmpty()) {
            return Optional.empty();
        }
        Matcher matcher = LEADING_NUMBER.matcher(cleaned);
        if (!matcher.find()) {
            return Optional.empty();
        }
        String rest = cleaned.substring(matcher.end()).trim();
        // "1998abc" is junk; "2400 sqft", "2400sqft" or "0.5 Acres" carry a unit suffix.
        if (!rest.isEmpty() && !Character.isWhitespace(cleaned.charAt(matcher.end())) && !startsWithUnit(rest)) {
            return Optional.empty();
        }
        try {
            return Optional.of(new BigDecimal(matcher.group()));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }

    private static boolean startsWithUnit(String rest) {
        String lower = rest.toLowerCase(Locale.ROOT);
        for (String unit : UNIT_SUFFIXES) {
            if (lower.startsWith(unit)) {
                return true;
            }
        }
        return false;
    }

    public static Optional<Integer> parseInteger(String raw) {
        return parseDecimal(raw).map(value -> {
            try {
                return value.setScale(0, RoundingMode.HALF_UP).intValueExact();
            } catch (ArithmeticException e) {
                return null;
            }
        });
    }

    public static Optional<Long> parseLong(String raw) {
        return parseDecimal(raw).map(value -> {
            try {
                return value.setScale(0, RoundingMode.HALF_UP).longValueExact();
            } catch (ArithmeticException e) {
                return null;
            }
        });
    }
}
