package com.waterfront.listings.crawl.listing;

import com.waterfront.listings.crawl.resolve.FieldValue;
import com.waterfront.listings.crawl.util.NumberParsing;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.regex.Pattern;

/**
 * Coerces resolved values into column types. Anything that does not fit yields null.
 */
final class ValueCoercion {

    private static final Pattern BARE_NUMBER = Pattern.compile("[-+$]?[\\d.,\\s]+");

    private ValueCoercion() {
    }

    static String toText(FieldValue value) {
        if (value == null || value.isEmpty()) {
            return null;
        }
        if (value instanceof FieldValue.MapValue || value instanceof FieldValue.ListValue) {
            return null;
        }
        String text = value.asText();
        return text == null ? null : text.trim();
    }

    /**
     * Like {@link #toText} but renders lists as a comma-joined string and maps as JSON.
     */
    static String toDisplayText(FieldValue value) {
        if (value == null || value.isEmpty()) {
            return null;
        }
        if (value instanceof FieldValue.ListValue list) {
            StringBuilder joined = new StringBuilder();
            for (FieldValue item : list.items()) {
                String text = item instanceof FieldValue.ListValue || item instanceof FieldValue.MapValue
                    ? item.asText()
                    : toText(item);
                if (text == null || text.isBlank()) {
                    continue;
                }
                if (joined.length() > 0) {
                    joined.append(", ");
                }
                joined.append(text);
            }
            return joined.length() == 0 ? null : joined.toString();
        }
        return value.asText();
    }

    /**
     * Display text of a value that names a water feature. A bare number says nothing about water
     * and yields null.
     */
    static String toSignalText(FieldValue value) {
        if (value instanceof FieldValue.Numeric) {
            return null;
        }
        String text = toDisplayText(value);
        if (text == null || text.isBlank() || BARE_NUMBER.matcher(text.trim()).matches()) {
            return null;
        }
        return text;
    }

    static BigDecimal toDecimal(FieldValue value) {
        if (value == null || value.isEmpty()) {
            return null;
        }
        return value.asDecimal().orElse(null);
    }

    static Integer toInteger(FieldValue value) {
        BigDecimal decimal = toDecimal(value);
        if (decimal == null) {
            return null;
        }
        try {
            return decimal.setScale(0, RoundingMode.HALF_UP).intValueExact();
        } catch (ArithmeticException e) {
            return null;
        }
    }

    static Long toLong(FieldValue value) {
        BigDecimal decimal = toDecimal(value);
        if (decimal == null) {
            return null;
        }
        try {
            return decimal.setScale(0, RoundingMode.HALF_UP).longValueExact();
        } catch (ArithmeticException e) {
            return null;
        }
    }

    static Double toDouble(FieldValue value) {
        BigDecimal decimal = toDecimal(value);
        return decimal == null ? null : decimal.doubleValue();
    }

    static Integer parseInteger(String raw) {
        return NumberParsing.parseInteger(raw).orElse(null);
    }
}
