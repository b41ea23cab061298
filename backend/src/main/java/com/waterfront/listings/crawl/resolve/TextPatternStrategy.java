package com.waterfront.listings.crawl.resolve;

import com.waterfront.listings.crawl.payload.ListingPayload;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pattern search for {@code "variant": value} occurrences in one text form of the page.
 */
public class TextPatternStrategy implements ResolutionStrategy {
    private static final List<String> TEMPLATES = List.of(
        "\"%s\"\\s*:\\s*\"([^\"]+)\"",
        "\"%s\"\\s*:\\s*([^,\\s}]+)",
        "%s\\s*:\\s*\"([^\"]+)\"",
        "%s\\s*:\\s*([^,\\s}]+)"
    );
    // Keyed by variant; the variant set is bounded by the field definitions.
    private static final Map<String, List<Pattern>> PATTERNS = new ConcurrentHashMap<>();

    private final ResolutionSource source;
    private final Function<ListingPayload, String> textSelector;

    public TextPatternStrategy(ResolutionSource source, Function<ListingPayload, String> textSelector) {
        this.source = source;
        this.textSelector = textSelector;
    }

    public static TextPatternStrategy cleanedText() {
        return new TextPatternStrategy(ResolutionSource.CLEANED_TEXT, ListingPayload::cleanedText);
    }

    public static TextPatternStrategy rawText() {
        return new TextPatternStrategy(ResolutionSource.RAW_TEXT, ListingPayload::rawText);
    }

    public static TextPatternStrategy pageText() {
        return new TextPatternStrategy(ResolutionSource.PAGE_TEXT, ListingPayload::pageText);
    }

    @Override
    public ResolutionSource source() {
        return source;
    }

    @Override
    public Optional<FieldValue> attempt(NameVariants variants, ListingPayload payload) {
        String text = textSelector.apply(payload);
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        for (String variant : variants.strong()) {
            for (Pattern pattern : patternsFor(variant)) {
                Matcher matcher = pattern.matcher(text);
                while (matcher.find()) {
                    String candidate = matcher.group(1).trim();
                    if (!FieldValue.isAbsentText(candidate)) {
                        return Optional.of(FieldValue.text(candidate));
                    }
                }
            }
        }
        return Optional.empty();
    }

    static List<Pattern> patternsFor(String variant) {
        return PATTERNS.computeIfAbsent(variant, key -> {
            String quoted = Pattern.quote(key);
            return TEMPLATES.stream()
                .map(template -> Pattern.compile(String.format(template, quoted), Pattern.CASE_INSENSITIVE))
                .toList();
        });
    }
}
