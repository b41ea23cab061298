package com.waterfront.listings.crawl.resolve;

import com.fasterxml.jackson.databind.JsonNode;
import com.waterfront.listings.crawl.payload.ListingPayload;

import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Depth-bounded walk of the cache tree with fuzzy key matching. Strong variants are tried over the
 * whole tree before the weak single-word variants. The {@link #exactKeys()} form only accepts keys
 * equal to a strong variant.
 */
public class RecursiveSearchStrategy implements ResolutionStrategy {
    // Shorter keys ("id", "at") would match far too many variants by containment.
    private static final int MIN_REVERSE_MATCH_LENGTH = 4;

    private final FieldDefinitions definitions;
    private final boolean exact;

    public RecursiveSearchStrategy(FieldDefinitions definitions) {
        this(definitions, false);
    }

    private RecursiveSearchStrategy(FieldDefinitions definitions, boolean exact) {
        this.definitions = definitions;
        this.exact = exact;
    }

    @Override
    public ResolutionStrategy exactKeys() {
        return exact ? this : new RecursiveSearchStrategy(definitions, true);
    }

    @Override
    public ResolutionSource source() {
        return ResolutionSource.RECURSIVE_SEARCH;
    }

    @Override
    public Optional<FieldValue> attempt(NameVariants variants, ListingPayload payload) {
        Optional<FieldValue> strong = search(payload.cache(), lowerCase(variants.strong()), 0);
        if (strong.isPresent() || exact) {
            return strong;
        }
        if (variants.weak().isEmpty()) {
            return Optional.empty();
        }
        return search(payload.cache(), lowerCase(variants.weak()), 0);
    }

    private Optional<FieldValue> search(JsonNode node, List<String> variants, int depth) {
        if (node == null || depth > definitions.maxSearchDepth()) {
            return Optional.empty();
        }
        if (node.isObject()) {
            Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> entry = fields.next();
                if (matches(entry.getKey(), variants)) {
                    Optional<FieldValue> value = FieldValue.fromJson(entry.getValue());
                    if (value.isPresent() && !value.get().isEmpty()) {
                        return value;
                    }
                }
                if (entry.getValue().isContainerNode()) {
                    Optional<FieldValue> nested = search(entry.getValue(), variants, depth + 1);
                    if (nested.isPresent()) {
                        return nested;
                    }
                }
            }
        } else if (node.isArray()) {
            for (JsonNode child : node) {
                Optional<FieldValue> nested = search(child, variants, depth + 1);
                if (nested.isPresent()) {
                    return nested;
                }
            }
        }
        return Optional.empty();
    }

    private boolean matches(String key, List<String> variants) {
        String lowerKey = key.toLowerCase(Locale.ROOT);
        if (exact) {
            return variants.contains(lowerKey);
        }
        for (String variant : variants) {
            if (lowerKey.contains(variant)) {
                return true;
            }
            if (lowerKey.length() >= MIN_REVERSE_MATCH_LENGTH && variant.contains(lowerKey)) {
                return true;
            }
        }
        return false;
    }

    private List<String> lowerCase(List<String> variants) {
        return variants.stream().map(v -> v.toLowerCase(Locale.ROOT)).distinct().toList();
    }
}
