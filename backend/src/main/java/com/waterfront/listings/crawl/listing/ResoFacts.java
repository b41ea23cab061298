package com.waterfront.listings.crawl.listing;

import com.fasterxml.jackson.databind.JsonNode;
import com.waterfront.listings.crawl.resolve.FieldValue;

import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * The listing facts block, normalized to camelCase keys whether the payload carried it as a map or
 * as a list of {@code {factLabel, factValue}} pairs.
 */
public final class ResoFacts {
    // Label substrings checked in order; the first hit names the fact.
    private static final List<Map.Entry<String, String>> LABEL_KEYS = List.of(
        Map.entry("year built", "yearBuilt"),
        Map.entry("lot size", "lotSize"),
        Map.entry("parcel", "parcelNumber"),
        Map.entry("waterfront", "waterfrontFeatures"),
        Map.entry("water view", "waterView"),
        Map.entry("water body", "waterBodyName"),
        Map.entry("dock", "dockInfo"),
        Map.entry("bridge", "bridgeHeight"),
        Map.entry("depth", "waterDepth"),
        Map.entry("canal", "canalInfo"),
        Map.entry("ocean", "oceanAccess"),
        Map.entry("price/sqft", "pricePerSquareFoot"),
        Map.entry("price per", "pricePerSquareFoot"),
        Map.entry("hoa", "hoaFee"),
        Map.entry("living area", "livingArea"),
        Map.entry("bedroom", "bedrooms"),
        Map.entry("bathroom", "bathrooms"),
        Map.entry("ownership", "ownershipType"),
        Map.entry("type", "homeType"),
        Map.entry("view", "view"),
        Map.entry("county", "county")
    );

    private final Map<String, JsonNode> facts;
    private final Set<String> consumed = new HashSet<>();

    private ResoFacts(Map<String, JsonNode> facts) {
        this.facts = facts;
    }

    public static ResoFacts empty() {
        return new ResoFacts(Map.of());
    }

    public static ResoFacts read(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return empty();
        }
        Map<String, JsonNode> facts = new LinkedHashMap<>();
        if (node.isObject()) {
            node.fields().forEachRemaining(entry -> {
                if (entry.getKey().equals("atAGlanceFacts") && entry.getValue().isArray()) {
                    readLabelled(entry.getValue(), facts);
                } else {
                    facts.put(entry.getKey(), entry.getValue());
                }
            });
        } else if (node.isArray()) {
            readLabelled(node, facts);
        }
        return new ResoFacts(facts);
    }

    private static void readLabelled(JsonNode list, Map<String, JsonNode> out) {
        for (JsonNode item : list) {
            if (!item.isObject()) {
                continue;
            }
            String label = item.path("factLabel").asText("");
            JsonNode value = item.get("factValue");
            if (label.isBlank() || value == null || value.isNull()) {
                continue;
            }
            String key = keyForLabel(label);
            out.putIfAbsent(key, value);
        }
    }

    static String keyForLabel(String label) {
        String lower = label.toLowerCase(Locale.ROOT).trim();
        for (Map.Entry<String, String> entry : LABEL_KEYS) {
            if (lower.contains(entry.getKey())) {
                return entry.getValue();
            }
        }
        StringBuilder camel = new StringBuilder();
        boolean upperNext = false;
        for (char c : lower.toCharArray()) {
            if (!Character.isLetterOrDigit(c)) {
                upperNext = camel.length() > 0;
                continue;
            }
            camel.append(upperNext ? Character.toUpperCase(c) : c);
            upperNext = false;
        }
        return camel.toString();
    }

    /**
     * The first non-empty fact among {@code keys}; each returned key is marked as consumed.
     */
    public Optional<FieldValue> first(String... keys) {
        for (String key : keys) {
            Optional<FieldValue> value = FieldValue.fromJson(facts.get(key));
            if (value.isPresent() && !value.get().isEmpty()) {
                consumed.add(key);
                return value;
            }
        }
        return Optional.empty();
    }

    public Optional<JsonNode> node(String key) {
        return Optional.ofNullable(facts.get(key));
    }

    /**
     * Facts not consumed by a column, for the extra-field bag.
     */
    public Map<String, JsonNode> remaining() {
        Map<String, JsonNode> remaining = new LinkedHashMap<>();
        facts.forEach((key, value) -> {
            if (!consumed.contains(key)) {
                remaining.put(key, value);
            }
        });
        return Collections.unmodifiableMap(remaining);
    }

    public boolean isEmpty() {
        return facts.isEmpty();
    }
}
