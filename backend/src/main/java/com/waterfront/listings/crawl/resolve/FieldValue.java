package com.waterfront.listings.crawl.resolve;

import com.fasterxml.jackson.annotation.JsonValue;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.waterfront.listings.crawl.util.NumberParsing;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * A resolved value of unknown marketplace shape. Keeps the flexible payload typed at the
 * boundary: text, number, boolean, nested map or list.
 */
public sealed interface FieldValue
    permits FieldValue.Text, FieldValue.Numeric, FieldValue.Bool, FieldValue.MapValue, FieldValue.ListValue {

    /**
     * True for values the marketplace uses to say "nothing here".
     */
    boolean isEmpty();

    /**
     * Scalar rendering; nested values render as JSON.
     */
    String asText();

    @JsonValue
    JsonNode toJson();

    default Optional<BigDecimal> asDecimal() {
        return Optional.empty();
    }

    record Text(String value) implements FieldValue {
        @Override
        public boolean isEmpty() {
            return isAbsentText(value);
        }

        @Override
        public String asText() {
            return value;
        }

        @Override
        public JsonNode toJson() {
            return JsonNodeFactory.instance.textNode(value);
        }

        @Override
        public Optional<BigDecimal> asDecimal() {
            return NumberParsing.parseDecimal(value);
        }
    }

    record Numeric(BigDecimal value) implements FieldValue {
        @Override
        public boolean isEmpty() {
            return value == null;
        }

        @Override
        public String asText() {
            return value == null ? null : value.stripTrailingZeros().toPlainString();
        }

        @Override
        public JsonNode toJson() {
            return JsonNodeFactory.instance.numberNode(value);
        }

        @Override
        public Optional<BigDecimal> asDecimal() {
            return Optional.ofNullable(value);
        }
    }

    record Bool(boolean value) implements FieldValue {
        @Override
        public boolean isEmpty() {
            return false;
        }

        @Override
        public String asText() {
            return Boolean.toString(value);
        }

        @Override
        public JsonNode toJson() {
            return JsonNodeFactory.instance.booleanNode(value);
        }
    }

    record MapValue(Map<String, FieldValue> entries) implements FieldValue {
        public MapValue {
            entries = entries == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(entries));
        }

        @Override
        public boolean isEmpty() {
            return entries.isEmpty();
        }

        @Override
        public String asText() {
            return toJson().toString();
        }

        @Override
        public JsonNode toJson() {
            ObjectNode node = JsonNodeFactory.instance.objectNode();
            entries.forEach((key, value) -> node.set(key, value.toJson()));
            return node;
        }
    }

    record ListValue(List<FieldValue> items) implements FieldValue {
        public ListValue {
            items = items == null ? List.of() : List.copyOf(items);
        }

        @Override
        public boolean isEmpty() {
            return items.isEmpty();
        }

        @Override
        public String asText() {
            return toJson().toString();
        }

        @Override
        public JsonNode toJson() {
            ArrayNode node = JsonNodeFactory.instance.arrayNode();
            items.forEach(item -> node.add(item.toJson()));
            return node;
        }
    }

    static FieldValue text(String value) {
        return new Text(value);
    }

    /**
     * Converts a Jackson tree into a value; JSON null and missing nodes yield empty.
     */
    static Optional<FieldValue> fromJson(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return Optional.empty();
        }
        if (node.isBoolean()) {
            return Optional.of(new Bool(node.booleanValue()));
        }
        if (node.isNumber()) {
            return Optional.of(new Numeric(node.decimalValue()));
        }
        if (node.isTextual()) {
            return Optional.of(new Text(node.textValue()));
        }
        if (node.isArray()) {
            List<FieldValue> items = new ArrayList<>();
            for (JsonNode child : node) {
                fromJson(child).ifPresent(items::add);
            }
            return Optional.of(new ListValue(items));
        }
        if (node.isObject()) {
            Map<String, FieldValue> entries = new LinkedHashMap<>();
            node.fields().forEachRemaining(entry ->
                fromJson(entry.getValue()).ifPresent(value -> entries.put(entry.getKey(), value))
            );
            return Optional.of(new MapValue(entries));
        }
        return Optional.of(new Text(node.asText()));
    }

    static boolean isAbsentText(String value) {
        if (value == null) {
            return true;
        }
        String trimmed = value.trim();
        if (trimmed.isEmpty()) {
            return true;
        }
        String lower = trimmed.toLowerCase(Locale.ROOT);
        return lower.equals("null")
            || lower.equals("undefined")
            || lower.equals("[]")
            || lower.equals("{}")
            || lower.equals("\"\"");
    }
}
