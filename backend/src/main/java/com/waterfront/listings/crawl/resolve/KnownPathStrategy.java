package com.waterfront.listings.crawl.resolve;

import com.fasterxml.jackson.databind.JsonNode;
import com.waterfront.listings.crawl.payload.ListingPayload;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Exact key lookup inside the well-known sections of the cache and of the property object.
 */
public class KnownPathStrategy implements ResolutionStrategy {
    private final FieldDefinitions definitions;

    public KnownPathStrategy(FieldDefinitions definitions) {
        this.definitions = definitions;
    }

    @Override
    public ResolutionSource source() {
        return ResolutionSource.KNOWN_PATH;
    }

    @Override
    public Optional<FieldValue> attempt(NameVariants variants, ListingPayload payload) {
        for (JsonNode root : roots(payload)) {
            for (String section : definitions.knownSections()) {
                JsonNode sectionNode = root.get(section);
                if (sectionNode == null || !sectionNode.isObject()) {
                    continue;
                }
                for (String variant : variants.strong()) {
                    Optional<FieldValue> value = FieldValue.fromJson(sectionNode.get(variant));
                    if (value.isPresent() && !value.get().isEmpty()) {
                        return value;
                    }
                }
            }
        }
        return Optional.empty();
    }

    private List<JsonNode> roots(ListingPayload payload) {
        List<JsonNode> roots = new ArrayList<>();
        if (payload.cache().isObject()) {
            roots.add(payload.cache());
        }
        JsonNode property = payload.propertyNode();
        if (property.isObject()) {
            roots.add(property);
        }
        return roots;
    }
}
