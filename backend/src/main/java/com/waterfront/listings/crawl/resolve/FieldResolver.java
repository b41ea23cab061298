package com.waterfront.listings.crawl.resolve;

import com.waterfront.listings.crawl.payload.ListingPayload;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Resolves a logical field against a listing payload by walking an ordered strategy chain and
 * stopping at the first non-empty value.
 */
@Component
public class FieldResolver {
    private static final Logger log = LoggerFactory.getLogger(FieldResolver.class);

    private final FieldDefinitions definitions;
    private final List<ResolutionStrategy> strategies;
    private final List<ResolutionStrategy> exactStrategies;
    private final Map<String, NameVariants> variantCache = new ConcurrentHashMap<>();

    @Autowired
    public FieldResolver(FieldDefinitions definitions) {
        this(definitions, defaultStrategies(definitions));
    }

    public FieldResolver(FieldDefinitions definitions, List<ResolutionStrategy> strategies) {
        this.definitions = definitions;
        this.strategies = List.copyOf(strategies);
        this.exactStrategies = this.strategies.stream().map(ResolutionStrategy::exactKeys).toList();
    }

    public static List<ResolutionStrategy> defaultStrategies(FieldDefinitions definitions) {
        return List.of(
            new KnownPathStrategy(definitions),
            new RecursiveSearchStrategy(definitions),
            TextPatternStrategy.cleanedText(),
            TextPatternStrategy.rawText(),
            TextPatternStrategy.pageText()
        );
    }

    public FieldResolution resolve(String field, ListingPayload payload) {
        return resolve(field, payload, strategies);
    }

    /**
     * Resolves without weak or substring key matches, for fields whose mere presence is taken as
     * a signal.
     */
    public FieldResolution resolveExact(String field, ListingPayload payload) {
        return resolve(field, payload, exactStrategies);
    }

    private FieldResolution resolve(String field, ListingPayload payload, List<ResolutionStrategy> chain) {
        if (field == null || field.isBlank() || payload == null) {
            return FieldResolution.miss(field);
        }
        NameVariants variants = variants(field);
        for (ResolutionStrategy strategy : chain) {
            Optional<FieldValue> value = strategy.attempt(variants, payload);
            if (value.isPresent() && !value.get().isEmpty()) {
                return new FieldResolution(field, value.get(), strategy.source());
            }
        }
        log.trace("No strategy resolved field {}", field);
        return FieldResolution.miss(field);
    }

    public NameVariants variants(String field) {
        return variantCache.computeIfAbsent(field, name -> NameVariants.of(name, definitions));
    }

    public FieldDefinitions definitions() {
        return definitions;
    }
}
