package com.waterfront.listings.crawl.resolve;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Alternate spellings of a logical field name.
 *
 * <p>Strong variants are the name itself, its camelCase and snake_case forms and the curated
 * synonyms. Weak variants are the single words of a multi-word name, which only the recursive
 * tree search uses.
 */
public record NameVariants(String field, List<String> strong, List<String> weak) {

    public NameVariants {
        strong = List.copyOf(strong);
        weak = List.copyOf(weak);
    }

    public static NameVariants of(String field, FieldDefinitions definitions) {
        Set<String> strong = new LinkedHashSet<>();
        strong.add(field);
        if (field.contains("_")) {
            strong.add(snakeToCamel(field));
        }
        String snake = camelToSnake(field);
        if (!snake.equals(field)) {
            strong.add(snake);
        }
        strong.addAll(definitions.synonymsFor(field));
        strong.addAll(definitions.synonymsFor(snake));

        Set<String> weak = new LinkedHashSet<>();
        String[] words = snake.split("_");
        if (words.length > 1) {
            for (String word : words) {
                if (word.isBlank() || definitions.isWeakStopWord(word)) {
                    continue;
                }
                String lower = word.toLowerCase(Locale.ROOT);
                weak.add(lower);
                weak.add(Character.toUpperCase(lower.charAt(0)) + lower.substring(1));
            }
        }
        weak.removeAll(strong);
        return new NameVariants(field, new ArrayList<>(strong), new ArrayList<>(weak));
    }

    public static String snakeToCamel(String name) {
        StringBuilder out = new StringBuilder();
        boolean upperNext = false;
        for (char c : name.toCharArray()) {
            if (c == '_') {
                upperNext = out.length() > 0;
                continue;
            }
            out.append(upperNext ? Character.toUpperCase(c) : c);
            upperNext = false;
        }
        return out.toString();
    }

    public static String camelToSnake(String name) {
        StringBuilder out = new StringBuilder();
        for (int i = 0; i < name.length(); i++) {
            char c = name.charAt(i);
            if (Character.isUpperCase(c)) {
                if (i > 0 && name.charAt(i - 1) != '_') {
                    out.append('_');
                }
                out.append(Character.toLowerCase(c));
            } else {
                out.append(c);
            }
        }
        return out.toString();
    }
}
