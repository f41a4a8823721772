package com.smartcook.query;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

import com.smartcook.text.IngredientNormalizer;

public record ParsedQuery(Set<String> phrases, String vectorText) {
    public static ParsedQuery parse(String rawQuery) {
        Set<String> phrases = new LinkedHashSet<>();
        if (rawQuery != null) {
            for (String phrase : rawQuery.split(",")) {
                String normalized = IngredientNormalizer.normalize(phrase.strip());
                if (!normalized.isEmpty()) {
                    phrases.add(normalized);
                }
            }
        }
        return new ParsedQuery(Collections.unmodifiableSet(phrases), String.join(" ", phrases));
    }

    public boolean isEmpty() {
        return phrases.isEmpty();
    }

    public int size() {
        return phrases.size();
    }
}
