package com.smartcook.ingest;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.json.JsonReadFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;

public class IngredientListParser {
    private final ObjectMapper objectMapper = JsonMapper.builder()
            .enable(JsonReadFeature.ALLOW_SINGLE_QUOTES)
            .enable(JsonReadFeature.ALLOW_BACKSLASH_ESCAPING_ANY_CHARACTER)
            .enable(JsonReadFeature.ALLOW_UNESCAPED_CONTROL_CHARS)
            .build();

    public List<String> parse(String text) {
        if (text == null || text.isBlank()) {
            throw new IngredientParseException("Ingredient field is empty");
        }
        JsonNode node;
        try {
            node = objectMapper.readTree(text);
        } catch (JsonProcessingException e) {
            throw new IngredientParseException("Ingredient field is not a list literal", e);
        }
        if (node == null || !node.isArray()) {
            throw new IngredientParseException("Ingredient field is not a list: " + abbreviate(text));
        }
        List<String> items = new ArrayList<>(node.size());
        for (JsonNode element : node) {
            if (!element.isValueNode() || element.isNull()) {
                throw new IngredientParseException("Ingredient list holds a non-text element: " + abbreviate(text));
            }
            items.add(element.asText());
        }
        return items;
    }

    public Optional<List<String>> tryParse(String text) {
        try {
            return Optional.of(parse(text));
        } catch (IngredientParseException e) {
            return Optional.empty();
        }
    }

    private static String abbreviate(String text) {
        return text.length() > 80 ? text.substring(0, 80) + "..." : text;
    }
}
