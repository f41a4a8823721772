package com.smartcook.index;

import java.util.List;

public record RecipeRecord(int id, String title, List<String> ingredients, String directions, String link) {
    public RecipeRecord {
        title = title == null ? "" : title;
        ingredients = ingredients == null ? List.of() : List.copyOf(ingredients);
        directions = directions == null ? "" : directions;
        link = link == null ? "" : link;
    }
}
