package com.smartcook.query;

import java.util.List;

public record Suggestion(
        int recipeId,
        String title,
        int matchPercentage,
        List<String> used,
        List<String> missing,
        int totalIngredientCount,
        String directions,
        String link,
        float similarity) {

    public Suggestion {
        used = List.copyOf(used);
        missing = List.copyOf(missing);
    }

    public int usedCount() {
        return used.size();
    }
}
