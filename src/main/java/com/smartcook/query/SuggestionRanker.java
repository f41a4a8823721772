package com.smartcook.query;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.smartcook.index.Candidate;
import com.smartcook.index.RecipeRecord;
import com.smartcook.index.RecipeStore;
import com.smartcook.text.IngredientNormalizer;

public class SuggestionRanker {
    private static final Logger log = LoggerFactory.getLogger(SuggestionRanker.class);
    static final Comparator<Suggestion> ORDER = Comparator.comparingInt(Suggestion::matchPercentage)
            .reversed()
            .thenComparing(Comparator.comparingInt(Suggestion::usedCount).reversed());

    private final RankingPolicy policy;

    public SuggestionRanker(RankingPolicy policy) {
        this.policy = policy;
    }

    public List<Suggestion> rank(List<Candidate> candidates, RecipeStore store, Set<String> queryPhrases, int topN) {
        int requiredUsed = policy.requiredUsed(queryPhrases.size());
        List<Suggestion> survivors = new ArrayList<>();
        for (Candidate candidate : candidates) {
            Optional<RecipeRecord> found = store.find(candidate.id());
            if (found.isEmpty()) {
                log.warn("Candidate id {} is outside the recipe store (size {}); skipping", candidate.id(), store.size());
                continue;
            }
            RecipeRecord recipe = found.get();
            int total = recipe.ingredients().size();
            if (total < policy.minRecipeIngredients()) {
                continue;
            }

            List<String> used = new ArrayList<>();
            List<String> missing = new ArrayList<>();
            for (String ingredient : recipe.ingredients()) {
                if (queryPhrases.contains(IngredientNormalizer.normalize(ingredient))) {
                    used.add(ingredient);
                } else {
                    missing.add(ingredient);
                }
            }
            if (used.size() < requiredUsed) {
                continue;
            }

            survivors.add(new Suggestion(
                    recipe.id(),
                    recipe.title(),
                    matchPercentage(used.size(), total),
                    used,
                    missing,
                    total,
                    recipe.directions(),
                    recipe.link(),
                    candidate.similarity()));
        }

        survivors.sort(ORDER);
        return survivors.size() > topN ? List.copyOf(survivors.subList(0, topN)) : List.copyOf(survivors);
    }

    static int matchPercentage(int used, int total) {
        return (int) Math.rint(100.0 * used / total);
    }
}
