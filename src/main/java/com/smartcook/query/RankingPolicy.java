package com.smartcook.query;

public record RankingPolicy(
        int candidatePoolSize,
        int defaultTopN,
        int minRecipeIngredients,
        int minUsedIngredients,
        int minCoveragePercent) {

    public RankingPolicy {
        if (candidatePoolSize <= 0) {
            throw new IllegalArgumentException("candidatePoolSize must be positive");
        }
        if (minCoveragePercent < 0 || minCoveragePercent > 100) {
            throw new IllegalArgumentException("minCoveragePercent must be within 0..100");
        }
    }

    public static RankingPolicy defaults() {
        return new RankingPolicy(100, 5, 3, 2, 30);
    }

    public int requiredUsed(int querySize) {
        int scaled = (minCoveragePercent * querySize + 99) / 100;
        return Math.max(minUsedIngredients, scaled);
    }
}
