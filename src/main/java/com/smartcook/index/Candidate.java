package com.smartcook.index;

import java.util.Comparator;

public record Candidate(int id, float similarity) {
    public static final Comparator<Candidate> BY_RANK = Comparator.comparingDouble(Candidate::similarity)
            .reversed()
            .thenComparingInt(Candidate::id);
}
