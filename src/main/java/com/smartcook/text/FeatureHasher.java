package com.smartcook.text;

import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.regex.Pattern;

public class FeatureHasher {
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private final HasherConfig config;

    public FeatureHasher(HasherConfig config) {
        this.config = config;
    }

    public FeatureHasher(int dimension) {
        this(HasherConfig.of(dimension));
    }

    public HasherConfig config() {
        return config;
    }

    public int dimension() {
        return config.dimension();
    }

    public HashedVector vectorize(String normalizedText) {
        int dimension = config.dimension();
        if (normalizedText == null || normalizedText.isBlank()) {
            return HashedVector.empty(dimension);
        }

        TreeMap<Integer, Float> buckets = new TreeMap<>();
        for (String token : WHITESPACE.split(normalizedText)) {
            if (token.isBlank()) {
                continue;
            }
            int index = Math.floorMod(token.hashCode(), dimension);
            buckets.merge(index, 1f, Float::sum);
        }

        float norm = 0f;
        for (float v : buckets.values()) {
            norm += v * v;
        }
        norm = (float) Math.sqrt(norm);

        int[] indices = new int[buckets.size()];
        float[] values = new float[buckets.size()];
        int position = 0;
        for (Map.Entry<Integer, Float> bucket : buckets.entrySet()) {
            indices[position] = bucket.getKey();
            values[position] = bucket.getValue() / norm;
            position++;
        }
        return new HashedVector(dimension, indices, values);
    }

    public List<HashedVector> vectorizeAll(List<String> normalizedTexts) {
        return normalizedTexts.stream()
                .map(this::vectorize)
                .toList();
    }
}
