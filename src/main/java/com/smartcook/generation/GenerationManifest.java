package com.smartcook.generation;

import java.time.Instant;

public record GenerationManifest(
        int formatVersion,
        String hashScheme,
        int hashDimension,
        int components,
        int recipeCount,
        int activeHashColumns,
        Instant builtAt,
        String corpusFingerprint) {
    public static final int CURRENT_FORMAT = 1;

    public GenerationManifest {
        corpusFingerprint = corpusFingerprint == null ? "" : corpusFingerprint;
    }
}
