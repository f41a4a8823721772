package com.smartcook.generation;

import java.nio.file.Path;
import java.util.List;

public record ArtifactLocations(Path manifest, Path reducer, Path vectors, Path recipes) {
    public static final String MANIFEST_FILE = "manifest.json";
    public static final String REDUCER_FILE = "reducer.bin";
    public static final String VECTORS_FILE = "vectors.bin";
    public static final String RECIPES_FILE = "recipes.json";

    public static ArtifactLocations in(Path directory) {
        return new ArtifactLocations(
                directory.resolve(MANIFEST_FILE),
                directory.resolve(REDUCER_FILE),
                directory.resolve(VECTORS_FILE),
                directory.resolve(RECIPES_FILE));
    }

    public List<Path> all() {
        return List.of(manifest, reducer, vectors, recipes);
    }
}
