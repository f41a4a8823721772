package com.smartcook.generation;

import com.smartcook.index.RecipeStore;
import com.smartcook.index.ReducerParameters;
import com.smartcook.index.SimilarityIndex;
import com.smartcook.text.HasherConfig;

public record Generation(GenerationManifest manifest, ReducerParameters reducer, SimilarityIndex index, RecipeStore store) {
    public Generation {
        if (reducer.hashDimension() != manifest.hashDimension()) {
            throw new IllegalArgumentException("Reducer was fitted on dimensionality " + reducer.hashDimension()
                    + " but the manifest declares " + manifest.hashDimension());
        }
        if (reducer.components() != manifest.components() || index.dimension() != manifest.components()) {
            throw new IllegalArgumentException("Reduced dimensionality disagrees: manifest=" + manifest.components()
                    + " reducer=" + reducer.components() + " index=" + index.dimension());
        }
        if (index.size() != store.size() || store.size() != manifest.recipeCount()) {
            throw new IllegalArgumentException("Row counts disagree: manifest=" + manifest.recipeCount()
                    + " index=" + index.size() + " store=" + store.size());
        }
    }

    public HasherConfig hasherConfig() {
        return new HasherConfig(manifest.hashScheme(), manifest.hashDimension());
    }

    public void requireCompatible(HasherConfig expectedHasher, int expectedComponents) {
        requireCompatible(manifest, expectedHasher, expectedComponents);
    }

    static void requireCompatible(GenerationManifest manifest, HasherConfig expectedHasher, int expectedComponents) {
        if (!expectedHasher.scheme().equals(manifest.hashScheme())) {
            throw new ConfigMismatchException("Generation was hashed with scheme " + manifest.hashScheme()
                    + " but the running hasher uses " + expectedHasher.scheme());
        }
        if (expectedHasher.dimension() != manifest.hashDimension()) {
            throw new ConfigMismatchException("Generation hashed dimensionality " + manifest.hashDimension()
                    + " does not match configured " + expectedHasher.dimension());
        }
        if (expectedComponents != manifest.components()) {
            throw new ConfigMismatchException("Generation reduced dimensionality " + manifest.components()
                    + " does not match configured " + expectedComponents);
        }
    }
}
