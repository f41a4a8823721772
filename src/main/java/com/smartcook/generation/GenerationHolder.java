package com.smartcook.generation;

import java.io.IOException;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.smartcook.query.QueryEngine;
import com.smartcook.query.Suggestion;

/**
 * Serving-side slot for the active generation. Queries read the slot once, so an in-flight query
 * sees either the old or the new generation in full.
 */
public class GenerationHolder {
    private static final Logger log = LoggerFactory.getLogger(GenerationHolder.class);

    private final AtomicReference<Generation> active = new AtomicReference<>();
    private final GenerationStore store;
    private final QueryEngine queryEngine;
    private final int components;

    public GenerationHolder(GenerationStore store, QueryEngine queryEngine, int components) {
        this.store = store;
        this.queryEngine = queryEngine;
        this.components = components;
    }

    public Optional<Generation> current() {
        return Optional.ofNullable(active.get());
    }

    public Generation reload(ArtifactLocations locations) throws IOException {
        Generation loaded;
        try {
            loaded = store.load(locations, queryEngine.hasherConfig(), components);
        } catch (IOException | RuntimeException e) {
            log.warn("Generation load from {} failed, keeping {} in place: {}",
                    locations.manifest().getParent(),
                    active.get() == null ? "no generation" : "the active generation",
                    e.getMessage());
            throw e;
        }
        install(loaded);
        return loaded;
    }

    public void install(Generation generation) {
        generation.requireCompatible(queryEngine.hasherConfig(), components);
        Generation previous = active.getAndSet(generation);
        log.info("Activated generation builtAt={} recipes={} (replaced {})",
                generation.manifest().builtAt(),
                generation.manifest().recipeCount(),
                previous == null ? "nothing" : previous.manifest().builtAt());
    }

    public List<Suggestion> suggest(String rawQuery, int topN) {
        Generation snapshot = active.get();
        if (snapshot == null) {
            throw new IllegalStateException("No generation loaded");
        }
        return queryEngine.suggest(snapshot, rawQuery, topN);
    }
}
