package com.smartcook.ingest;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.smartcook.generation.Generation;
import com.smartcook.generation.GenerationManifest;
import com.smartcook.index.BruteForceSimilarityIndex;
import com.smartcook.index.RecipeRecord;
import com.smartcook.index.RecipeStore;
import com.smartcook.index.ReducerParameters;
import com.smartcook.index.TruncatedSvdReducer;
import com.smartcook.runtime.AppConfig;
import com.smartcook.text.FeatureHasher;
import com.smartcook.text.HashedVector;
import com.smartcook.text.IngredientNormalizer;

public class IndexBuilder {
    private static final Logger log = LoggerFactory.getLogger(IndexBuilder.class);

    private final FeatureHasher hasher;
    private final TruncatedSvdReducer reducer;
    private final IngredientListParser parser;
    private final AppConfig.BuildConfig buildConfig;
    private final Clock clock;

    public IndexBuilder(AppConfig config) {
        this(new FeatureHasher(config.getHashing().getDimension()),
                new TruncatedSvdReducer(
                        config.getReduction().getComponents(),
                        config.getReduction().getOversamples(),
                        config.getReduction().getPowerIterations(),
                        config.getReduction().getSeed()),
                config.getBuild(),
                Clock.systemUTC());
    }

    public IndexBuilder(FeatureHasher hasher, TruncatedSvdReducer reducer, AppConfig.BuildConfig buildConfig, Clock clock) {
        if (buildConfig.getChunkSize() <= 0) {
            throw new IllegalArgumentException("chunkSize must be positive: " + buildConfig.getChunkSize());
        }
        this.hasher = hasher;
        this.reducer = reducer;
        this.parser = new IngredientListParser();
        this.buildConfig = buildConfig;
        this.clock = clock;
    }

    public BuildResult build(Path corpusCsv) throws IOException {
        String fingerprint = CorpusFingerprint.sha256(corpusCsv);
        log.info("Building index from {} sha256={}", corpusCsv, fingerprint);
        try (RecipeCorpusReader reader = RecipeCorpusReader.open(corpusCsv)) {
            return build(reader, fingerprint);
        }
    }

    public BuildResult build(Iterator<RawRecipeRow> corpus) throws IOException {
        return build(corpus, "");
    }

    public BuildResult build(Iterator<RawRecipeRow> corpus, String corpusFingerprint) throws IOException {
        long start = System.nanoTime();
        Accumulator accumulator = new Accumulator();

        int workers = Math.max(1, buildConfig.getWorkerThreads());
        ExecutorService executor = Executors.newFixedThreadPool(workers);
        Deque<Future<ChunkResult>> inFlight = new ArrayDeque<>();
        try {
            int chunkIndex = 0;
            while (corpus.hasNext()) {
                List<RawRecipeRow> rows = nextChunk(corpus);
                int index = chunkIndex++;
                inFlight.addLast(executor.submit(() -> processChunk(index, rows)));
                if (inFlight.size() >= workers * 2) {
                    accumulator.accept(await(inFlight.removeFirst()));
                }
            }
            while (!inFlight.isEmpty()) {
                accumulator.accept(await(inFlight.removeFirst()));
            }
        } finally {
            executor.shutdownNow();
        }

        List<RecipeRecord> records = accumulator.records;
        List<HashedVector> hashed = accumulator.hashed;
        if (records.isEmpty()) {
            throw new EmptyCorpusException("Corpus yielded no usable recipes (rows=" + accumulator.totalRows
                    + ", skipped=" + accumulator.skipped + ")");
        }
        log.info("Vectorized {} recipes from {} rows in {} chunks (skipped {})",
                records.size(), accumulator.totalRows, accumulator.chunks, accumulator.skipped);

        ReducerParameters parameters = reducer.fit(hashed);
        List<float[]> projected = new ArrayList<>(hashed.size());
        for (HashedVector vector : hashed) {
            projected.add(parameters.project(vector));
        }
        BruteForceSimilarityIndex index = BruteForceSimilarityIndex.build(projected, parameters.components());

        GenerationManifest manifest = new GenerationManifest(
                GenerationManifest.CURRENT_FORMAT,
                hasher.config().scheme(),
                hasher.dimension(),
                parameters.components(),
                records.size(),
                parameters.activeColumnCount(),
                clock.instant(),
                corpusFingerprint);
        Generation generation = new Generation(manifest, parameters, index, new RecipeStore(records));

        long elapsedMs = (System.nanoTime() - start) / 1_000_000;
        BuildReport report = new BuildReport(
                accumulator.totalRows,
                records.size(),
                accumulator.skipped,
                accumulator.chunks,
                parameters.activeColumnCount(),
                elapsedMs);
        log.info("Index build finished recipes={} activeHashColumns={} components={} elapsedMs={}",
                report.indexedRecipes(),
                report.activeHashColumns(),
                parameters.components(),
                elapsedMs);
        return new BuildResult(generation, report);
    }

    private List<RawRecipeRow> nextChunk(Iterator<RawRecipeRow> corpus) {
        List<RawRecipeRow> rows = new ArrayList<>();
        while (corpus.hasNext() && rows.size() < buildConfig.getChunkSize()) {
            rows.add(corpus.next());
        }
        return rows;
    }

    ChunkResult processChunk(int chunkIndex, List<RawRecipeRow> rows) {
        List<ParsedRecipe> parsed = new ArrayList<>(rows.size());
        int skipped = 0;
        int missingColumn = 0;
        for (RawRecipeRow row : rows) {
            if (row.ingredients() == null) {
                missingColumn++;
            }
            List<String> ingredients;
            try {
                ingredients = parser.parse(row.ingredients());
            } catch (IngredientParseException e) {
                skipped++;
                log.debug("Skipping row {}: {}", row.rowNumber(), e.getMessage());
                continue;
            }
            String vectorText = ingredients.stream()
                    .map(IngredientNormalizer::normalize)
                    .filter(normalized -> !normalized.isEmpty())
                    .collect(Collectors.joining(" "));
            parsed.add(new ParsedRecipe(
                    truncate(row.title(), buildConfig.getMaxTitleLength()),
                    ingredients,
                    truncate(directionsText(row.directions()), buildConfig.getMaxDirectionsLength()),
                    truncate(row.link(), buildConfig.getMaxLinkLength()),
                    hasher.vectorize(vectorText)));
        }
        if (!rows.isEmpty() && missingColumn == rows.size()) {
            log.warn("Chunk {} has no ingredients column; all {} rows skipped", chunkIndex, rows.size());
        } else {
            log.info("Processed chunk {} rows={} parsed={} skipped={}", chunkIndex, rows.size(), parsed.size(), skipped);
        }
        return new ChunkResult(rows.size(), parsed, skipped);
    }

    private String directionsText(String directions) {
        if (directions == null) {
            return "";
        }
        return parser.tryParse(directions)
                .map(steps -> String.join(" ", steps))
                .orElse(directions);
    }

    private static ChunkResult await(Future<ChunkResult> future) throws IOException {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new InterruptedIOException("Index build interrupted");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            if (cause instanceof Error error) {
                throw error;
            }
            throw new IOException("Chunk processing failed", cause);
        }
    }

    private static String truncate(String value, int maxLength) {
        if (value == null) {
            return "";
        }
        if (maxLength <= 0 || value.length() <= maxLength) {
            return value;
        }
        return value.substring(0, maxLength);
    }

    private static final class Accumulator {
        private final List<RecipeRecord> records = new ArrayList<>();
        private final List<HashedVector> hashed = new ArrayList<>();
        private long totalRows;
        private long skipped;
        private int chunks;

        void accept(ChunkResult result) {
            for (ParsedRecipe recipe : result.recipes()) {
                records.add(new RecipeRecord(records.size(), recipe.title(), recipe.ingredients(), recipe.directions(), recipe.link()));
                hashed.add(recipe.vector());
            }
            totalRows += result.rows();
            skipped += result.skipped();
            chunks++;
        }
    }

    record ParsedRecipe(String title, List<String> ingredients, String directions, String link, HashedVector vector) {
    }

    record ChunkResult(int rows, List<ParsedRecipe> recipes, int skipped) {
    }
}
