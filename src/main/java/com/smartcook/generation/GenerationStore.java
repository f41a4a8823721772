package com.smartcook.generation;

import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Stream;
import java.util.zip.GZIPInputStream;
import java.util.zip.GZIPOutputStream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SequenceWriter;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.smartcook.index.BruteForceSimilarityIndex;
import com.smartcook.index.RecipeRecord;
import com.smartcook.index.RecipeStore;
import com.smartcook.index.ReducerParameters;
import com.smartcook.text.HasherConfig;

public class GenerationStore {
    private static final Logger log = LoggerFactory.getLogger(GenerationStore.class);

    private final ObjectMapper objectMapper = JsonMapper.builder()
            .findAndAddModules()
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .build();

    public void save(Generation generation, Path directory) throws IOException {
        if (!(generation.index() instanceof BruteForceSimilarityIndex index)) {
            throw new IllegalArgumentException("Unsupported similarity index type: " + generation.index().getClass().getName());
        }
        Path parent = directory.toAbsolutePath().getParent();
        Files.createDirectories(parent);
        Path staging = Files.createTempDirectory(parent, directory.getFileName() + ".staging-");
        try {
            ArtifactLocations locations = ArtifactLocations.in(staging);
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(locations.manifest().toFile(), generation.manifest());
            try (DataOutputStream out = binaryOut(locations.reducer())) {
                generation.reducer().writeTo(out);
            }
            try (DataOutputStream out = binaryOut(locations.vectors())) {
                index.writeTo(out);
            }
            try (SequenceWriter writer = objectMapper.writer().writeValues(locations.recipes().toFile())) {
                writer.init(true);
                for (RecipeRecord record : generation.store().records()) {
                    writer.write(record);
                }
            }
            if (Files.exists(directory)) {
                throw new IOException("Generation directory already exists: " + directory);
            }
            try {
                Files.move(staging, directory, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(staging, directory);
            }
        } finally {
            deleteRecursively(staging);
        }
        log.info("Saved generation recipes={} components={} to {}",
                generation.manifest().recipeCount(),
                generation.manifest().components(),
                directory);
    }

    public GenerationManifest readManifest(Path manifestPath) throws MissingArtifactException {
        if (!Files.isRegularFile(manifestPath)) {
            throw new MissingArtifactException(manifestPath, "Generation manifest not found");
        }
        try {
            GenerationManifest manifest = objectMapper.readValue(manifestPath.toFile(), GenerationManifest.class);
            if (manifest == null) {
                throw new MissingArtifactException(manifestPath, "Empty generation manifest");
            }
            if (manifest.formatVersion() != GenerationManifest.CURRENT_FORMAT) {
                throw new MissingArtifactException(manifestPath, "Unsupported generation format " + manifest.formatVersion());
            }
            if (manifest.hashScheme() == null || manifest.builtAt() == null
                    || manifest.hashDimension() <= 0 || manifest.components() <= 0
                    || manifest.recipeCount() < 0 || manifest.activeHashColumns() < 0) {
                throw new MissingArtifactException(manifestPath, "Invalid generation manifest " + manifest);
            }
            return manifest;
        } catch (MissingArtifactException e) {
            throw e;
        } catch (IOException e) {
            throw new MissingArtifactException(manifestPath, "Unreadable generation manifest", e);
        }
    }

    public Generation load(ArtifactLocations locations, HasherConfig expectedHasher, int expectedComponents) throws IOException {
        for (Path artifact : locations.all()) {
            if (!Files.isRegularFile(artifact)) {
                throw new MissingArtifactException(artifact, "Generation artifact not found");
            }
        }
        GenerationManifest manifest = readManifest(locations.manifest());
        Generation.requireCompatible(manifest, expectedHasher, expectedComponents);

        ReducerParameters reducer;
        try (DataInputStream in = binaryIn(locations.reducer())) {
            reducer = ReducerParameters.readFrom(in);
        } catch (IOException e) {
            throw new MissingArtifactException(locations.reducer(), "Unreadable reducer parameters", e);
        }

        BruteForceSimilarityIndex index;
        try (DataInputStream in = binaryIn(locations.vectors())) {
            index = BruteForceSimilarityIndex.readFrom(in);
        } catch (IOException | ArithmeticException e) {
            throw new MissingArtifactException(locations.vectors(), "Unreadable similarity vectors", e);
        }

        List<RecipeRecord> records = new ArrayList<>();
        try (MappingIterator<RecipeRecord> iterator = objectMapper.readerFor(RecipeRecord.class)
                .readValues(locations.recipes().toFile())) {
            while (iterator.hasNext()) {
                records.add(iterator.next());
            }
        } catch (IOException | RuntimeException e) {
            throw new MissingArtifactException(locations.recipes(), "Unreadable recipe store", e);
        }

        try {
            Generation generation = new Generation(manifest, reducer, index, new RecipeStore(records));
            log.info("Loaded generation recipes={} components={} builtAt={}",
                    manifest.recipeCount(),
                    manifest.components(),
                    manifest.builtAt());
            return generation;
        } catch (IllegalArgumentException e) {
            throw new MissingArtifactException(locations.manifest(), "Inconsistent generation artifacts (" + e.getMessage() + ")", e);
        }
    }

    private static DataOutputStream binaryOut(Path path) throws IOException {
        OutputStream file = Files.newOutputStream(path);
        return new DataOutputStream(new BufferedOutputStream(new GZIPOutputStream(file, 1 << 16)));
    }

    private static DataInputStream binaryIn(Path path) throws IOException {
        InputStream file = Files.newInputStream(path);
        return new DataInputStream(new BufferedInputStream(new GZIPInputStream(file, 1 << 16)));
    }

    private static void deleteRecursively(Path root) throws IOException {
        if (!Files.exists(root)) {
            return;
        }
        try (Stream<Path> paths = Files.walk(root)) {
            for (Path path : paths.sorted(Comparator.reverseOrder()).toList()) {
                Files.deleteIfExists(path);
            }
        }
    }
}
