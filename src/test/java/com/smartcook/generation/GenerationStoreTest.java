package com.smartcook.generation;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.stream.Stream;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.smartcook.fixture.RecipeFixtures;
import com.smartcook.text.HasherConfig;

class GenerationStoreTest {
    @TempDir
    Path tempDir;

    private final GenerationStore store = new GenerationStore();
    private Generation generation;

    @BeforeEach
    void buildGeneration() throws IOException {
        generation = RecipeFixtures.builder(RecipeFixtures.smallConfig())
                .build(RecipeFixtures.pantryCorpus().iterator())
                .generation();
    }

    @Test
    void shouldRoundTripAllArtifacts() throws IOException {
        Path directory = tempDir.resolve("gen-1");
        store.save(generation, directory);

        Generation loaded = store.load(ArtifactLocations.in(directory), HasherConfig.of(RecipeFixtures.DIMENSION),
                RecipeFixtures.COMPONENTS);

        assertEquals(generation.manifest(), loaded.manifest());
        assertEquals(generation.reducer(), loaded.reducer());
        assertEquals(generation.store().records(), loaded.store().records());
        assertArrayEquals(RecipeFixtures.rowsOf(generation.index()), RecipeFixtures.rowsOf(loaded.index()));
        try (Stream<Path> siblings = Files.list(tempDir)) {
            assertEquals(1, siblings.count());
        }
    }

    @Test
    void shouldRefuseToOverwriteAnExistingGeneration() throws IOException {
        Path directory = tempDir.resolve("gen-1");
        store.save(generation, directory);

        assertThrows(IOException.class, () -> store.save(generation, directory));
        assertTrue(Files.isRegularFile(directory.resolve("manifest.json")));
    }

    @Test
    void shouldRejectGenerationBuiltWithDifferentSettings() throws IOException {
        Path directory = tempDir.resolve("gen-1");
        store.save(generation, directory);
        ArtifactLocations locations = ArtifactLocations.in(directory);

        assertThrows(ConfigMismatchException.class,
                () -> store.load(locations, HasherConfig.of(1 << 18), RecipeFixtures.COMPONENTS));
        assertThrows(ConfigMismatchException.class,
                () -> store.load(locations, HasherConfig.of(RecipeFixtures.DIMENSION), 100));
        assertThrows(ConfigMismatchException.class,
                () -> store.load(locations, new HasherConfig("murmur3", RecipeFixtures.DIMENSION), RecipeFixtures.COMPONENTS));
    }

    @Test
    void shouldReportMissingArtifacts() throws IOException {
        Path directory = tempDir.resolve("gen-1");
        store.save(generation, directory);
        ArtifactLocations locations = ArtifactLocations.in(directory);
        Files.delete(locations.recipes());

        MissingArtifactException error = assertThrows(MissingArtifactException.class,
                () -> store.load(locations, HasherConfig.of(RecipeFixtures.DIMENSION), RecipeFixtures.COMPONENTS));
        assertEquals(locations.recipes(), error.artifact());
    }

    @Test
    void shouldReportCorruptArtifacts() throws IOException {
        Path directory = tempDir.resolve("gen-1");
        store.save(generation, directory);
        ArtifactLocations locations = ArtifactLocations.in(directory);
        Files.write(locations.vectors(), new byte[] { 1, 2, 3, 4 });

        MissingArtifactException error = assertThrows(MissingArtifactException.class,
                () -> store.load(locations, HasherConfig.of(RecipeFixtures.DIMENSION), RecipeFixtures.COMPONENTS));
        assertEquals(locations.vectors(), error.artifact());
    }

    @Test
    void shouldReportManifestWithImpossibleValues() throws IOException {
        String[][] corruptions = {
                { "\"recipeCount\"\\s*:\\s*\\d+", "\"recipeCount\" : -1" },
                { "\"recipeCount\"\\s*:\\s*\\d+", "\"recipeCount\" : 8" },
                { "\"activeHashColumns\"\\s*:\\s*\\d+", "\"activeHashColumns\" : -3" },
                { "\"builtAt\"\\s*:\\s*\"[^\"]*\"", "\"builtAt\" : null" },
                { "\\{", "[" } };
        for (int i = 0; i < corruptions.length; i++) {
            Path directory = tempDir.resolve("gen-" + i);
            store.save(generation, directory);
            ArtifactLocations locations = ArtifactLocations.in(directory);
            String manifest = Files.readString(locations.manifest());
            Files.writeString(locations.manifest(), manifest.replaceFirst(corruptions[i][0], corruptions[i][1]));

            MissingArtifactException error = assertThrows(MissingArtifactException.class,
                    () -> store.load(locations, HasherConfig.of(RecipeFixtures.DIMENSION), RecipeFixtures.COMPONENTS),
                    corruptions[i][1]);
            assertEquals(locations.manifest(), error.artifact());
        }
    }

    @Test
    void shouldReportMissingManifest() {
        assertFalse(Files.exists(tempDir.resolve("nowhere")));
        assertThrows(MissingArtifactException.class,
                () -> store.readManifest(tempDir.resolve("nowhere").resolve("manifest.json")));
    }
}
