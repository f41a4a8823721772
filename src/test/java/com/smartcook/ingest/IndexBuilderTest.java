package com.smartcook.ingest;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.smartcook.fixture.RecipeFixtures;
import com.smartcook.generation.Generation;
import com.smartcook.index.RecipeRecord;
import com.smartcook.runtime.AppConfig;
import com.smartcook.text.HasherConfig;

class IndexBuilderTest {

    @Test
    void shouldIndexParsableRowsAndSkipTheRest() throws IOException {
        BuildResult result = RecipeFixtures.builder(RecipeFixtures.smallConfig())
                .build(RecipeFixtures.pantryCorpus().iterator());

        BuildReport report = result.report();
        assertEquals(8, report.totalRows());
        assertEquals(7, report.indexedRecipes());
        assertEquals(1, report.skippedRecords());
        assertEquals(4, report.chunks());

        Generation generation = result.generation();
        assertEquals(7, generation.store().size());
        assertEquals(7, generation.index().size());
        assertEquals(RecipeFixtures.COMPONENTS, generation.index().dimension());
        assertEquals(HasherConfig.STRING_HASH_V1, generation.manifest().hashScheme());
        assertEquals(RecipeFixtures.DIMENSION, generation.manifest().hashDimension());
        assertEquals(Instant.parse("2026-01-15T10:00:00Z"), generation.manifest().builtAt());
    }

    @Test
    void shouldAssignIdsInCorpusOrder() throws IOException {
        Generation generation = RecipeFixtures.builder(RecipeFixtures.smallConfig())
                .build(RecipeFixtures.pantryCorpus().iterator())
                .generation();

        List<String> titles = generation.store().records().stream().map(RecipeRecord::title).toList();
        assertEquals(List.of("Pancakes", "Shortbread", "Omelette", "Tomato salad", "Garlic bread", "French toast", "Guacamole"),
                titles);
        for (int id = 0; id < titles.size(); id++) {
            assertEquals(id, generation.store().records().get(id).id());
        }
        assertEquals(List.of("2 eggs", "1 c. flour", "1 cup milk", "1 tbsp. sugar"),
                generation.store().find(0).orElseThrow().ingredients());
    }

    @Test
    void shouldProduceTheSameGenerationRegardlessOfWorkerCount() throws IOException {
        AppConfig parallel = RecipeFixtures.smallConfig();
        AppConfig sequential = RecipeFixtures.smallConfig();
        sequential.getBuild().setWorkerThreads(1);
        sequential.getBuild().setChunkSize(100);

        Generation first = RecipeFixtures.builder(parallel).build(RecipeFixtures.pantryCorpus().iterator()).generation();
        Generation second = RecipeFixtures.builder(sequential).build(RecipeFixtures.pantryCorpus().iterator()).generation();

        assertEquals(first.manifest(), second.manifest());
        assertEquals(first.reducer(), second.reducer());
        assertEquals(first.store().records(), second.store().records());
        assertArrayEquals(RecipeFixtures.rowsOf(first.index()), RecipeFixtures.rowsOf(second.index()));
    }

    @Test
    void shouldFailWhenNoRowIsUsable() {
        List<RawRecipeRow> rows = List.of(
                new RawRecipeRow(1, "Soup", null, "Boil.", ""),
                new RawRecipeRow(2, "Stew", null, "Simmer.", ""),
                new RawRecipeRow(3, "Tea", "'steep'", "Pour.", ""));

        EmptyCorpusException error = assertThrows(EmptyCorpusException.class,
                () -> RecipeFixtures.builder(RecipeFixtures.smallConfig()).build(rows.iterator()));
        assertEquals("Corpus yielded no usable recipes (rows=3, skipped=3)", error.getMessage());
        assertThrows(EmptyCorpusException.class,
                () -> RecipeFixtures.builder(RecipeFixtures.smallConfig()).build(List.<RawRecipeRow>of().iterator()));
    }

    @Test
    void shouldTruncateStoredFieldsAndFlattenDirections() throws IOException {
        AppConfig config = RecipeFixtures.smallConfig();
        config.getBuild().setMaxTitleLength(4);
        config.getBuild().setMaxLinkLength(7);
        List<RawRecipeRow> rows = List.of(
                new RawRecipeRow(1, "Pancakes", RecipeFixtures.listLiteral("eggs", "flour", "milk"),
                        RecipeFixtures.listLiteral("Whisk.", "Fry."), "example.com/pancakes"),
                RecipeFixtures.row(2, "Toast", "bread", "butter"));

        RecipeRecord record = RecipeFixtures.builder(config).build(rows.iterator()).generation().store().find(0).orElseThrow();

        assertEquals("Panc", record.title());
        assertEquals("example", record.link());
        assertEquals("Whisk. Fry.", record.directions());
    }

    @Test
    void shouldFingerprintCorpusFile(@TempDir Path tempDir) throws IOException {
        Path csv = tempDir.resolve("corpus.csv");
        Files.writeString(csv, "title,ingredients,directions,link\n"
                + "Pancakes,\"[\"\"eggs\"\", \"\"flour\"\", \"\"milk\"\"]\",Fry.,example.com/1\n"
                + "Toast,\"[\"\"bread\"\", \"\"butter\"\"]\",Toast.,example.com/2\n", StandardCharsets.UTF_8);

        BuildResult result = RecipeFixtures.builder(RecipeFixtures.smallConfig()).build(csv);

        assertEquals(CorpusFingerprint.sha256(csv), result.generation().manifest().corpusFingerprint());
        assertEquals(64, result.generation().manifest().corpusFingerprint().length());
        assertEquals(2, result.report().indexedRecipes());
    }
}
