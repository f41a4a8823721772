package com.smartcook.ingest;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;

import java.io.IOException;
import java.io.StringReader;
import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.Test;

class RecipeCorpusReaderTest {

    @Test
    void shouldReadQuotedFieldsAndIgnoreExtraColumns() throws IOException {
        String csv = "id,title,ingredients,directions,link,source,NER\n"
                + "0,Pancakes,\"[\"\"2 eggs\"\", \"\"1 c. flour\"\"]\",\"[\"\"Whisk, then fry.\"\"]\",example.com/p,Gathered,\"[]\"\n"
                + "1,Toast,\"[\"\"bread\"\"]\",Toast it.,example.com/t,Gathered,\"[]\"\n";

        List<RawRecipeRow> rows = readAll(csv);

        assertEquals(2, rows.size());
        RawRecipeRow first = rows.get(0);
        assertEquals(1, first.rowNumber());
        assertEquals("Pancakes", first.title());
        assertEquals("[\"2 eggs\", \"1 c. flour\"]", first.ingredients());
        assertEquals("[\"Whisk, then fry.\"]", first.directions());
        assertEquals("example.com/p", first.link());
        assertEquals(2, rows.get(1).rowNumber());
    }

    @Test
    void shouldReportMissingColumnsAsEmptyOrNull() throws IOException {
        List<RawRecipeRow> rows = readAll("title,directions\nSoup,Boil.\n");

        assertEquals(1, rows.size());
        assertNull(rows.get(0).ingredients());
        assertEquals("", rows.get(0).link());
    }

    @Test
    void shouldYieldNothingForHeaderOnlyCorpus() throws IOException {
        try (RecipeCorpusReader reader = RecipeCorpusReader.open(new StringReader("title,ingredients\n"))) {
            assertFalse(reader.hasNext());
        }
    }

    private static List<RawRecipeRow> readAll(String csv) throws IOException {
        List<RawRecipeRow> rows = new ArrayList<>();
        try (RecipeCorpusReader reader = RecipeCorpusReader.open(new StringReader(csv))) {
            reader.forEachRemaining(rows::add);
        }
        return rows;
    }
}
