package com.smartcook.ingest;

import java.io.Closeable;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.Map;
import java.util.NoSuchElementException;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;

public class RecipeCorpusReader implements Iterator<RawRecipeRow>, Closeable {
    private final MappingIterator<Map<String, String>> rows;
    private long rowNumber;

    private RecipeCorpusReader(MappingIterator<Map<String, String>> rows) {
        this.rows = rows;
    }

    public static RecipeCorpusReader open(Path csv) throws IOException {
        return open(Files.newBufferedReader(csv, StandardCharsets.UTF_8));
    }

    public static RecipeCorpusReader open(Reader reader) throws IOException {
        CsvMapper mapper = CsvMapper.builder()
                .enable(CsvParser.Feature.SKIP_EMPTY_LINES)
                .enable(CsvParser.Feature.ALLOW_TRAILING_COMMA)
                .build();
        CsvSchema schema = CsvSchema.emptySchema().withHeader();
        MappingIterator<Map<String, String>> rows = mapper.readerForMapOf(String.class)
                .with(schema)
                .readValues(reader);
        return new RecipeCorpusReader(rows);
    }

    @Override
    public boolean hasNext() {
        return rows.hasNext();
    }

    @Override
    public RawRecipeRow next() {
        if (!rows.hasNext()) {
            throw new NoSuchElementException();
        }
        Map<String, String> row = rows.next();
        rowNumber++;
        return new RawRecipeRow(
                rowNumber,
                row.getOrDefault("title", ""),
                row.get("ingredients"),
                row.getOrDefault("directions", ""),
                row.getOrDefault("link", ""));
    }

    @Override
    public void close() throws IOException {
        rows.close();
    }
}
