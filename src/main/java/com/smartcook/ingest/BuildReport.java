package com.smartcook.ingest;

public record BuildReport(
        long totalRows,
        int indexedRecipes,
        long skippedRecords,
        int chunks,
        int activeHashColumns,
        long elapsedMs) {
}
