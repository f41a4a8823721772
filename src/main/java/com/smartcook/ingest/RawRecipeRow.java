package com.smartcook.ingest;

public record RawRecipeRow(long rowNumber, String title, String ingredients, String directions, String link) {
}
