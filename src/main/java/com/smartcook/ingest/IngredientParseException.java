package com.smartcook.ingest;

public class IngredientParseException extends IllegalArgumentException {
    public IngredientParseException(String message) {
        super(message);
    }

    public IngredientParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
