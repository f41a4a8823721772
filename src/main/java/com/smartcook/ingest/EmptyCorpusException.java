package com.smartcook.ingest;

public class EmptyCorpusException extends IllegalStateException {
    public EmptyCorpusException(String message) {
        super(message);
    }
}
