package com.smartcook.generation;

import java.io.IOException;
import java.nio.file.Path;

public class MissingArtifactException extends IOException {
    private final Path artifact;

    public MissingArtifactException(Path artifact, String message) {
        super(message + ": " + artifact);
        this.artifact = artifact;
    }

    public MissingArtifactException(Path artifact, String message, Throwable cause) {
        super(message + ": " + artifact, cause);
        this.artifact = artifact;
    }

    public Path artifact() {
        return artifact;
    }
}
