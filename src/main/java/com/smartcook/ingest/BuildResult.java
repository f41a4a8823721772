package com.smartcook.ingest;

import com.smartcook.generation.Generation;

public record BuildResult(Generation generation, BuildReport report) {
}
