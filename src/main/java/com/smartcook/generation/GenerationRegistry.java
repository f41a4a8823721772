package com.smartcook.generation;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Optional;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;

public class GenerationRegistry {
    private static final DateTimeFormatter GENERATION_NAME = DateTimeFormatter.ofPattern("'gen-'yyyyMMdd'T'HHmmssSSS")
            .withZone(ZoneOffset.UTC);

    private final Path registryPath;
    private final Path generationsRoot;
    private final Clock clock;
    private final ObjectMapper objectMapper = JsonMapper.builder()
            .findAndAddModules()
            .build();

    public GenerationRegistry(Path registryPath, Path generationsRoot) {
        this(registryPath, generationsRoot, Clock.systemUTC());
    }

    public GenerationRegistry(Path registryPath, Path generationsRoot, Clock clock) {
        this.registryPath = registryPath;
        this.generationsRoot = generationsRoot;
        this.clock = clock;
    }

    public RegistryState load() throws IOException {
        if (!Files.exists(registryPath) || Files.size(registryPath) == 0L) {
            return RegistryState.initial();
        }
        return objectMapper.readValue(registryPath.toFile(), RegistryState.class);
    }

    public Path newGenerationDirectory() throws IOException {
        Files.createDirectories(generationsRoot);
        String base = GENERATION_NAME.format(clock.instant());
        Path candidate = generationsRoot.resolve(base);
        int suffix = 1;
        while (Files.exists(candidate)) {
            candidate = generationsRoot.resolve(base + "-" + suffix++);
        }
        return candidate;
    }

    public Optional<Path> currentDirectory() throws IOException {
        RegistryState state = load();
        if (!state.hasCurrent()) {
            return Optional.empty();
        }
        return Optional.of(generationsRoot.resolve(state.current()));
    }

    public RegistryState publish(Path generationDirectory) throws IOException {
        if (!Files.isDirectory(generationDirectory)) {
            throw new MissingArtifactException(generationDirectory, "Cannot publish a generation that does not exist");
        }
        RegistryState current = load();
        String name = generationDirectory.getFileName().toString();
        RegistryState updated = new RegistryState(current.current(), name);
        save(updated);
        return updated;
    }

    public RegistryState rollback() throws IOException {
        RegistryState current = load();
        if (current.previous() == null || current.previous().isBlank()) {
            throw new IllegalStateException("No previous generation to roll back to");
        }
        RegistryState rolledBack = new RegistryState(current.current(), current.previous());
        save(rolledBack);
        return rolledBack;
    }

    private void save(RegistryState state) throws IOException {
        if (registryPath.toAbsolutePath().getParent() != null) {
            Files.createDirectories(registryPath.toAbsolutePath().getParent());
        }
        Path temp = registryPath.resolveSibling(registryPath.getFileName() + ".tmp");
        objectMapper.writerWithDefaultPrettyPrinter().writeValue(temp.toFile(), state);
        try {
            Files.move(temp, registryPath, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(temp, registryPath, StandardCopyOption.REPLACE_EXISTING);
        }
    }
}
