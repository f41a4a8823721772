package com.smartcook;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.smartcook.generation.ArtifactLocations;
import com.smartcook.generation.GenerationHolder;
import com.smartcook.generation.GenerationManifest;
import com.smartcook.generation.GenerationRegistry;
import com.smartcook.generation.GenerationStore;
import com.smartcook.generation.RegistryState;
import com.smartcook.ingest.BuildReport;
import com.smartcook.ingest.BuildResult;
import com.smartcook.ingest.CorpusFingerprint;
import com.smartcook.ingest.IndexBuilder;
import com.smartcook.query.QueryEngine;
import com.smartcook.query.Suggestion;
import com.smartcook.runtime.AppConfig;
import com.smartcook.text.FeatureHasher;
import com.smartcook.text.HasherConfig;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(
        name = "smart-cook",
        mixinStandardHelpOptions = true,
        version = "smart-cook 0.1.0",
        description = "Builds a recipe similarity index and suggests recipes for a list of ingredients.")
public class Main implements Callable<Integer> {
    private static final Logger log = LoggerFactory.getLogger(Main.class);
    private static final Set<String> EXIT_WORDS = Set.of("exit", "quit", "sair");
    private static final int DIRECTIONS_EXCERPT = 200;

    @Option(names = { "-c", "--config" }, description = "Path to YAML config file", defaultValue = "src/main/resources/application.yml")
    String configPath;

    @Option(names = "--mode", description = "Execution mode: ${COMPLETION-CANDIDATES}", defaultValue = "interactive")
    Mode mode;

    @Option(names = "--corpus", description = "Recipe corpus CSV (title, ingredients, directions, link)")
    Path corpusPath;

    @Option(names = "--force", description = "Rebuild even when the published generation already covers this corpus", defaultValue = "false")
    boolean force;

    @Option(names = "--generation", description = "Serve this generation directory instead of the published one")
    Path generationDir;

    @Option(names = { "-i", "--ingredients" }, description = "Comma separated ingredients used in suggest mode")
    String ingredients;

    @Option(names = "--top-n", description = "Number of suggestions to print (defaults to query.topN)")
    Integer topN;

    private PrintStream out = System.out;
    private BufferedReader in = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));

    enum Mode {
        build,
        suggest,
        interactive,
        rollback
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new Main()).execute(args);
        System.exit(exitCode);
    }

    Main withConsole(BufferedReader input, PrintStream output) {
        this.in = input;
        this.out = output;
        return this;
    }

    @Override
    public Integer call() throws Exception {
        AppConfig config = loadConfig(Path.of(configPath));
        GenerationRegistry registry = new GenerationRegistry(
                Path.of(config.getStorage().getRegistryPath()),
                Path.of(config.getStorage().getGenerationsRoot()));

        log.info("Starting smart-cook in {} mode", mode);
        log.info("Using config file: {}", configPath);
        log.info("Hashing dimension={} components={} candidatePool={}",
                config.getHashing().getDimension(),
                config.getReduction().getComponents(),
                config.getQuery().getCandidatePoolSize());

        if (mode == Mode.build) {
            if (corpusPath == null) {
                log.error("--corpus is required in build mode");
                return 2;
            }
            buildAndPublish(config, registry);
        }
        if (mode == Mode.rollback) {
            RegistryState state = registry.rollback();
            log.info("Rolled back: current={} previous={}", state.current(), state.previous());
        }
        if (mode == Mode.suggest) {
            if (ingredients == null || ingredients.isBlank()) {
                log.error("--ingredients is required in suggest mode");
                return 2;
            }
            Optional<GenerationHolder> holder = openGeneration(config, registry);
            if (holder.isEmpty()) {
                return 2;
            }
            printSuggestions(ingredients, holder.get().suggest(ingredients, resolveTopN(config)));
        }
        if (mode == Mode.interactive) {
            if (generationDir == null && registry.currentDirectory().isEmpty() && corpusPath != null) {
                out.println("No index found. Building one from " + corpusPath + " ...");
                buildAndPublish(config, registry);
            }
            Optional<GenerationHolder> holder = openGeneration(config, registry);
            if (holder.isEmpty()) {
                return 2;
            }
            runInteractive(holder.get(), resolveTopN(config));
        }
        return 0;
    }

    private AppConfig loadConfig(Path config) throws IOException {
        if (!Files.exists(config)) {
            return new AppConfig();
        }
        ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
        return mapper.readValue(config.toFile(), AppConfig.class);
    }

    private void buildAndPublish(AppConfig config, GenerationRegistry registry) throws IOException {
        GenerationStore store = new GenerationStore();
        Optional<Path> current = registry.currentDirectory();
        if (!force && current.isPresent() && isUpToDate(config, store, current.get())) {
            log.info("Published generation {} already covers {}; use --force to rebuild", current.get(), corpusPath);
            return;
        }

        BuildResult result = new IndexBuilder(config).build(corpusPath);
        Path target = registry.newGenerationDirectory();
        store.save(result.generation(), target);
        RegistryState state = registry.publish(target);

        BuildReport report = result.report();
        log.info("Published generation {} rows={} indexed={} skipped={} chunks={} elapsedMs={} (previous={})",
                state.current(),
                report.totalRows(),
                report.indexedRecipes(),
                report.skippedRecords(),
                report.chunks(),
                report.elapsedMs(),
                state.previous() == null ? "none" : state.previous());
    }

    private boolean isUpToDate(AppConfig config, GenerationStore store, Path generation) throws IOException {
        Path manifestPath = ArtifactLocations.in(generation).manifest();
        if (!Files.exists(manifestPath)) {
            return false;
        }
        GenerationManifest manifest = store.readManifest(manifestPath);
        return manifest.corpusFingerprint().equals(CorpusFingerprint.sha256(corpusPath))
                && manifest.hashDimension() == config.getHashing().getDimension()
                && manifest.components() == config.getReduction().getComponents()
                && HasherConfig.STRING_HASH_V1.equals(manifest.hashScheme());
    }

    private Optional<GenerationHolder> openGeneration(AppConfig config, GenerationRegistry registry) throws IOException {
        Path directory = generationDir != null ? generationDir : registry.currentDirectory().orElse(null);
        if (directory == null) {
            log.error("No generation published yet; run --mode build --corpus <csv> first");
            return Optional.empty();
        }
        QueryEngine engine = new QueryEngine(
                new FeatureHasher(config.getHashing().getDimension()),
                config.getQuery().toPolicy());
        GenerationHolder holder = new GenerationHolder(new GenerationStore(), engine, config.getReduction().getComponents());
        holder.reload(ArtifactLocations.in(directory));
        return Optional.of(holder);
    }

    private int resolveTopN(AppConfig config) {
        return topN != null ? topN : config.getQuery().getTopN();
    }

    private void runInteractive(GenerationHolder holder, int limit) throws IOException {
        out.println("Recipe suggester - type your ingredients separated by commas (exit to quit)");
        out.println("Example: eggs, flour, sugar, milk");
        while (true) {
            out.print("> ");
            out.flush();
            String line = in.readLine();
            if (line == null) {
                break;
            }
            String input = line.strip();
            if (EXIT_WORDS.contains(input.toLowerCase(Locale.ROOT))) {
                break;
            }
            if (input.isEmpty()) {
                out.println("Please type some ingredients.");
                continue;
            }
            printSuggestions(input, holder.suggest(input, limit));
        }
    }

    void printSuggestions(String input, List<Suggestion> suggestions) {
        if (suggestions.isEmpty()) {
            out.println("No suitable recipe found. Try other ingredients.");
            return;
        }
        out.println();
        out.println("Suggested recipes for: " + input);
        for (int i = 0; i < suggestions.size(); i++) {
            Suggestion suggestion = suggestions.get(i);
            out.printf("%n%d. %s (%d%% match)%n", i + 1, suggestion.title(), suggestion.matchPercentage());
            out.printf("   Ingredients used (%d/%d):%n", suggestion.usedCount(), suggestion.totalIngredientCount());
            for (String used : suggestion.used()) {
                out.println("    + " + used);
            }
            if (!suggestion.missing().isEmpty()) {
                out.println("   Missing ingredients:");
                for (String missing : suggestion.missing()) {
                    out.println("    - " + missing);
                }
            }
            if (!suggestion.directions().isBlank()) {
                String directions = suggestion.directions();
                if (directions.length() > DIRECTIONS_EXCERPT) {
                    directions = directions.substring(0, DIRECTIONS_EXCERPT) + "...";
                }
                out.println("   Directions: " + directions);
            }
            if (!suggestion.link().isBlank()) {
                out.println("   More: " + suggestion.link());
            }
        }
    }
}
