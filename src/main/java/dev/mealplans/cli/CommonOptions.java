package dev.mealplans.cli;

import ch.qos.logback.classic.Level;
import dev.mealplans.backend.OllamaDraftGenerator;
import dev.mealplans.engine.SettingsLoader;
import dev.mealplans.model.PlannerSettings;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Option;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Options shared by the {@code generate} and {@code optimize} commands.
 */
public class CommonOptions {

    @Option(names = "--catalog", required = true, description = "JSON catalog with recipes, users and feedback")
    Path catalog;

    @Option(names = "--store", description = "Directory of stored plans")
    Path store;

    @Option(names = "--settings", description = "JSON file with planner settings")
    Path settingsFile;

    @Option(names = "--model", description = "Draft generator model (default: llama3)")
    String model;

    @Option(names = "--ollama-url", defaultValue = OllamaDraftGenerator.DEFAULT_BASE_URL,
        description = "Base URL of the Ollama server (default: ${DEFAULT-VALUE})")
    String ollamaUrl;

    @Option(names = "--seed", description = "Seed for reproducible selections")
    Long seed;

    @Option(names = "--min-candidates", description = "Override the minimum candidate pool size")
    Integer minimumCandidates;

    @Option(names = "--verbose", description = "Log selection and orchestration details")
    boolean verbose;

    /** Settings file, then command-line overrides. */
    PlannerSettings resolveSettings() throws IOException {
        PlannerSettings settings = settingsFile == null
            ? PlannerSettings.defaults()
            : SettingsLoader.loadFromFile(settingsFile);
        if (model != null) {
            settings = settings.withModel(model);
        }
        if (seed != null) {
            settings = settings.withSeed(seed);
        }
        if (minimumCandidates != null) {
            settings = settings.withMinimumCandidates(minimumCandidates);
        }
        return settings;
    }

    void applyLogLevel() {
        if (verbose) {
            var logger = (ch.qos.logback.classic.Logger) LoggerFactory.getLogger("dev.mealplans");
            logger.setLevel(Level.DEBUG);
        }
    }
}
