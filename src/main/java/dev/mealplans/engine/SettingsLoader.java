package dev.mealplans.engine;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.mealplans.model.PlannerSettings;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;

/**
 * Loads planner settings from JSON. Every field is optional and falls back to its default.
 */
public final class SettingsLoader {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private SettingsLoader() {}

    public static PlannerSettings loadFromFile(Path path) throws IOException {
        return parseSettings(MAPPER.readTree(path.toFile()));
    }

    public static PlannerSettings loadFromString(String json) throws IOException {
        return parseSettings(MAPPER.readTree(json));
    }

    static PlannerSettings parseSettings(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return PlannerSettings.defaults();
        }
        int minimumCandidates = node.has("minimumCandidates")
            ? node.get("minimumCandidates").asInt() : PlannerSettings.DEFAULT_MINIMUM_CANDIDATES;
        double calorieTolerance = node.has("calorieTolerance")
            ? node.get("calorieTolerance").asDouble() : PlannerSettings.DEFAULT_CALORIE_TOLERANCE;
        double optionalPartProbability = node.has("optionalPartProbability")
            ? node.get("optionalPartProbability").asDouble() : PlannerSettings.DEFAULT_OPTIONAL_PART_PROBABILITY;
        double activityUplift = node.has("activityUplift")
            ? node.get("activityUplift").asDouble() : PlannerSettings.DEFAULT_ACTIVITY_UPLIFT;
        int maxPromptCandidates = node.has("maxPromptCandidates")
            ? node.get("maxPromptCandidates").asInt() : PlannerSettings.DEFAULT_MAX_PROMPT_CANDIDATES;
        Duration draftTimeout = node.has("draftTimeoutSeconds")
            ? Duration.ofSeconds(node.get("draftTimeoutSeconds").asLong()) : PlannerSettings.DEFAULT_DRAFT_TIMEOUT;
        String model = node.has("model") ? node.get("model").asText() : PlannerSettings.DEFAULT_MODEL;
        Long seed = node.has("seed") && !node.get("seed").isNull() ? node.get("seed").asLong() : null;

        if (calorieTolerance < 0 || calorieTolerance >= 1) {
            throw new IllegalArgumentException("calorieTolerance must be in [0, 1): " + calorieTolerance);
        }
        if (optionalPartProbability < 0 || optionalPartProbability > 1) {
            throw new IllegalArgumentException(
                "optionalPartProbability must be in [0, 1]: " + optionalPartProbability);
        }
        return new PlannerSettings(minimumCandidates, calorieTolerance, optionalPartProbability, activityUplift,
            maxPromptCandidates, draftTimeout, model, seed);
    }
}
