package dev.mealplans.model;

import java.time.Duration;

/**
 * Tunables for a generation run.
 */
public record PlannerSettings(
    int minimumCandidates,
    double calorieTolerance,
    double optionalPartProbability,
    double activityUplift,
    int maxPromptCandidates,
    Duration draftTimeout,
    String model,
    Long seed // nullable, unseeded when absent
) {
    public static final int DEFAULT_MINIMUM_CANDIDATES = 30;
    public static final double DEFAULT_CALORIE_TOLERANCE = 0.15;
    public static final double DEFAULT_OPTIONAL_PART_PROBABILITY = 0.5;
    public static final double DEFAULT_ACTIVITY_UPLIFT = 1.10;
    public static final int DEFAULT_MAX_PROMPT_CANDIDATES = 10;
    public static final Duration DEFAULT_DRAFT_TIMEOUT = Duration.ofSeconds(120);
    public static final String DEFAULT_MODEL = "llama3";

    public static PlannerSettings defaults() {
        return new PlannerSettings(DEFAULT_MINIMUM_CANDIDATES, DEFAULT_CALORIE_TOLERANCE,
            DEFAULT_OPTIONAL_PART_PROBABILITY, DEFAULT_ACTIVITY_UPLIFT, DEFAULT_MAX_PROMPT_CANDIDATES,
            DEFAULT_DRAFT_TIMEOUT, DEFAULT_MODEL, null);
    }

    public PlannerSettings withSeed(Long newSeed) {
        return new PlannerSettings(minimumCandidates, calorieTolerance, optionalPartProbability,
            activityUplift, maxPromptCandidates, draftTimeout, model, newSeed);
    }

    public PlannerSettings withModel(String newModel) {
        return new PlannerSettings(minimumCandidates, calorieTolerance, optionalPartProbability,
            activityUplift, maxPromptCandidates, draftTimeout, newModel, seed);
    }

    public PlannerSettings withMinimumCandidates(int minimum) {
        return new PlannerSettings(minimum, calorieTolerance, optionalPartProbability,
            activityUplift, maxPromptCandidates, draftTimeout, model, seed);
    }

    /** Base daily kcal after the activity uplift. */
    public int adjustedBase(int dailyCalories, UserProfile user) {
        if (user != null && user.isActive()) {
            return (int) (dailyCalories * activityUplift);
        }
        return dailyCalories;
    }
}
