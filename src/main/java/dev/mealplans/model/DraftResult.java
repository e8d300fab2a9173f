package dev.mealplans.model;

/**
 * Result of turning a draft generator response into a plan.
 */
public sealed interface DraftResult {

    record Success(Plan plan) implements DraftResult {}

    record Failure(String error, String rawResponse) implements DraftResult {}
}
