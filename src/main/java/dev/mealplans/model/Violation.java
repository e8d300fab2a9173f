package dev.mealplans.model;

/**
 * A single reason why a plan is not acceptable.
 */
public record Violation(
    Kind kind,
    int dayIndex,     // 1-based, 0 for plan-level violations
    String dayType,
    String mealType,  // nullable
    String partName,  // nullable
    Long recipeId,    // nullable
    String reason
) {
    public enum Kind {
        DAY_TYPES,
        MISSING_MEAL,
        MISSING_PART,
        UNRESOLVED_PART,
        UNKNOWN_RECIPE,
        MISSING_TAGS,
        CALORIE_BAND
    }

    public static Violation planLevel(Kind kind, String reason) {
        return new Violation(kind, 0, null, null, null, null, reason);
    }

    @Override
    public String toString() {
        return reason;
    }
}
