package dev.mealplans.engine;

/**
 * Components of a recipe score. Raw component values; {@link #total()} applies the weights.
 */
public record ScoreBreakdown(
    double calorieFit,
    double tagBonus,
    double personalBonus,
    double globalBonus,
    double jitter
) {
    public static final double CALORIE_WEIGHT = 0.4;
    public static final double TAG_WEIGHT = 0.2;
    public static final double PERSONAL_WEIGHT = 0.25;

    /** Score without the tie-break jitter. */
    public double weighted() {
        return calorieFit * CALORIE_WEIGHT
            + tagBonus * TAG_WEIGHT
            + personalBonus * PERSONAL_WEIGHT
            + globalBonus;
    }

    public double total() {
        return weighted() + jitter;
    }
}
