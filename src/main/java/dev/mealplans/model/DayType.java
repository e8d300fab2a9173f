package dev.mealplans.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Day classification controlling the calorie multiplier and the expected meals.
 */
public enum DayType {
    REGULAR("regular", 1.0),
    WORKOUT("workout", 1.20),
    REST("rest", 0.90);

    public static final List<String> BASE_MEAL_TYPES = List.of(
        "breakfast", "lunch", "dinner", "mid_morning", "mid_afternoon", "supper");
    public static final List<String> WORKOUT_MEAL_TYPES = List.of("pre-workout", "post-workout");

    private final String wireName;
    private final double calorieMultiplier;

    DayType(String wireName, double calorieMultiplier) {
        this.wireName = wireName;
        this.calorieMultiplier = calorieMultiplier;
    }

    public String wireName() { return wireName; }
    public double calorieMultiplier() { return calorieMultiplier; }

    /** Day target in kcal, truncated toward zero. */
    public int targetFor(int baseDailyCalories) {
        return (int) (baseDailyCalories * calorieMultiplier);
    }

    public List<String> expectedMealTypes() {
        if (this != WORKOUT) {
            return BASE_MEAL_TYPES;
        }
        var all = new ArrayList<>(BASE_MEAL_TYPES);
        all.addAll(WORKOUT_MEAL_TYPES);
        return List.copyOf(all);
    }

    public static Optional<DayType> fromWire(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (DayType type : values()) {
            if (type.wireName.equals(normalized)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
