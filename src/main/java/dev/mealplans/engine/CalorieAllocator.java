package dev.mealplans.engine;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Splits a day's calorie target across its meals with fixed weights.
 * Allocations are not renormalized, so they need not add up to the target.
 */
public final class CalorieAllocator {

    static final Map<String, Double> WEIGHTS = Map.of(
        "breakfast", 0.25,
        "lunch", 0.35,
        "dinner", 0.30,
        "pre-workout", 0.05,
        "post-workout", 0.05,
        "mid_morning", 0.05,
        "mid_afternoon", 0.05,
        "supper", 0.10
    );

    private CalorieAllocator() {}

    /**
     * Allocate calories per meal type, in the order given. Unknown meal types get 0.
     */
    public static Map<String, Integer> allocate(int targetCalories, List<String> mealTypes) {
        var allocations = new LinkedHashMap<String, Integer>();
        int target = Math.max(0, targetCalories);
        for (String mealType : mealTypes) {
            double weight = WEIGHTS.getOrDefault(mealType, 0.0);
            allocations.put(mealType, (int) Math.floor(target * weight));
        }
        return allocations;
    }

    public static int allocate(int targetCalories, String mealType) {
        return allocate(targetCalories, List.of(mealType)).get(mealType);
    }
}
