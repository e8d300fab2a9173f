package dev.mealplans.engine;

import dev.mealplans.model.CandidatePool;
import dev.mealplans.model.CandidateRecipe;
import dev.mealplans.model.Day;
import dev.mealplans.model.DaySummary;
import dev.mealplans.model.MealSlot;
import dev.mealplans.model.PartSlot;
import dev.mealplans.model.Plan;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Sums the nutrition of the selected recipes per day. Unknown recipe ids count as zero.
 */
public final class NutritionSummarizer {

    private NutritionSummarizer() {}

    public static List<DaySummary> summarize(Plan plan, CandidatePool pool) {
        var summaries = new ArrayList<DaySummary>();
        for (Day day : plan.days()) {
            double calories = 0.0;
            double protein = 0.0;
            double carbohydrate = 0.0;
            double fat = 0.0;
            for (MealSlot meal : day.meals()) {
                for (PartSlot part : meal.parts()) {
                    Optional<CandidateRecipe> recipe = pool.find(part.selectedRecipeId());
                    if (recipe.isPresent()) {
                        calories += recipe.get().calories();
                        protein += recipe.get().protein();
                        carbohydrate += recipe.get().carbohydrate();
                        fat += recipe.get().fat();
                    }
                }
            }
            summaries.add(new DaySummary(day.date(), day.dayType(),
                round2(calories), round2(protein), round2(carbohydrate), round2(fat)));
        }
        return summaries;
    }

    public static double dayCalories(List<MealSlot> meals, CandidatePool pool) {
        return meals.stream()
            .flatMap(m -> m.parts().stream())
            .map(p -> pool.find(p.selectedRecipeId()))
            .flatMap(Optional::stream)
            .mapToDouble(CandidateRecipe::calories)
            .sum();
    }

    private static double round2(double value) {
        return Math.round(value * 100.0) / 100.0;
    }
}
