package dev.mealplans.engine;

import dev.mealplans.model.CandidatePool;
import dev.mealplans.model.CandidateRecipe;
import dev.mealplans.model.Day;
import dev.mealplans.model.MealSlot;
import dev.mealplans.model.MealStructure;
import dev.mealplans.model.PartSlot;
import dev.mealplans.model.PartSpec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.function.BiPredicate;

/**
 * Drops filled optional parts, one at a time, while a day is above its upper calorie band.
 * Each step drops the part that leaves the total closest to the target.
 */
final class BandTrimmer {

    private static final Logger log = LoggerFactory.getLogger(BandTrimmer.class);

    private final MealStructure structure;
    private final double tolerance;

    BandTrimmer(MealStructure structure, double tolerance) {
        this.structure = structure;
        this.tolerance = tolerance;
    }

    /**
     * @param pinned parts that must stay even though optional, by meal type
     */
    Day trim(Day day, CandidatePool pool, BiPredicate<String, PartSlot> pinned) {
        double upper = day.targetCalories() * (1 + tolerance);
        List<MealSlot> meals = new ArrayList<>(day.meals());
        double total = NutritionSummarizer.dayCalories(meals, pool);

        while (total > upper) {
            int bestMeal = -1;
            int bestPart = -1;
            double bestDistance = Double.MAX_VALUE;
            double bestCalories = 0.0;
            for (int m = 0; m < meals.size(); m++) {
                MealSlot meal = meals.get(m);
                for (int p = 0; p < meal.parts().size(); p++) {
                    PartSlot part = meal.parts().get(p);
                    if (!part.isFilled() || isRequired(meal.mealType(), part.name())
                        || pinned.test(meal.mealType(), part)) {
                        continue;
                    }
                    double calories = pool.find(part.selectedRecipeId()).map(CandidateRecipe::calories).orElse(0.0);
                    double distance = Math.abs(total - calories - day.targetCalories());
                    if (distance < bestDistance) {
                        bestDistance = distance;
                        bestMeal = m;
                        bestPart = p;
                        bestCalories = calories;
                    }
                }
            }
            if (bestMeal < 0) {
                log.warn("Day {} stays at {} kcal, above its {} kcal band, with no optional part left to drop",
                    day.dayType(), Math.round(total), Math.round(upper));
                break;
            }
            MealSlot meal = meals.get(bestMeal);
            var parts = new ArrayList<>(meal.parts());
            PartSlot dropped = parts.set(bestPart, new PartSlot(parts.get(bestPart).name(), null));
            meals.set(bestMeal, new MealSlot(meal.mealType(), meal.allocatedCalories(), parts));
            total -= bestCalories;
            log.debug("Dropped optional {} of {} on {} day ({} kcal), day total now {}",
                dropped.name(), meal.mealType(), day.dayType(), bestCalories, total);
        }
        return new Day(day.date(), day.dayType(), day.targetCalories(), meals);
    }

    private boolean isRequired(String mealType, String partName) {
        if (!structure.isStructured(mealType)) {
            return true;
        }
        return structure.parts(mealType).stream()
            .filter(spec -> spec.name().equalsIgnoreCase(partName))
            .anyMatch(PartSpec::required);
    }
}
