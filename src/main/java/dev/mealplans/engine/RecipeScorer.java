package dev.mealplans.engine;

import dev.mealplans.model.CandidateRecipe;
import dev.mealplans.model.UserFeedback;
import dev.mealplans.model.UserProfile;

import java.util.Optional;
import java.util.Random;

/**
 * Heuristic desirability of a recipe for one slot. Higher is better; calorie fit dominates.
 */
public final class RecipeScorer {

    static final double MAX_JITTER = 0.05;
    private static final int FEEDBACK_COUNT_CAP = 5;
    private static final double POPULARITY_CAP = 0.05;

    private final Random random;

    public RecipeScorer(Random random) {
        this.random = random;
    }

    public double score(CandidateRecipe recipe, UserProfile user, String mealType, String partName,
                        double targetCalories, FeedbackLookup feedback) {
        return explain(recipe, user, mealType, partName, targetCalories, feedback).total();
    }

    /**
     * Score a recipe and return every component.
     *
     * @param user           acting user, or null; without a user only cached feedback is used
     * @param targetCalories calorie target of the slot; calorie fit is skipped when not positive
     */
    public ScoreBreakdown explain(CandidateRecipe recipe, UserProfile user, String mealType, String partName,
                                  double targetCalories, FeedbackLookup feedback) {
        double calorieFit = 0.0;
        if (targetCalories > 0) {
            double diff = Math.abs(recipe.calories() - targetCalories);
            calorieFit = Math.max(0.0, 1.0 - diff / targetCalories);
        }

        double tagBonus = 0.0;
        if (mealType != null && recipe.hasTag(mealType)) {
            tagBonus += 0.1;
        }
        if (partName != null && recipe.hasTag(partName)) {
            tagBonus += 0.1;
        }

        Optional<UserFeedback> history = feedback == null ? Optional.empty() : feedback.find(recipe.id());
        double personal = history.map(RecipeScorer::personalBonus).orElse(0.0);

        double global = 0.0;
        if (recipe.averageRating() != null && recipe.averageRating() > 0) {
            global += Math.min(recipe.averageRating() / 5.0, 1.0) * POPULARITY_CAP;
        }
        if (recipe.globalCookedCount() != null && recipe.globalCookedCount() > 0) {
            global += Math.min(recipe.globalCookedCount() / 100.0, 1.0) * POPULARITY_CAP;
        }

        double jitter = random.nextDouble() * MAX_JITTER;
        return new ScoreBreakdown(calorieFit, tagBonus, personal, global, jitter);
    }

    static double personalBonus(UserFeedback fb) {
        double bonus = 0.0;
        if (fb.rating() != null) {
            if (fb.rating() >= 4) {
                bonus += 0.1;
            } else if (fb.rating() <= 2) {
                bonus -= 0.1;
            }
        }
        if (Boolean.TRUE.equals(fb.liked())) {
            bonus += 0.1;
        } else if (Boolean.FALSE.equals(fb.liked())) {
            bonus -= 0.2;
        }
        bonus += Math.min(fb.cookedCount(), FEEDBACK_COUNT_CAP) * 0.02;
        bonus -= Math.min(fb.skipCount(), FEEDBACK_COUNT_CAP) * 0.02;
        return bonus;
    }
}
