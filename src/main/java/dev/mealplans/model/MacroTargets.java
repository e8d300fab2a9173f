package dev.mealplans.model;

/**
 * Share of daily calories per macronutrient.
 */
public record MacroTargets(double protein, double carbs, double fat) {

    public static MacroTargets forGoal(String goal) {
        if ("weight_loss".equals(goal)) {
            return new MacroTargets(0.35, 0.40, 0.25);
        }
        if ("muscle_gain".equals(goal)) {
            return new MacroTargets(0.30, 0.50, 0.20);
        }
        return new MacroTargets(0.25, 0.50, 0.25);
    }
}
