package dev.mealplans.model;

/**
 * One part of a planned meal.
 */
public record PartSlot(
    String name,
    Long selectedRecipeId // nullable, unfilled part
) {
    public boolean isFilled() {
        return selectedRecipeId != null;
    }
}
