package dev.mealplans.model;

/**
 * A user's history with one recipe.
 */
public record UserFeedback(
    long recipeId,
    Integer rating, // nullable, 1 to 5
    Boolean liked,  // nullable, tri-state
    int cookedCount,
    int skipCount
) {}
