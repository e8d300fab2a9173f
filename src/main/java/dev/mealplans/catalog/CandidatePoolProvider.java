package dev.mealplans.catalog;

import dev.mealplans.model.CandidatePool;
import dev.mealplans.model.UserProfile;

/**
 * Source of the recipes a user may be planned with.
 */
public interface CandidatePoolProvider {

    /**
     * Recipes eligible for the user, already narrowed by dietary preferences and
     * carrying their calculated calories and macros.
     */
    CandidatePool candidatesFor(UserProfile user);
}
