package dev.mealplans.catalog;

import dev.mealplans.model.UserFeedback;
import dev.mealplans.model.UserProfile;

import java.util.Map;
import java.util.Optional;

/**
 * Read access to a user's recipe history.
 */
public interface FeedbackProvider {

    /** All feedback of the user, keyed by recipe id. */
    Map<Long, UserFeedback> feedbackFor(UserProfile user);

    /** Single lookup, used when a feedback snapshot misses a recipe. */
    default Optional<UserFeedback> find(UserProfile user, long recipeId) {
        return Optional.ofNullable(feedbackFor(user).get(recipeId));
    }
}
