package dev.mealplans.engine;

import dev.mealplans.catalog.FeedbackProvider;
import dev.mealplans.model.UserFeedback;
import dev.mealplans.model.UserProfile;

import java.util.Map;
import java.util.Optional;

/**
 * Feedback snapshot for one request, with an optional on-demand fallback.
 */
public final class FeedbackLookup {

    private static final FeedbackLookup EMPTY = new FeedbackLookup(Map.of(), null, null);

    private final Map<Long, UserFeedback> cache;
    private final FeedbackProvider fallback; // nullable
    private final UserProfile user;          // nullable

    private FeedbackLookup(Map<Long, UserFeedback> cache, FeedbackProvider fallback, UserProfile user) {
        this.cache = Map.copyOf(cache);
        this.fallback = fallback;
        this.user = user;
    }

    public static FeedbackLookup empty() {
        return EMPTY;
    }

    public static FeedbackLookup of(Map<Long, UserFeedback> snapshot) {
        return new FeedbackLookup(snapshot, null, null);
    }

    /** Snapshot the user's feedback now and fall back to the provider on a miss. */
    public static FeedbackLookup cachedFrom(FeedbackProvider provider, UserProfile user) {
        if (user == null) {
            return EMPTY;
        }
        return new FeedbackLookup(provider.feedbackFor(user), provider, user);
    }

    public Optional<UserFeedback> find(long recipeId) {
        UserFeedback cached = cache.get(recipeId);
        if (cached != null) {
            return Optional.of(cached);
        }
        if (fallback == null || user == null) {
            return Optional.empty();
        }
        return fallback.find(user, recipeId);
    }

    public int size() {
        return cache.size();
    }
}
