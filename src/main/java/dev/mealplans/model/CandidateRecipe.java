package dev.mealplans.model;

import java.util.Collection;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Read-only view of a recipe for planning. Nutrition values are taken as given.
 */
public record CandidateRecipe(
    long id,
    String title,
    Set<String> tags,
    double calories,
    double protein,
    double carbohydrate,
    double fat,
    Double averageRating,     // nullable
    Integer globalCookedCount // nullable
) {
    public CandidateRecipe {
        tags = tags == null ? Set.of() : tags.stream()
            .map(t -> t.trim().toLowerCase(Locale.ROOT))
            .collect(Collectors.toUnmodifiableSet());
    }

    public boolean hasTag(String tag) {
        return tag != null && tags.contains(tag.trim().toLowerCase(Locale.ROOT));
    }

    public boolean hasAllTags(Collection<String> required) {
        return required.stream().allMatch(this::hasTag);
    }
}
