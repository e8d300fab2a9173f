package dev.mealplans.model;

import java.util.Locale;
import java.util.Set;

public record UserProfile(
    String email,
    String name,
    String physicalActivity, // none, low, moderate, high
    Set<String> dietaryPreferences
) {
    private static final Set<String> ACTIVE_LEVELS = Set.of("moderate", "high");

    public UserProfile {
        dietaryPreferences = dietaryPreferences == null ? Set.of() : Set.copyOf(dietaryPreferences);
    }

    public boolean isActive() {
        return physicalActivity != null
            && ACTIVE_LEVELS.contains(physicalActivity.trim().toLowerCase(Locale.ROOT));
    }

    public String displayName() {
        return name == null || name.isBlank() ? email : name;
    }
}
