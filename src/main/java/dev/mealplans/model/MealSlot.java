package dev.mealplans.model;

import java.util.List;
import java.util.Optional;

/**
 * A meal within a plan day, with its calorie allocation and part selections.
 */
public record MealSlot(String mealType, int allocatedCalories, List<PartSlot> parts) {

    public MealSlot {
        parts = parts == null ? List.of() : List.copyOf(parts);
    }

    public Optional<PartSlot> part(String name) {
        return parts.stream()
            .filter(p -> p.name() != null && p.name().equalsIgnoreCase(name))
            .findFirst();
    }
}
