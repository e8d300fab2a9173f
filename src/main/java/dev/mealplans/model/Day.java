package dev.mealplans.model;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * A single plan day. The day type is kept as its wire string so that drafts
 * carrying an unknown or misspelt type can still be represented and reported.
 */
public record Day(LocalDate date, String dayType, int targetCalories, List<MealSlot> meals) {

    public Day {
        meals = meals == null ? List.of() : List.copyOf(meals);
    }

    public Optional<DayType> type() {
        return DayType.fromWire(dayType);
    }

    public Optional<MealSlot> meal(String mealType) {
        return meals.stream()
            .filter(m -> m.mealType() != null && m.mealType().equalsIgnoreCase(mealType))
            .findFirst();
    }
}
