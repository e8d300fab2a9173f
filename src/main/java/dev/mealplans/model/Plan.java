package dev.mealplans.model;

import java.util.List;
import java.util.Optional;

/**
 * A 3-day meal plan: one regular, one workout and one rest day.
 */
public record Plan(
    String title,
    String userEmail,
    int baseDailyCalories,
    String goal,
    MacroTargets macroTargets,
    List<Day> days
) {
    public Plan {
        days = days == null ? List.of() : List.copyOf(days);
    }

    public Optional<Day> day(DayType type) {
        return days.stream()
            .filter(d -> d.type().filter(type::equals).isPresent())
            .findFirst();
    }

    public Plan withTitle(String newTitle) {
        return new Plan(newTitle, userEmail, baseDailyCalories, goal, macroTargets, days);
    }

    public Plan withDays(List<Day> newDays) {
        return new Plan(title, userEmail, baseDailyCalories, goal, macroTargets, newDays);
    }
}
