package dev.mealplans.engine;

import dev.mealplans.model.CandidatePool;
import dev.mealplans.model.MacroTargets;
import dev.mealplans.model.UserProfile;

import java.time.LocalDate;

/**
 * Everything one generation request plans against. Passed explicitly to each component.
 *
 * @param baseDailyCalories base daily target after any activity adjustment
 * @param startDate         date of the first plan day
 */
public record PlanningContext(
    UserProfile user,
    int baseDailyCalories,
    String goal,
    CandidatePool pool,
    FeedbackLookup feedback,
    LocalDate startDate
) {
    public MacroTargets macroTargets() {
        return MacroTargets.forGoal(goal);
    }

    public String userEmail() {
        return user == null ? null : user.email();
    }

    public String userDisplayName() {
        return user == null ? "anonymous" : user.displayName();
    }
}
