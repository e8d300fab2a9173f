package dev.mealplans.engine;

import dev.mealplans.model.Violation;

import java.util.List;

/**
 * A plan still violates the planning rules after its repair pass, or a deterministic
 * plan could not be built within them.
 */
public class PlanValidationException extends MealPlanningException {

    private final List<Violation> violations;

    public PlanValidationException(List<Violation> violations) {
        super("Plan failed validation: " + violations);
        this.violations = List.copyOf(violations);
    }

    public List<Violation> violations() {
        return violations;
    }
}
