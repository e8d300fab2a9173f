package dev.mealplans.engine;

/**
 * The user's candidate pool is too small to plan with. No plan is produced.
 */
public class InsufficientCandidatesException extends MealPlanningException {

    private final int required;
    private final int found;

    public InsufficientCandidatesException(int required, int found) {
        super("Need at least %d recipes matching preferences, but found only %d.".formatted(required, found));
        this.required = required;
        this.found = found;
    }

    public int required() { return required; }
    public int found() { return found; }
}
