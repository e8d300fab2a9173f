package dev.mealplans.engine;

/**
 * The draft generator was unreachable, timed out, or returned something unusable.
 */
public class DraftException extends MealPlanningException {

    public DraftException(String message) {
        super(message);
    }

    public DraftException(String message, Throwable cause) {
        super(message, cause);
    }
}
