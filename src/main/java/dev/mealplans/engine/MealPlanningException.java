package dev.mealplans.engine;

/**
 * Base type of the failures a generation run can surface.
 */
public class MealPlanningException extends RuntimeException {

    public MealPlanningException(String message) {
        super(message);
    }

    public MealPlanningException(String message, Throwable cause) {
        super(message, cause);
    }
}
