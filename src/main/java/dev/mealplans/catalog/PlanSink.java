package dev.mealplans.catalog;

import dev.mealplans.model.Plan;
import dev.mealplans.model.UserProfile;

import java.io.IOException;
import java.util.Optional;

/**
 * Persistence for finished plans. Each call stores or replaces a whole plan.
 */
public interface PlanSink {

    /** Store a new plan and return its identifier. */
    long save(Plan plan, UserProfile user) throws IOException;

    /** Export a stored plan back into plan form, e.g. for re-optimization. */
    Optional<Plan> export(long planId) throws IOException;

    /** Replace a stored plan entirely. */
    void replace(long planId, Plan plan) throws IOException;
}
