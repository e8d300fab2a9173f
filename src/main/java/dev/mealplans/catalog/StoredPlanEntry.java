package dev.mealplans.catalog;

import java.time.Instant;

/**
 * Index entry of a stored plan.
 */
public record StoredPlanEntry(
    long id,
    String userEmail,
    String title,
    Instant savedAt
) {}
