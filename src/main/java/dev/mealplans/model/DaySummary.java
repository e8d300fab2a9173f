package dev.mealplans.model;

import java.time.LocalDate;

/**
 * Nutrition totals of the selected recipes of one day.
 */
public record DaySummary(
    LocalDate date,
    String dayType,
    double totalCalories,
    double protein,
    double carbohydrate,
    double fat
) {}
