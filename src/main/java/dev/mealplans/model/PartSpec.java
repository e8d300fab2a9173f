package dev.mealplans.model;

/**
 * A named component of a structured meal, e.g. "main course" or "soup".
 */
public record PartSpec(String name, boolean required) {

    public static PartSpec required(String name) {
        return new PartSpec(name, true);
    }

    public static PartSpec optional(String name) {
        return new PartSpec(name, false);
    }
}
