package dev.mealplans.model;

public enum GenerationMethod {
    DRAFT("draft"),
    DRAFT_REPAIRED("draft+repair"),
    DETERMINISTIC("deterministic");

    private final String label;

    GenerationMethod(String label) {
        this.label = label;
    }

    public String label() { return label; }
}
