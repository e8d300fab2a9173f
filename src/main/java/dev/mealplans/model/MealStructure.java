package dev.mealplans.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Which meals are split into parts, and which tags a recipe needs to fill a slot.
 * Meal types without a part list are "simple" meals with a single implicit part.
 */
public record MealStructure(
    Map<String, List<PartSpec>> structuredMeals,
    Map<String, String> simpleMealTags
) {
    public static final String MAIN_COURSE = "main course";
    public static final String SIMPLE_PART = "main";

    public MealStructure {
        structuredMeals = Collections.unmodifiableMap(new LinkedHashMap<>(structuredMeals));
        simpleMealTags = Collections.unmodifiableMap(new LinkedHashMap<>(simpleMealTags));
    }

    public static MealStructure defaults() {
        var structured = new LinkedHashMap<String, List<PartSpec>>();
        structured.put("breakfast", List.of(
            PartSpec.required(MAIN_COURSE), PartSpec.optional("fruit"), PartSpec.optional("dairy")));
        structured.put("lunch", List.of(PartSpec.required(MAIN_COURSE), PartSpec.optional("soup")));
        structured.put("dinner", List.of(PartSpec.required(MAIN_COURSE), PartSpec.optional("soup")));

        var simple = new LinkedHashMap<String, String>();
        simple.put("mid_morning", "breakfast");
        simple.put("mid_afternoon", "breakfast");
        simple.put("supper", "dinner");
        simple.put("pre-workout", "pre-workout");
        simple.put("post-workout", "post-workout");
        return new MealStructure(structured, simple);
    }

    public boolean isStructured(String mealType) {
        return structuredMeals.containsKey(normalize(mealType));
    }

    public boolean isSimple(String mealType) {
        return simpleMealTags.containsKey(normalize(mealType));
    }

    /** Part specs of a structured meal, or an empty list for simple and unknown meals. */
    public List<PartSpec> parts(String mealType) {
        return structuredMeals.getOrDefault(normalize(mealType), List.of());
    }

    public List<String> requiredPartNames(String mealType) {
        return parts(mealType).stream().filter(PartSpec::required).map(PartSpec::name).toList();
    }

    /** Tag that identifies recipes for this meal: the mapped tag for simple meals. */
    public String mealTag(String mealType) {
        String meal = normalize(mealType);
        return simpleMealTags.getOrDefault(meal, meal);
    }

    /**
     * Tags a recipe must carry to fill the given slot. Simple meals need their mapped
     * meal tag plus "main course" regardless of the part name.
     */
    public Set<String> requiredTags(String mealType, String partName) {
        String meal = normalize(mealType);
        var tags = new LinkedHashSet<String>();
        if (simpleMealTags.containsKey(meal)) {
            tags.add(simpleMealTags.get(meal));
            tags.add(MAIN_COURSE);
            return tags;
        }
        if (!meal.isEmpty()) {
            tags.add(meal);
        }
        if (partName != null && !partName.isBlank()) {
            tags.add(normalize(partName));
        }
        return tags;
    }

    private static String normalize(String value) {
        return value == null ? "" : value.trim().toLowerCase(Locale.ROOT);
    }
}
