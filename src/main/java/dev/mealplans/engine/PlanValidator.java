package dev.mealplans.engine;

import dev.mealplans.model.CandidatePool;
import dev.mealplans.model.CandidateRecipe;
import dev.mealplans.model.Day;
import dev.mealplans.model.DayType;
import dev.mealplans.model.MealSlot;
import dev.mealplans.model.MealStructure;
import dev.mealplans.model.PartSlot;
import dev.mealplans.model.Plan;
import dev.mealplans.model.Violation;
import dev.mealplans.model.Violation.Kind;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Checks a plan against the structural and calorie rules. Never throws; an empty
 * result means the plan is accepted.
 */
public final class PlanValidator {

    private static final Set<String> REQUIRED_DAY_TYPES = Arrays.stream(DayType.values())
        .map(DayType::wireName)
        .collect(Collectors.toUnmodifiableSet());

    private final MealStructure structure;
    private final double tolerance;

    public PlanValidator(MealStructure structure, double tolerance) {
        this.structure = structure;
        this.tolerance = tolerance;
    }

    /**
     * Validate a plan. All findings are accumulated.
     *
     * @param dailyCalorieBase base daily kcal; each day's target is this scaled by its day type
     * @param pool             recipes that selections must resolve to
     */
    public List<Violation> validate(Plan plan, int dailyCalorieBase, CandidatePool pool) {
        var violations = new ArrayList<Violation>();

        // Rule 1: exactly one day of each type
        List<String> dayTypes = plan.days().stream().map(d -> normalize(d.dayType())).toList();
        Set<String> found = new TreeSet<>(dayTypes);
        if (!found.equals(REQUIRED_DAY_TYPES) || dayTypes.size() != REQUIRED_DAY_TYPES.size()) {
            violations.add(Violation.planLevel(Kind.DAY_TYPES,
                "Meal plan must include exactly one regular, one workout, and one rest day. Found: %s"
                    .formatted(dayTypes)));
        }

        for (int i = 0; i < plan.days().size(); i++) {
            validateDay(plan.days().get(i), i + 1, dailyCalorieBase, pool, violations);
        }
        return violations;
    }

    /**
     * Required slots of the plan that have no selection, as "dayType/mealType/part".
     */
    public List<String> unresolvedRequiredSlots(Plan plan) {
        var slots = new ArrayList<String>();
        for (Day day : plan.days()) {
            for (MealSlot meal : day.meals()) {
                if (structure.isStructured(meal.mealType())) {
                    for (String required : structure.requiredPartNames(meal.mealType())) {
                        boolean filled = meal.part(required).map(PartSlot::isFilled).orElse(false);
                        if (!filled) {
                            slots.add(day.dayType() + "/" + meal.mealType() + "/" + required);
                        }
                    }
                } else if (structure.isSimple(meal.mealType())
                    && meal.parts().stream().noneMatch(PartSlot::isFilled)) {
                    slots.add(day.dayType() + "/" + meal.mealType() + "/" + MealStructure.SIMPLE_PART);
                }
            }
        }
        return slots;
    }

    private void validateDay(Day day, int dayIndex, int base, CandidatePool pool, List<Violation> violations) {
        String dayType = normalize(day.dayType());
        Optional<DayType> type = day.type();

        // Rule 2: expected meals present
        List<String> expected = type.orElse(DayType.REGULAR).expectedMealTypes();
        Set<String> present = day.meals().stream()
            .map(m -> normalize(m.mealType()))
            .collect(Collectors.toSet());
        var missingMeals = new LinkedHashSet<String>();
        for (String mealType : expected) {
            if (!present.contains(mealType)) {
                missingMeals.add(mealType);
            }
        }
        for (String missing : missingMeals) {
            violations.add(new Violation(Kind.MISSING_MEAL, dayIndex, dayType, missing, null, null,
                "Day %d (%s): Missing required meal: %s".formatted(dayIndex, dayType, missing)));
        }

        double dayCalories = 0.0;
        for (MealSlot meal : day.meals()) {
            String mealType = normalize(meal.mealType());
            if (structure.isStructured(mealType)) {
                checkStructuredParts(meal, mealType, dayIndex, dayType, violations);
            } else if (structure.isSimple(mealType) && meal.parts().stream().noneMatch(PartSlot::isFilled)) {
                violations.add(new Violation(Kind.UNRESOLVED_PART, dayIndex, dayType, mealType,
                    MealStructure.SIMPLE_PART, null,
                    "Day %d (%s), Meal %s: No recipe selected".formatted(dayIndex, dayType, mealType)));
            }

            // Rule 4: selections resolve and carry the slot's tags
            for (PartSlot part : meal.parts()) {
                if (!part.isFilled()) {
                    continue;
                }
                String partName = normalize(part.name());
                Optional<CandidateRecipe> recipe = pool.find(part.selectedRecipeId());
                if (recipe.isEmpty()) {
                    violations.add(new Violation(Kind.UNKNOWN_RECIPE, dayIndex, dayType, mealType, partName,
                        part.selectedRecipeId(),
                        "Day %d (%s), Meal %s, Part %s: Invalid recipe ID %d"
                            .formatted(dayIndex, dayType, mealType, partName, part.selectedRecipeId())));
                    continue;
                }
                dayCalories += recipe.get().calories();
                Set<String> requiredTags = structure.requiredTags(mealType, partName);
                if (!recipe.get().hasAllTags(requiredTags)) {
                    violations.add(new Violation(Kind.MISSING_TAGS, dayIndex, dayType, mealType, partName,
                        part.selectedRecipeId(),
                        "Day %d (%s), Meal %s, Part %s: Recipe ID %d lacks required tags %s"
                            .formatted(dayIndex, dayType, mealType, partName, part.selectedRecipeId(), requiredTags)));
                }
            }
        }

        // Rule 5: calorie band around the day-type target
        if (type.isPresent()) {
            int target = type.get().targetFor(base);
            double low = target * (1 - tolerance);
            double high = target * (1 + tolerance);
            if (dayCalories < low || dayCalories > high) {
                violations.add(new Violation(Kind.CALORIE_BAND, dayIndex, dayType, null, null, null,
                    String.format(Locale.ROOT, "Day %d (%s): Total calories %.2f outside target %d ±%d%%",
                        dayIndex, dayType, dayCalories, target, Math.round(tolerance * 100))));
            }
        }
    }

    // Rule 3: required parts present and resolved
    private void checkStructuredParts(MealSlot meal, String mealType, int dayIndex, String dayType,
                                      List<Violation> violations) {
        for (String required : structure.requiredPartNames(mealType)) {
            Optional<PartSlot> part = meal.part(required);
            if (part.isEmpty()) {
                violations.add(new Violation(Kind.MISSING_PART, dayIndex, dayType, mealType, required, null,
                    "Day %d (%s), Meal %s: Missing required part: %s"
                        .formatted(dayIndex, dayType, mealType, required)));
            } else if (!part.get().isFilled()) {
                violations.add(new Violation(Kind.UNRESOLVED_PART, dayIndex, dayType, mealType, required, null,
                    "Day %d (%s), Meal %s: Required part '%s' has no recipe"
                        .formatted(dayIndex, dayType, mealType, required)));
            }
        }
    }

    private static String normalize(String value) {
        return value == null ? "" : value.trim().toLowerCase(Locale.ROOT);
    }
}
