package dev.mealplans.engine;

import dev.mealplans.model.CandidateRecipe;
import dev.mealplans.model.Day;
import dev.mealplans.model.DayType;
import dev.mealplans.model.MealSlot;
import dev.mealplans.model.MealStructure;
import dev.mealplans.model.PartSlot;
import dev.mealplans.model.PartSpec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.BooleanSupplier;

/**
 * Builds one fully shaped plan day, keeping valid selections from an earlier version
 * of the day and selecting recipes for the rest.
 */
final class DayAssembler {

    private static final Logger log = LoggerFactory.getLogger(DayAssembler.class);

    private final RecipeSelector selector;
    private final MealStructure structure;

    DayAssembler(RecipeSelector selector, MealStructure structure) {
        this.selector = selector;
        this.structure = structure;
    }

    /**
     * @param previous        earlier version of this day whose valid selections are kept, or null
     * @param includeOptional asked once per empty optional part; true means try to fill it
     */
    Day assemble(DayType type, LocalDate date, Day previous, PlanningContext ctx, BooleanSupplier includeOptional) {
        int target = type.targetFor(ctx.baseDailyCalories());
        List<String> mealTypes = type.expectedMealTypes();
        Map<String, Integer> allocations = CalorieAllocator.allocate(target, mealTypes);
        log.debug("Assembling {} day {}: target {} kcal, allocations {}", type.wireName(), date, target, allocations);

        var meals = new ArrayList<MealSlot>();
        for (String mealType : mealTypes) {
            int allocated = allocations.getOrDefault(mealType, 0);
            Optional<MealSlot> existing = previous == null ? Optional.empty() : previous.meal(mealType);
            if (structure.isStructured(mealType)) {
                meals.add(structuredMeal(type, mealType, allocated, existing, ctx, includeOptional));
            } else {
                meals.add(simpleMeal(type, mealType, allocated, existing, ctx));
            }
        }
        return new Day(date, type.wireName(), target, meals);
    }

    private MealSlot structuredMeal(DayType type, String mealType, int allocated, Optional<MealSlot> existing,
                                    PlanningContext ctx, BooleanSupplier includeOptional) {
        List<PartSpec> specs = structure.parts(mealType);
        double perPart = (double) allocated / specs.size();
        var parts = new ArrayList<PartSlot>();
        for (PartSpec spec : specs) {
            Optional<CandidateRecipe> kept = existing
                .flatMap(m -> m.part(spec.name()))
                .flatMap(p -> reusable(p.selectedRecipeId(), mealType, spec.name(), ctx));
            Long selected = kept.map(CandidateRecipe::id).orElse(null);
            if (selected == null && (spec.required() || includeOptional.getAsBoolean())) {
                selected = selector.select(ctx.pool(), mealType, spec.name(), perPart, ctx.user(), ctx.feedback())
                    .map(CandidateRecipe::id)
                    .orElse(null);
                if (selected == null && spec.required()) {
                    log.warn("Slot unfillable: required part '{}' of {} on {} day has no matching recipe",
                        spec.name(), mealType, type.wireName());
                }
            }
            parts.add(new PartSlot(spec.name(), selected));
        }
        return new MealSlot(mealType, allocated, parts);
    }

    private MealSlot simpleMeal(DayType type, String mealType, int allocated, Optional<MealSlot> existing,
                                PlanningContext ctx) {
        Optional<CandidateRecipe> kept = existing.flatMap(m -> m.parts().stream()
            .filter(PartSlot::isFilled)
            .findFirst())
            .flatMap(p -> reusable(p.selectedRecipeId(), mealType, null, ctx));
        Long selected = kept.map(CandidateRecipe::id).orElse(null);
        if (selected == null) {
            selected = selector.select(ctx.pool(), mealType, null, allocated, ctx.user(), ctx.feedback())
                .map(CandidateRecipe::id)
                .orElse(null);
            if (selected == null) {
                log.warn("Slot unfillable: simple meal {} on {} day has no matching recipe",
                    mealType, type.wireName());
            }
        }
        return new MealSlot(mealType, allocated, List.of(new PartSlot(MealStructure.SIMPLE_PART, selected)));
    }

    private Optional<CandidateRecipe> reusable(Long recipeId, String mealType, String partName, PlanningContext ctx) {
        Set<String> requiredTags = structure.requiredTags(mealType, partName);
        return ctx.pool().find(recipeId).filter(r -> r.hasAllTags(requiredTags));
    }
}
