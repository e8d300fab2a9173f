package dev.mealplans.engine;

import dev.mealplans.model.Day;
import dev.mealplans.model.DayType;
import dev.mealplans.model.MealStructure;
import dev.mealplans.model.PartSlot;
import dev.mealplans.model.Plan;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Objects;
import java.util.Random;

/**
 * Rebuilds a possibly partial or invalid plan into a fully shaped one. Valid
 * selections are kept; missing or invalid ones are selected again. Optional parts
 * without a prior selection are included at random to vary the plans, and dropped
 * again if they push a day above its calorie band.
 */
public final class PlanRepairer {

    private static final Logger log = LoggerFactory.getLogger(PlanRepairer.class);

    private final DayAssembler assembler;
    private final BandTrimmer trimmer;
    private final Random random;
    private final double optionalPartProbability;

    public PlanRepairer(RecipeSelector selector, MealStructure structure, Random random,
                        double optionalPartProbability, double tolerance) {
        this.assembler = new DayAssembler(selector, structure);
        this.trimmer = new BandTrimmer(structure, tolerance);
        this.random = random;
        this.optionalPartProbability = optionalPartProbability;
    }

    /**
     * Return a replacement plan with exactly one regular, workout and rest day, in that order.
     * The draft itself is left untouched.
     */
    public Plan repair(Plan draft, PlanningContext ctx) {
        log.info("Repairing plan '{}' ({} draft days)", draft.title(), draft.days().size());
        var days = new ArrayList<Day>();
        DayType[] types = DayType.values();
        for (int i = 0; i < types.length; i++) {
            DayType type = types[i];
            Day previous = draft.day(type).orElse(null);
            LocalDate date = previous != null && previous.date() != null
                ? previous.date()
                : ctx.startDate().plusDays(i);
            Day assembled = assembler.assemble(type, date, previous, ctx,
                () -> random.nextDouble() < optionalPartProbability);
            days.add(trimmer.trim(assembled, ctx.pool(), (mealType, part) -> keptFrom(previous, mealType, part)));
        }
        String title = draft.title() == null || draft.title().isBlank()
            ? "AI Plan for " + ctx.userDisplayName()
            : draft.title();
        return new Plan(title, ctx.userEmail(), ctx.baseDailyCalories(), ctx.goal(), ctx.macroTargets(), days);
    }

    // a selection carried over unchanged from the draft day
    private static boolean keptFrom(Day previous, String mealType, PartSlot part) {
        return previous != null && previous.meal(mealType)
            .flatMap(m -> m.part(part.name()))
            .map(p -> Objects.equals(p.selectedRecipeId(), part.selectedRecipeId()))
            .orElse(false);
    }
}
