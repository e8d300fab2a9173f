package dev.mealplans.engine;

import dev.mealplans.model.CandidatePool;
import dev.mealplans.model.Day;
import dev.mealplans.model.DayType;
import dev.mealplans.model.MealStructure;
import dev.mealplans.model.Plan;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;

/**
 * Builds a plan directly from the candidate pool, without any draft. Every part is
 * attempted; optional parts are then dropped while a day sits above its calorie band.
 */
public final class PlanBuilder {

    private static final Logger log = LoggerFactory.getLogger(PlanBuilder.class);

    private final DayAssembler assembler;
    private final BandTrimmer trimmer;

    public PlanBuilder(RecipeSelector selector, MealStructure structure, double tolerance) {
        this.assembler = new DayAssembler(selector, structure);
        this.trimmer = new BandTrimmer(structure, tolerance);
    }

    public Plan build(PlanningContext ctx) {
        var days = new ArrayList<Day>();
        DayType[] types = DayType.values();
        for (int i = 0; i < types.length; i++) {
            DayType type = types[i];
            Day day = assembler.assemble(type, ctx.startDate().plusDays(i), null, ctx, () -> true);
            log.info("Deterministic day {}: type '{}', target {} kcal", i + 1, type.wireName(), day.targetCalories());
            days.add(trimToBand(day, ctx.pool()));
        }
        return new Plan("Personalized Plan for " + ctx.userDisplayName(), ctx.userEmail(),
            ctx.baseDailyCalories(), ctx.goal(), ctx.macroTargets(), days);
    }

    Day trimToBand(Day day, CandidatePool pool) {
        return trimmer.trim(day, pool, (mealType, part) -> false);
    }
}
