package dev.mealplans.engine;

import dev.mealplans.model.CandidatePool;
import dev.mealplans.model.Day;
import dev.mealplans.model.DayType;
import dev.mealplans.model.MealSlot;
import dev.mealplans.model.MealStructure;
import dev.mealplans.model.PartSlot;
import dev.mealplans.model.Plan;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class PlanBuilderTest {

    private final CandidatePool pool = PlanFixtures.standardPool();
    private final PlanBuilder builder = new PlanBuilder(PlanFixtures.selector(9), MealStructure.defaults(), 0.15);

    @Test
    void buildsThreeDaysInsideTheirBands() {
        Plan plan = builder.build(PlanFixtures.context(pool));

        assertThat(plan.days()).extracting(Day::dayType).containsExactly("regular", "workout", "rest");
        for (Day day : plan.days()) {
            double total = NutritionSummarizer.dayCalories(day.meals(), pool);
            assertThat(total).isBetween(day.targetCalories() * 0.85, day.targetCalories() * 1.15);
        }
        assertThat(new PlanValidator(MealStructure.defaults(), 0.15).unresolvedRequiredSlots(plan)).isEmpty();
    }

    @Test
    void fillsPlanMetadata() {
        Plan plan = builder.build(PlanFixtures.context(pool));

        assertThat(plan.title()).isEqualTo("Personalized Plan for Ana");
        assertThat(plan.userEmail()).isEqualTo("ana@example.com");
        assertThat(plan.baseDailyCalories()).isEqualTo(2000);
        assertThat(plan.macroTargets().protein()).isEqualTo(0.25);
        assertThat(plan.days()).extracting(Day::date).containsExactly(
            PlanFixtures.START, PlanFixtures.START.plusDays(1), PlanFixtures.START.plusDays(2));
    }

    @Test
    void workoutDayHasWorkoutMeals() {
        Day workout = builder.build(PlanFixtures.context(pool)).day(DayType.WORKOUT).orElseThrow();

        assertThat(workout.meals()).extracting(MealSlot::mealType).contains("pre-workout", "post-workout");
        assertThat(workout.meal("pre-workout").orElseThrow().parts())
            .containsExactly(new PartSlot(MealStructure.SIMPLE_PART, PlanFixtures.PRE_WORKOUT));
    }

    @Test
    void trimsOptionalPartsOnRestDay() {
        Day rest = builder.build(PlanFixtures.context(pool)).day(DayType.REST).orElseThrow();

        assertThat(NutritionSummarizer.dayCalories(rest.meals(), pool)).isEqualTo(1960.0);
        assertThat(rest.meal("lunch").orElseThrow().part("soup").orElseThrow().isFilled()).isFalse();
        assertThat(rest.meal("dinner").orElseThrow().part("soup").orElseThrow().isFilled()).isFalse();
        assertThat(rest.meal("breakfast").orElseThrow().part("fruit").orElseThrow().isFilled()).isTrue();
    }

    @Test
    void trimNeverDropsRequiredParts() {
        var heavy = new CandidatePool(List.of(
            PlanFixtures.recipe(1, 3000, "lunch", "main course"),
            PlanFixtures.recipe(2, 50, "lunch", "soup")));
        var day = new Day(PlanFixtures.START, "regular", 2000, List.of(new MealSlot("lunch", 700, List.of(
            new PartSlot("main course", 1L), new PartSlot("soup", 2L)))));

        Day trimmed = builder.trimToBand(day, heavy);

        assertThat(trimmed.meal("lunch").orElseThrow().parts())
            .containsExactly(new PartSlot("main course", 1L), new PartSlot("soup", null));
    }

    @Test
    void leavesRequiredSlotEmptyWithoutCandidates() {
        var withoutDinnerMain = new CandidatePool(pool.all().stream()
            .filter(r -> r.id() != PlanFixtures.DINNER_MAIN)
            .toList());

        Plan plan = builder.build(PlanFixtures.context(withoutDinnerMain));

        assertThat(new PlanValidator(MealStructure.defaults(), 0.15).unresolvedRequiredSlots(plan))
            .contains("regular/dinner/main course", "regular/supper/main");
    }
}
