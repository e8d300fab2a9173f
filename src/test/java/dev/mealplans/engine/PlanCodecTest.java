package dev.mealplans.engine;

import dev.mealplans.model.DayType;
import dev.mealplans.model.Plan;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class PlanCodecTest {

    @Test
    void writesSnakeCaseWireFormat() {
        var json = PlanCodec.toJson(PlanFixtures.validPlan());

        assertThat(json.get("meal_plan_title").asText()).isEqualTo("Personalized Plan for Ana");
        assertThat(json.get("base_daily_calories").asInt()).isEqualTo(2000);
        assertThat(json.at("/macro_targets/carbs").asDouble()).isEqualTo(0.5);
        assertThat(json.at("/days/0/day_type").asText()).isEqualTo("regular");
        assertThat(json.at("/days/0/date").asText()).isEqualTo("2024-03-04");
        assertThat(json.at("/days/0/meals/0/allocated_calories_for_meal").asInt()).isEqualTo(500);
        assertThat(json.at("/days/0/meals/0/parts/0/selected_recipe_id").asLong()).isEqualTo(PlanFixtures.BREAKFAST_MAIN);
        assertThat(json.at("/days/2/meals/1/parts/1/selected_recipe_id").isNull()).isTrue();
    }

    @Test
    void readsBackWrittenPlan() throws Exception {
        Plan plan = PlanFixtures.validPlan();

        Plan read = PlanCodec.fromString(PlanCodec.toJsonString(plan));

        assertThat(read).isEqualTo(plan);
    }

    @Test
    void acceptsStringRecipeIdsAndBadDates() throws Exception {
        Plan plan = PlanCodec.fromString("""
            {"days": [{"date": "next monday", "day_type": "rest",
                       "meals": [{"meal_type": "supper", "parts": [
                          {"name": "main", "selected_recipe_id": "42"},
                          {"name": "extra", "selected_recipe_id": "n/a"},
                          {"name": "odd", "selected_recipe_id": 1.5}]}]}]}
            """);

        var day = plan.day(DayType.REST).orElseThrow();
        assertThat(day.date()).isNull();
        var parts = day.meal("supper").orElseThrow().parts();
        assertThat(parts.get(0).selectedRecipeId()).isEqualTo(42L);
        assertThat(parts.get(1).selectedRecipeId()).isNull();
        assertThat(parts.get(2).selectedRecipeId()).isNull();
        assertThat(plan.goal()).isEqualTo("maintenance");
    }
}
