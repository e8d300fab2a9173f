package dev.mealplans.engine;

import dev.mealplans.model.CandidatePool;
import dev.mealplans.model.MealStructure;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.stream.LongStream;

import static org.assertj.core.api.Assertions.assertThat;

class DraftPromptBuilderTest {

    @Test
    void includesTargetsPerDayType() {
        String prompt = DraftPromptBuilder.buildGenerationPrompt(
            PlanFixtures.context(PlanFixtures.standardPool()), MealStructure.defaults(), 10);

        assertThat(prompt).contains("Regular: 2000 kcal");
        assertThat(prompt).contains("Workout: 2400 kcal");
        assertThat(prompt).contains("Rest: 1800 kcal");
        assertThat(prompt).contains("user Ana");
    }

    @Test
    void listsCandidatesPerSlot() {
        String prompt = DraftPromptBuilder.buildGenerationPrompt(
            PlanFixtures.context(PlanFixtures.standardPool()), MealStructure.defaults(), 10);

        assertThat(prompt).contains("For 'regular' day, 'lunch' meal, 'main course' part (Target ~700 kcal):");
        assertThat(prompt).contains("For 'workout' day, 'pre-workout' meal, 'main' part (Target ~120 kcal):");
        assertThat(prompt).contains("\"recipe_id\" : 4");
        assertThat(prompt).contains("Select: {\"name\": \"soup\", \"selected_recipe_id\": <recipe_id_or_null>}");
    }

    @Test
    void marksSlotsWithoutCandidates() {
        var recipes = new ArrayList<>(PlanFixtures.standardPool().all());
        recipes.removeIf(r -> r.id() == PlanFixtures.DINNER_SOUP);

        String prompt = DraftPromptBuilder.buildGenerationPrompt(
            PlanFixtures.context(new CandidatePool(recipes)), MealStructure.defaults(), 10);

        assertThat(prompt).contains(
            "For 'rest' day, 'dinner' meal, 'soup' part: NO CANDIDATES FOUND. Use 'selected_recipe_id': null.");
    }

    @Test
    void capsCandidatesPerSlot() {
        var pool = new CandidatePool(LongStream.rangeClosed(1, 5)
            .mapToObj(id -> PlanFixtures.recipe(id, 300 + id, "lunch", "soup"))
            .toList());

        String section = DraftPromptBuilder.buildCandidateSections(
            PlanFixtures.context(pool), MealStructure.defaults(), 2);

        assertThat(section).contains("\"recipe_id\" : 1", "\"recipe_id\" : 2");
        assertThat(section).doesNotContain("\"recipe_id\" : 3");
    }

    @Test
    void optimizationPromptEmbedsPlan() {
        String prompt = DraftPromptBuilder.buildOptimizationPrompt("{\"days\": []}");

        assertThat(prompt).contains("SAME JSON format");
        assertThat(prompt).endsWith("Meal Plan Input:\n{\"days\": []}");
    }
}
