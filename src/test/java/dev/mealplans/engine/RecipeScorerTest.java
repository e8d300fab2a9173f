package dev.mealplans.engine;

import dev.mealplans.model.CandidateRecipe;
import dev.mealplans.model.UserFeedback;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.Random;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class RecipeScorerTest {

    private final RecipeScorer scorer = new RecipeScorer(new Random(3));

    @Test
    void closerCaloriesScoreHigher() {
        double previous = Double.NEGATIVE_INFINITY;
        for (double calories : new double[] {900, 700, 560, 520, 500}) {
            var recipe = PlanFixtures.recipe(1, calories, "lunch", "main course");
            double weighted = scorer.explain(recipe, null, "lunch", "main course", 500, FeedbackLookup.empty())
                .weighted();
            assertThat(weighted).isGreaterThanOrEqualTo(previous);
            previous = weighted;
        }
    }

    @Test
    void calorieFitIsSkippedWithoutTarget() {
        var recipe = PlanFixtures.recipe(1, 300, "lunch");

        var breakdown = scorer.explain(recipe, null, "lunch", "soup", 0, FeedbackLookup.empty());

        assertThat(breakdown.calorieFit()).isZero();
        assertThat(breakdown.tagBonus()).isCloseTo(0.1, within(1e-9));
    }

    @Test
    void calorieFitFloorsAtZero() {
        var recipe = PlanFixtures.recipe(1, 1500, "dinner");

        assertThat(scorer.explain(recipe, null, "dinner", null, 500, FeedbackLookup.empty()).calorieFit()).isZero();
    }

    @Test
    void matchingTagsAddBonus() {
        var recipe = PlanFixtures.recipe(1, 500, "Lunch", "Main Course");

        var breakdown = scorer.explain(recipe, null, "lunch", "main course", 500, FeedbackLookup.empty());

        assertThat(breakdown.calorieFit()).isEqualTo(1.0);
        assertThat(breakdown.tagBonus()).isCloseTo(0.2, within(1e-9));
    }

    @Test
    void positiveFeedbackIsCapped() {
        var feedback = new UserFeedback(1, 5, true, 12, 0);

        assertThat(RecipeScorer.personalBonus(feedback)).isCloseTo(0.3, within(1e-9));
    }

    @Test
    void negativeFeedbackLowersScore() {
        var feedback = new UserFeedback(1, 1, false, 0, 2);

        assertThat(RecipeScorer.personalBonus(feedback)).isCloseTo(-0.34, within(1e-9));
    }

    @Test
    void feedbackIsLookedUpByRecipe() {
        var recipe = PlanFixtures.recipe(7, 500, "lunch");
        var lookup = FeedbackLookup.of(Map.of(7L, new UserFeedback(7, 4, null, 0, 0)));

        var breakdown = scorer.explain(recipe, PlanFixtures.USER, "lunch", null, 500, lookup);

        assertThat(breakdown.personalBonus()).isCloseTo(0.1, within(1e-9));
    }

    @Test
    void popularityIsBounded() {
        var recipe = new CandidateRecipe(1, "Popular", Set.of("lunch"), 500, 0, 0, 0, 5.0, 250);

        var breakdown = scorer.explain(recipe, null, "lunch", null, 500, FeedbackLookup.empty());

        assertThat(breakdown.globalBonus()).isCloseTo(0.1, within(1e-9));
    }

    @Test
    void jitterStaysSmall() {
        var recipe = PlanFixtures.recipe(1, 500, "lunch");
        for (int i = 0; i < 50; i++) {
            var breakdown = scorer.explain(recipe, null, "lunch", null, 500, FeedbackLookup.empty());
            assertThat(breakdown.jitter()).isGreaterThanOrEqualTo(0.0).isLessThan(RecipeScorer.MAX_JITTER);
            assertThat(breakdown.total()).isCloseTo(breakdown.weighted() + breakdown.jitter(), within(1e-12));
        }
    }
}
