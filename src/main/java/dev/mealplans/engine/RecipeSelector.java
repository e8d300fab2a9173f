package dev.mealplans.engine;

import dev.mealplans.model.CandidatePool;
import dev.mealplans.model.CandidateRecipe;
import dev.mealplans.model.MealStructure;
import dev.mealplans.model.UserProfile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Random;
import java.util.Set;

/**
 * Picks the best-scoring recipe for a slot among the tag-compatible candidates.
 */
public final class RecipeSelector {

    private static final Logger log = LoggerFactory.getLogger(RecipeSelector.class);

    private final RecipeScorer scorer;
    private final MealStructure structure;
    private final Random random;

    public RecipeSelector(RecipeScorer scorer, MealStructure structure, Random random) {
        this.scorer = scorer;
        this.structure = structure;
        this.random = random;
    }

    /**
     * Select a recipe for a slot. Ties on the top score are broken uniformly at random.
     *
     * @param partName part being filled, or null for the implicit part of a simple meal
     * @return the chosen recipe, or empty when no candidate carries the required tags
     */
    public Optional<CandidateRecipe> select(CandidatePool pool, String mealType, String partName,
                                            double targetCalories, UserProfile user, FeedbackLookup feedback) {
        Set<String> requiredTags = structure.requiredTags(mealType, partName);
        List<CandidateRecipe> candidates = pool.withTags(requiredTags);

        // simple meals score against their mapped tag and "main course"
        boolean simple = structure.isSimple(mealType);
        String scoreMeal = structure.mealTag(mealType);
        String scorePart = simple ? MealStructure.MAIN_COURSE : partName;

        double bestScore = Double.NEGATIVE_INFINITY;
        var best = new ArrayList<CandidateRecipe>();
        for (CandidateRecipe candidate : candidates) {
            double score = scorer.score(candidate, user, scoreMeal, scorePart, targetCalories, feedback);
            if (score > bestScore) {
                bestScore = score;
                best.clear();
                best.add(candidate);
            } else if (score == bestScore) {
                best.add(candidate);
            }
        }

        if (best.isEmpty()) {
            log.warn("No suitable recipe for part '{}' of meal '{}' (required tags {}, {} candidates after filter)",
                partName, mealType, requiredTags, candidates.size());
            return Optional.empty();
        }
        CandidateRecipe chosen = best.get(random.nextInt(best.size()));
        log.debug("Selected recipe {} for {}/{} (score {}, {} candidates)",
            chosen.id(), mealType, partName, bestScore, candidates.size());
        return Optional.of(chosen);
    }
}
