package dev.mealplans.cli;

import dev.mealplans.backend.OllamaDraftGenerator;
import dev.mealplans.catalog.JsonCatalog;
import dev.mealplans.catalog.JsonPlanStore;
import dev.mealplans.engine.DraftException;
import dev.mealplans.engine.FeedbackLookup;
import dev.mealplans.engine.GenerationOrchestrator;
import dev.mealplans.engine.MealPlanningException;
import dev.mealplans.engine.PlanValidationException;
import dev.mealplans.engine.PlanningContext;
import dev.mealplans.model.GenerationResult;
import dev.mealplans.model.MealStructure;
import dev.mealplans.model.Plan;
import dev.mealplans.model.PlannerSettings;
import dev.mealplans.model.UserProfile;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Option;

import java.io.IOException;
import java.util.Optional;
import java.util.concurrent.Callable;

@Command(
    name = "optimize",
    mixinStandardHelpOptions = true,
    description = "Ask the draft generator to improve a stored plan and replace it."
)
public class OptimizeCommand implements Callable<Integer> {

    @Mixin
    CommonOptions common;

    @Option(names = "--plan-id", required = true, description = "Id of the stored plan")
    long planId;

    @Override
    public Integer call() {
        common.applyLogLevel();
        if (common.store == null) {
            System.err.println("Error: --store is required to optimize a plan");
            return MealPlannerCli.EXIT_INPUT_ERROR;
        }

        var store = new JsonPlanStore(common.store);
        PlannerSettings settings;
        JsonCatalog catalog;
        Optional<Plan> existing;
        try {
            settings = common.resolveSettings();
            catalog = JsonCatalog.loadFromFile(common.catalog);
            existing = store.export(planId);
        } catch (IOException | IllegalArgumentException e) {
            System.err.println("Error: " + e.getMessage());
            return MealPlannerCli.EXIT_INPUT_ERROR;
        }
        if (existing.isEmpty()) {
            System.err.println("Error: meal plan with ID " + planId + " does not exist");
            return MealPlannerCli.EXIT_INPUT_ERROR;
        }

        Plan plan = existing.get();
        UserProfile user = catalog.findUser(plan.userEmail()).orElse(null);
        var orchestrator = new GenerationOrchestrator(settings, MealStructure.defaults(),
            new OllamaDraftGenerator(common.ollamaUrl, settings.draftTimeout()));

        GenerationResult result;
        try {
            PlanningContext ctx = orchestrator.prepareForExisting(plan, user,
                catalog.candidatesFor(user), FeedbackLookup.cachedFrom(catalog, user));
            result = orchestrator.optimize(plan, ctx);
        } catch (PlanValidationException e) {
            System.err.println("Error: optimized plan is still invalid:");
            e.violations().forEach(v -> System.err.println("  " + v));
            return MealPlannerCli.EXIT_GENERATION_FAILED;
        } catch (DraftException e) {
            System.err.println("Error: " + e.getMessage());
            return MealPlannerCli.EXIT_GENERATION_FAILED;
        } catch (MealPlanningException e) {
            System.err.println("Error: " + e.getMessage());
            return MealPlannerCli.EXIT_INPUT_ERROR;
        }

        try {
            store.replace(planId, result.plan());
        } catch (IOException e) {
            System.err.println("Error: failed to store optimized plan: " + e.getMessage());
            return MealPlannerCli.EXIT_GENERATION_FAILED;
        }
        System.err.println("Optimized plan " + planId + " using " + result.method().label());
        return 0;
    }
}
