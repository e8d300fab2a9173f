package dev.mealplans.cli;

import dev.mealplans.backend.DraftGenerator;
import dev.mealplans.backend.OllamaDraftGenerator;
import dev.mealplans.catalog.JsonCatalog;
import dev.mealplans.catalog.JsonPlanStore;
import dev.mealplans.engine.FeedbackLookup;
import dev.mealplans.engine.GenerationOrchestrator;
import dev.mealplans.engine.MealPlanningException;
import dev.mealplans.engine.PlanCodec;
import dev.mealplans.engine.PlanValidationException;
import dev.mealplans.engine.PlanningContext;
import dev.mealplans.model.DaySummary;
import dev.mealplans.model.GenerationResult;
import dev.mealplans.model.MealStructure;
import dev.mealplans.model.PlannerSettings;
import dev.mealplans.model.UserProfile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Option;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.Callable;

@Command(
    name = "generate",
    mixinStandardHelpOptions = true,
    description = "Create a personalized 3-day meal plan for a user."
)
public class GenerateCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(GenerateCommand.class);

    private static final Set<String> GOALS = Set.of("weight_loss", "muscle_gain", "maintenance");

    @Mixin
    CommonOptions common;

    @Option(names = "--user", required = true, description = "Email of the user to plan for")
    String userEmail;

    @Option(names = "--calories", defaultValue = "2000", description = "Base daily calories (default: ${DEFAULT-VALUE})")
    int calories;

    @Option(names = "--goal", defaultValue = "maintenance",
        description = "Nutrition goal: weight_loss, muscle_gain, maintenance (default: ${DEFAULT-VALUE})")
    String goal;

    @Option(names = "--start-date", description = "Date of the first plan day (default: today)")
    LocalDate startDate;

    @Option(names = "--force-deterministic", description = "Skip the draft generator")
    boolean forceDeterministic;

    @Option(names = "--out", description = "Write the plan JSON to this file instead of stdout")
    Path out;

    @Override
    public Integer call() {
        common.applyLogLevel();
        if (!GOALS.contains(goal)) {
            System.err.println("Error: unknown goal '" + goal + "'. Use one of " + GOALS);
            return MealPlannerCli.EXIT_INPUT_ERROR;
        }
        if (calories <= 0) {
            System.err.println("Error: --calories must be positive");
            return MealPlannerCli.EXIT_INPUT_ERROR;
        }

        PlannerSettings settings;
        JsonCatalog catalog;
        try {
            settings = common.resolveSettings();
            catalog = JsonCatalog.loadFromFile(common.catalog);
        } catch (IOException | IllegalArgumentException e) {
            System.err.println("Error: " + e.getMessage());
            return MealPlannerCli.EXIT_INPUT_ERROR;
        }

        Optional<UserProfile> user = catalog.findUser(userEmail);
        if (user.isEmpty()) {
            System.err.println("Error: user " + userEmail + " not found in " + common.catalog);
            return MealPlannerCli.EXIT_INPUT_ERROR;
        }

        DraftGenerator generator = forceDeterministic
            ? null
            : new OllamaDraftGenerator(common.ollamaUrl, settings.draftTimeout());
        var orchestrator = new GenerationOrchestrator(settings, MealStructure.defaults(), generator);

        GenerationResult result;
        try {
            PlanningContext ctx = orchestrator.prepare(user.get(), calories, goal,
                catalog.candidatesFor(user.get()), FeedbackLookup.cachedFrom(catalog, user.get()),
                startDate != null ? startDate : LocalDate.now());
            result = orchestrator.generate(ctx, forceDeterministic);
        } catch (PlanValidationException e) {
            System.err.println("Error: " + e.getMessage());
            return MealPlannerCli.EXIT_GENERATION_FAILED;
        } catch (MealPlanningException e) {
            System.err.println("Error: " + e.getMessage());
            return MealPlannerCli.EXIT_INPUT_ERROR;
        }

        try {
            emit(result, user.get());
        } catch (IOException e) {
            System.err.println("Error: failed to write plan: " + e.getMessage());
            return MealPlannerCli.EXIT_GENERATION_FAILED;
        }
        return 0;
    }

    private void emit(GenerationResult result, UserProfile user) throws IOException {
        String json = PlanCodec.toJsonString(result.plan());
        if (out != null) {
            Files.writeString(out, json, StandardCharsets.UTF_8);
        } else {
            System.out.println(json);
        }
        if (common.store != null) {
            long id = new JsonPlanStore(common.store).save(result.plan(), user);
            System.err.println("Stored plan " + id + " in " + common.store);
        }

        System.err.println("Plan '" + result.plan().title() + "' created using " + result.method().label());
        for (DaySummary summary : result.summaries()) {
            System.err.printf("  %s (%s): %.2f kcal, P %.2f g, C %.2f g, F %.2f g%n", summary.date(),
                summary.dayType(), summary.totalCalories(), summary.protein(), summary.carbohydrate(), summary.fat());
        }
        result.unfilledSlots().forEach(slot -> System.err.println("  Unfilled: " + slot));
        result.qualityNotes().forEach(note -> System.err.println("  Note: " + note));
        log.debug("Trace: {}", result.trace());
    }
}
