package dev.mealplans.engine;

import dev.mealplans.backend.DraftGenerator;
import dev.mealplans.backend.DraftResponse;
import dev.mealplans.engine.GenerationRun.State;
import dev.mealplans.model.CandidatePool;
import dev.mealplans.model.Day;
import dev.mealplans.model.DayType;
import dev.mealplans.model.DraftResult;
import dev.mealplans.model.GenerationMethod;
import dev.mealplans.model.GenerationResult;
import dev.mealplans.model.MealSlot;
import dev.mealplans.model.MealStructure;
import dev.mealplans.model.Plan;
import dev.mealplans.model.PlannerSettings;
import dev.mealplans.model.UserProfile;
import dev.mealplans.model.Violation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Random;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Drives one plan request: draft, validate, repair once, re-validate, and fall back
 * to the deterministic builder when the draft path cannot produce a valid plan.
 */
public final class GenerationOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(GenerationOrchestrator.class);

    private final PlannerSettings settings;
    private final MealStructure structure;
    private final DraftGenerator generator; // nullable, deterministic only when absent
    private final PlanValidator validator;
    private final PlanRepairer repairer;
    private final PlanBuilder builder;

    public GenerationOrchestrator(PlannerSettings settings, MealStructure structure, DraftGenerator generator) {
        this(settings, structure, generator,
            settings.seed() == null ? new Random() : new Random(settings.seed()));
    }

    public GenerationOrchestrator(PlannerSettings settings, MealStructure structure,
                                  DraftGenerator generator, Random random) {
        this.settings = settings;
        this.generator = generator;
        RecipeSelector selector = new RecipeSelector(new RecipeScorer(random), structure, random);
        this.validator = new PlanValidator(structure, settings.calorieTolerance());
        this.repairer = new PlanRepairer(selector, structure, random, settings.optionalPartProbability(),
            settings.calorieTolerance());
        this.builder = new PlanBuilder(selector, structure, settings.calorieTolerance());
        this.structure = structure;
    }

    /**
     * Check prerequisites and build the request context for a new plan.
     *
     * @param dailyCalories base daily kcal before the activity uplift
     * @throws InsufficientCandidatesException when the pool is below the configured minimum
     */
    public PlanningContext prepare(UserProfile user, int dailyCalories, String goal, CandidatePool pool,
                                   FeedbackLookup feedback, LocalDate startDate) {
        requireCandidates(pool);
        int base = settings.adjustedBase(dailyCalories, user);
        if (base != dailyCalories) {
            log.info("Adjusted daily calories for activity level: {} -> {}", dailyCalories, base);
        }
        return new PlanningContext(user, base, goal, pool, feedback, startDate);
    }

    /**
     * Build the request context for optimizing a stored plan. Its base calories are already adjusted.
     */
    public PlanningContext prepareForExisting(Plan existing, UserProfile user, CandidatePool pool,
                                              FeedbackLookup feedback) {
        requireCandidates(pool);
        LocalDate start = existing.days().stream()
            .map(Day::date)
            .filter(Objects::nonNull)
            .min(LocalDate::compareTo)
            .orElse(LocalDate.now());
        return new PlanningContext(user, existing.baseDailyCalories(), existing.goal(), pool, feedback, start);
    }

    private void requireCandidates(CandidatePool pool) {
        if (pool.size() < settings.minimumCandidates()) {
            throw new InsufficientCandidatesException(settings.minimumCandidates(), pool.size());
        }
    }

    /**
     * Produce an accepted plan. Draft failures never escape; they select the deterministic path.
     *
     * @throws PlanValidationException when the deterministic plan breaks a rule other than an unfillable part
     */
    public GenerationResult generate(PlanningContext ctx, boolean forceDeterministic) {
        if (generator != null && !forceDeterministic) {
            var run = new GenerationRun("generate", State.AWAIT_DRAFT);
            try {
                String prompt = DraftPromptBuilder.buildGenerationPrompt(ctx, structure, settings.maxPromptCandidates());
                Plan draft = requestPlan(prompt);
                if (draft.title() == null || draft.title().isBlank()) {
                    draft = draft.withTitle("AI Plan for " + ctx.userDisplayName());
                }
                GenerationResult result = validateAndRepair(run, draft, ctx);
                log.info("Draft plan accepted for {} ({}) in {} ms", run.label(), result.method().label(),
                    run.elapsedMillis());
                return result;
            } catch (DraftException | PlanValidationException e) {
                log.warn("Draft path failed, falling back to deterministic generation: {}", e.getMessage());
                run.transitionTo(State.FALLBACK_DETERMINISTIC);
                return buildDeterministic(run, ctx);
            }
        }
        log.info("Using deterministic generation{}", forceDeterministic ? " (forced)" : "");
        return buildDeterministic(new GenerationRun("generate", State.FALLBACK_DETERMINISTIC), ctx);
    }

    /**
     * Ask the generator to improve an existing plan. The returned plan is meant to replace it entirely.
     *
     * @throws DraftException          when no generator is configured or its response is unusable
     * @throws PlanValidationException when the repaired plan still violates the rules
     */
    public GenerationResult optimize(Plan existing, PlanningContext ctx) {
        if (generator == null) {
            throw new DraftException("Optimization needs a draft generator");
        }
        var run = new GenerationRun("optimize", State.AWAIT_DRAFT);
        String prompt = DraftPromptBuilder.buildOptimizationPrompt(PlanCodec.toJsonString(existing));
        Plan draft = requestPlan(prompt);
        if (draft.title() == null || draft.title().isBlank()) {
            draft = draft.withTitle(existing.title());
        }
        return validateAndRepair(run, draft, ctx);
    }

    private GenerationResult validateAndRepair(GenerationRun run, Plan draft, PlanningContext ctx) {
        run.transitionTo(State.VALIDATE);
        List<Violation> violations = validator.validate(draft, ctx.baseDailyCalories(), ctx.pool());
        if (violations.isEmpty()) {
            run.transitionTo(State.ACCEPT);
            return result(anchored(draft, ctx), GenerationMethod.DRAFT, run, ctx, List.of());
        }
        log.info("Draft has {} violation(s), repairing", violations.size());
        violations.forEach(v -> log.debug("  {}", v));

        run.transitionTo(State.REPAIR);
        Plan repaired = repairer.repair(draft, ctx);
        run.transitionTo(State.REVALIDATE);
        List<Violation> remaining = validator.validate(repaired, ctx.baseDailyCalories(), ctx.pool());
        if (!remaining.isEmpty()) {
            throw new PlanValidationException(remaining);
        }
        run.transitionTo(State.ACCEPT);
        return result(repaired, GenerationMethod.DRAFT_REPAIRED, run, ctx, List.of());
    }

    /**
     * Only required parts without any candidate may stay open in a deterministic plan.
     *
     * @throws PlanValidationException when the built plan breaks any other rule
     */
    private GenerationResult buildDeterministic(GenerationRun run, PlanningContext ctx) {
        Plan plan = builder.build(ctx);
        List<Violation> notes = validator.validate(plan, ctx.baseDailyCalories(), ctx.pool());
        List<Violation> blocking = notes.stream()
            .filter(v -> v.kind() != Violation.Kind.UNRESOLVED_PART)
            .toList();
        if (!blocking.isEmpty()) {
            log.error("Deterministic plan rejected with {} violation(s)", blocking.size());
            throw new PlanValidationException(blocking);
        }
        if (!notes.isEmpty()) {
            log.warn("Deterministic plan accepted with {} unresolved part(s)", notes.size());
            notes.forEach(n -> log.debug("  {}", n));
        }
        run.transitionTo(State.ACCEPT);
        return result(plan, GenerationMethod.DETERMINISTIC, run, ctx, notes);
    }

    // plan metadata, day targets and meal allocations come from the request, never from the draft
    private static Plan anchored(Plan draft, PlanningContext ctx) {
        var days = new ArrayList<Day>();
        for (Day day : draft.days()) {
            int target = day.type()
                .map(t -> t.targetFor(ctx.baseDailyCalories()))
                .orElse(day.targetCalories());
            var meals = new ArrayList<MealSlot>();
            for (MealSlot meal : day.meals()) {
                int allocated = meal.mealType() == null
                    ? meal.allocatedCalories()
                    : CalorieAllocator.allocate(target, meal.mealType().trim().toLowerCase(Locale.ROOT));
                meals.add(new MealSlot(meal.mealType(), allocated, meal.parts()));
            }
            String dayType = day.type().map(DayType::wireName).orElse(day.dayType());
            days.add(new Day(day.date(), dayType, target, meals));
        }
        return new Plan(draft.title(), ctx.userEmail(), ctx.baseDailyCalories(), ctx.goal(), ctx.macroTargets(),
            days);
    }

    private GenerationResult result(Plan plan, GenerationMethod method, GenerationRun run,
                                    PlanningContext ctx, List<Violation> notes) {
        return new GenerationResult(plan, method, run.traceNames(), validator.unresolvedRequiredSlots(plan),
            notes, NutritionSummarizer.summarize(plan, ctx.pool()));
    }

    /**
     * Call the generator under the draft timeout and parse its response into a plan.
     */
    private Plan requestPlan(String prompt) {
        DraftResponse response = callWithTimeout(prompt);
        if (!response.success()) {
            throw new DraftException("Draft generator failed: " + response.error());
        }
        DraftResult parsed = DraftParser.parse(response.responseText());
        if (parsed instanceof DraftResult.Failure failure) {
            throw new DraftException(failure.error());
        }
        return ((DraftResult.Success) parsed).plan();
    }

    private DraftResponse callWithTimeout(String prompt) {
        ExecutorService executor = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "draft-generator");
            t.setDaemon(true);
            return t;
        });
        try {
            Future<DraftResponse> future = executor.submit(() -> generator.requestDraft(prompt, settings.model()));
            long timeoutMillis = settings.draftTimeout().toMillis();
            DraftResponse response = future.get(timeoutMillis, TimeUnit.MILLISECONDS);
            if (response == null) {
                throw new DraftException("Draft generator returned no response");
            }
            log.debug("Draft from {} received in {} ms", generator.getName(), response.durationMillis());
            return response;
        } catch (TimeoutException e) {
            throw new DraftException("Draft generator timed out after %d ms"
                .formatted(settings.draftTimeout().toMillis()), e);
        } catch (ExecutionException e) {
            throw new DraftException("Draft generator raised: " + e.getCause(), e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new DraftException("Interrupted while waiting for the draft", e);
        } finally {
            executor.shutdownNow();
        }
    }
}
