package dev.mealplans.engine;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import dev.mealplans.model.CandidateRecipe;
import dev.mealplans.model.DayType;
import dev.mealplans.model.MacroTargets;
import dev.mealplans.model.MealStructure;
import dev.mealplans.model.PartSpec;

import java.util.List;
import java.util.Map;
import java.util.TreeSet;

/**
 * Builds the prompts sent to the draft generator: one for a new plan, with candidate
 * recipes per slot, and one for optimizing an exported plan.
 */
public final class DraftPromptBuilder {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private DraftPromptBuilder() {}

    /**
     * Build the prompt for a fresh 3-day plan.
     *
     * @param maxCandidates cap on the candidates listed per slot
     */
    public static String buildGenerationPrompt(PlanningContext ctx, MealStructure structure, int maxCandidates) {
        int base = ctx.baseDailyCalories();
        var sb = new StringBuilder();
        sb.append("You are an expert meal planning assistant. Generate a 3-day JSON meal plan for user ")
            .append(ctx.userDisplayName())
            .append(" targeting approximately ").append(base)
            .append(" kcal/day (adjusted per day type) with goal '").append(ctx.goal()).append("'.\n");
        sb.append("**Requirements**:\n");
        sb.append("1. Three days exactly: one 'regular', one 'workout', and one 'rest' day.\n");
        sb.append("2. Calorie targets:\n");
        for (DayType type : DayType.values()) {
            sb.append("   - ").append(capitalize(type.wireName())).append(": ")
                .append(type.targetFor(base)).append(" kcal\n");
        }
        sb.append("   - Meal distribution: breakfast (25%), lunch (35%), dinner (30%), mid_morning (5%), ")
            .append("mid_afternoon (5%), supper (10%), and for workout days add pre-workout (5%) and post-workout (5%).\n");
        sb.append("3. Meal structure:\n");
        for (var entry : structure.structuredMeals().entrySet()) {
            sb.append("   - ").append(capitalize(entry.getKey())).append(": ")
                .append(describeParts(entry.getValue())).append(".\n");
        }
        sb.append("   - Simple meals and workout meals: only one part, tagged 'main course' plus its meal tag ")
            .append(describeSimpleTags(structure.simpleMealTags())).append(".\n");
        sb.append("4. Recipe selection: use only the candidate recipes below. For required parts, always select one ")
            .append("if available (use null if no candidate exists). For optional parts, select 50% of the time.\n");
        sb.append("5. Output a single valid JSON object starting with '{' and ending with '}' with no extra text.\n\n");
        sb.append("**Candidate Recipes**:\n");
        sb.append(buildCandidateSections(ctx, structure, maxCandidates));
        sb.append(buildOutputFormat(ctx));
        return sb.toString();
    }

    /**
     * Build the prompt asking the generator to improve an existing plan in place.
     */
    public static String buildOptimizationPrompt(String planJson) {
        return "You are an expert meal planning assistant. Optimize the following meal plan so that it meets "
            + "all the pre-established rules (calorie targets, required meals, nutritional balance, and valid "
            + "recipe selections). Return the optimized meal plan in the SAME JSON format with no extra "
            + "commentary.\n\nMeal Plan Input:\n" + planJson;
    }

    static String buildCandidateSections(PlanningContext ctx, MealStructure structure, int maxCandidates) {
        var sb = new StringBuilder();
        for (DayType type : DayType.values()) {
            Map<String, Integer> allocations =
                CalorieAllocator.allocate(type.targetFor(ctx.baseDailyCalories()), type.expectedMealTypes());
            for (String mealType : type.expectedMealTypes()) {
                int allocated = allocations.get(mealType);
                if (structure.isStructured(mealType)) {
                    for (PartSpec part : structure.parts(mealType)) {
                        appendSlot(sb, ctx, structure, type, mealType, part.name(), allocated, maxCandidates);
                    }
                } else {
                    appendSlot(sb, ctx, structure, type, mealType, MealStructure.SIMPLE_PART, allocated, maxCandidates);
                }
            }
        }
        return sb.toString();
    }

    private static void appendSlot(StringBuilder sb, PlanningContext ctx, MealStructure structure, DayType type,
                                   String mealType, String partName, int allocated, int maxCandidates) {
        List<CandidateRecipe> candidates = ctx.pool()
            .withTags(structure.requiredTags(mealType, partName))
            .stream()
            .limit(maxCandidates)
            .toList();
        if (candidates.isEmpty()) {
            sb.append("\nFor '%s' day, '%s' meal, '%s' part: NO CANDIDATES FOUND. Use 'selected_recipe_id': null.\n"
                .formatted(type.wireName(), mealType, partName));
            return;
        }
        sb.append("\nFor '%s' day, '%s' meal, '%s' part (Target ~%d kcal):\n"
            .formatted(type.wireName(), mealType, partName, allocated));
        sb.append("Candidates: ").append(candidateJson(candidates)).append("\n");
        sb.append("Select: {\"name\": \"%s\", \"selected_recipe_id\": <recipe_id_or_null>}\n".formatted(partName));
    }

    private static String candidateJson(List<CandidateRecipe> candidates) {
        ArrayNode array = MAPPER.createArrayNode();
        for (CandidateRecipe recipe : candidates) {
            ObjectNode node = array.addObject();
            node.put("recipe_id", recipe.id());
            node.put("title", recipe.title());
            node.put("calories", Math.round(recipe.calories() * 100.0) / 100.0);
            ArrayNode tags = node.putArray("tags");
            new TreeSet<>(recipe.tags()).forEach(tags::add);
        }
        try {
            return MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(array);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize candidate summaries", e);
        }
    }

    private static String buildOutputFormat(PlanningContext ctx) {
        MacroTargets macros = ctx.macroTargets();
        int base = ctx.baseDailyCalories();
        return """

            **Output Format**:
            {
              "meal_plan_title": "AI Generated Meal Plan for %s",
              "user_email": "%s",
              "base_daily_calories": %d,
              "goal": "%s",
              "macro_targets": {"protein": %s, "carbs": %s, "fat": %s},
              "days": [
                {
                  "date": "YYYY-MM-DD",
                  "day_type": "regular",
                  "target_calories_for_day": %d,
                  "meals": [
                    {
                      "meal_type": "breakfast",
                      "allocated_calories_for_meal": %d,
                      "parts": [
                        {"name": "main course", "selected_recipe_id": <id_or_null>},
                        {"name": "fruit", "selected_recipe_id": <id_or_null>},
                        {"name": "dairy", "selected_recipe_id": <id_or_null>}
                      ]
                    }
                  ]
                }
              ]
            }
            """.formatted(ctx.userDisplayName(), ctx.userEmail() == null ? "" : ctx.userEmail(), base, ctx.goal(),
            macros.protein(), macros.carbs(), macros.fat(), DayType.REGULAR.targetFor(base),
            CalorieAllocator.allocate(DayType.REGULAR.targetFor(base), "breakfast"));
    }

    private static String describeParts(List<PartSpec> parts) {
        return String.join(", ", parts.stream()
            .map(p -> "'" + p.name() + "' (" + (p.required() ? "required" : "optional") + ")")
            .toList());
    }

    private static String describeSimpleTags(Map<String, String> simpleTags) {
        var mapped = new TreeSet<String>();
        simpleTags.forEach((meal, tag) -> {
            if (!meal.equals(tag)) {
                mapped.add(meal + " -> '" + tag + "'");
            }
        });
        return mapped.isEmpty() ? "" : "(" + String.join(", ", mapped) + ")";
    }

    private static String capitalize(String value) {
        return value.isEmpty() ? value : Character.toUpperCase(value.charAt(0)) + value.substring(1);
    }
}
