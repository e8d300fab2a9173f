package dev.mealplans.engine;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import dev.mealplans.model.Day;
import dev.mealplans.model.MacroTargets;
import dev.mealplans.model.MealSlot;
import dev.mealplans.model.PartSlot;
import dev.mealplans.model.Plan;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;

/**
 * Converts plans to and from their nested key-value wire form. Reading is lenient:
 * missing fields get defaults so that malformed drafts still reach validation.
 */
public final class PlanCodec {

    private static final Logger log = LoggerFactory.getLogger(PlanCodec.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private PlanCodec() {}

    public static ObjectNode toJson(Plan plan) {
        ObjectNode root = MAPPER.createObjectNode();
        root.put("meal_plan_title", plan.title());
        root.put("user_email", plan.userEmail());
        root.put("base_daily_calories", plan.baseDailyCalories());
        root.put("goal", plan.goal());
        MacroTargets macros = plan.macroTargets() != null ? plan.macroTargets() : MacroTargets.forGoal(plan.goal());
        ObjectNode macroNode = root.putObject("macro_targets");
        macroNode.put("protein", macros.protein());
        macroNode.put("carbs", macros.carbs());
        macroNode.put("fat", macros.fat());

        ArrayNode days = root.putArray("days");
        for (Day day : plan.days()) {
            ObjectNode dayNode = days.addObject();
            dayNode.put("date", day.date() == null ? null : day.date().toString());
            dayNode.put("day_type", day.dayType());
            dayNode.put("target_calories_for_day", day.targetCalories());
            ArrayNode meals = dayNode.putArray("meals");
            for (MealSlot meal : day.meals()) {
                ObjectNode mealNode = meals.addObject();
                mealNode.put("meal_type", meal.mealType());
                mealNode.put("allocated_calories_for_meal", meal.allocatedCalories());
                ArrayNode parts = mealNode.putArray("parts");
                for (PartSlot part : meal.parts()) {
                    ObjectNode partNode = parts.addObject();
                    partNode.put("name", part.name());
                    if (part.selectedRecipeId() == null) {
                        partNode.putNull("selected_recipe_id");
                    } else {
                        partNode.put("selected_recipe_id", part.selectedRecipeId());
                    }
                }
            }
        }
        return root;
    }

    public static String toJsonString(Plan plan) {
        try {
            return MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(toJson(plan));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize plan '" + plan.title() + "'", e);
        }
    }

    public static Plan fromString(String json) throws IOException {
        return fromJson(MAPPER.readTree(json));
    }

    public static Plan fromJson(JsonNode root) {
        String goal = text(root, "goal", "maintenance");
        JsonNode macroNode = root.get("macro_targets");
        MacroTargets macros = macroNode != null && macroNode.isObject()
            ? new MacroTargets(macroNode.path("protein").asDouble(), macroNode.path("carbs").asDouble(),
                macroNode.path("fat").asDouble())
            : MacroTargets.forGoal(goal);

        var days = new ArrayList<Day>();
        for (JsonNode dayNode : root.path("days")) {
            days.add(parseDay(dayNode));
        }
        return new Plan(
            text(root, "meal_plan_title", null),
            text(root, "user_email", null),
            root.path("base_daily_calories").asInt(0),
            goal,
            macros,
            days);
    }

    private static Day parseDay(JsonNode node) {
        var meals = new ArrayList<MealSlot>();
        for (JsonNode mealNode : node.path("meals")) {
            var parts = new ArrayList<PartSlot>();
            for (JsonNode partNode : mealNode.path("parts")) {
                parts.add(new PartSlot(text(partNode, "name", ""), recipeId(partNode.get("selected_recipe_id"))));
            }
            meals.add(new MealSlot(text(mealNode, "meal_type", ""),
                mealNode.path("allocated_calories_for_meal").asInt(0), parts));
        }
        return new Day(parseDate(text(node, "date", null)), text(node, "day_type", ""),
            node.path("target_calories_for_day").asInt(0), List.copyOf(meals));
    }

    private static LocalDate parseDate(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return LocalDate.parse(value.trim());
        } catch (DateTimeParseException e) {
            log.warn("Invalid date '{}' in plan, leaving it unset", value);
            return null;
        }
    }

    private static Long recipeId(JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        if (node.canConvertToLong() && node.isIntegralNumber()) {
            return node.asLong();
        }
        if (node.isTextual()) {
            try {
                return Long.parseLong(node.asText().trim());
            } catch (NumberFormatException e) {
                log.warn("Non-numeric recipe id '{}' treated as unselected", node.asText());
                return null;
            }
        }
        log.warn("Unsupported recipe id {} treated as unselected", node);
        return null;
    }

    private static String text(JsonNode node, String field, String fallback) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? fallback : value.asText();
    }
}
