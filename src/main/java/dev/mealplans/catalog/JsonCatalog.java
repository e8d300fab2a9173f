package dev.mealplans.catalog;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.mealplans.model.CandidatePool;
import dev.mealplans.model.CandidateRecipe;
import dev.mealplans.model.UserFeedback;
import dev.mealplans.model.UserProfile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Recipes, users and feedback read from a single JSON catalog file.
 */
public final class JsonCatalog implements CandidatePoolProvider, FeedbackProvider {

    private static final Logger log = LoggerFactory.getLogger(JsonCatalog.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final List<CandidateRecipe> recipes;
    private final Map<String, UserProfile> users;
    private final Map<String, Map<Long, UserFeedback>> feedbackByUser;

    JsonCatalog(List<CandidateRecipe> recipes, Map<String, UserProfile> users,
                Map<String, Map<Long, UserFeedback>> feedbackByUser) {
        this.recipes = List.copyOf(recipes);
        this.users = Map.copyOf(users);
        this.feedbackByUser = Map.copyOf(feedbackByUser);
    }

    public static JsonCatalog loadFromFile(Path path) throws IOException {
        JsonNode root = MAPPER.readTree(path.toFile());
        return parseCatalog(root);
    }

    public static JsonCatalog loadFromString(String json) throws IOException {
        JsonNode root = MAPPER.readTree(json);
        return parseCatalog(root);
    }

    public List<CandidateRecipe> recipes() {
        return recipes;
    }

    public Optional<UserProfile> findUser(String email) {
        return email == null ? Optional.empty() : Optional.ofNullable(users.get(key(email)));
    }

    @Override
    public CandidatePool candidatesFor(UserProfile user) {
        CandidatePool all = new CandidatePool(recipes);
        CandidatePool pool = user == null ? all : all.forPreferences(user.dietaryPreferences());
        log.debug("Candidate pool for {}: {} of {} recipes", user == null ? "anonymous" : user.email(),
            pool.size(), all.size());
        return pool;
    }

    @Override
    public Map<Long, UserFeedback> feedbackFor(UserProfile user) {
        if (user == null || user.email() == null) {
            return Map.of();
        }
        return feedbackByUser.getOrDefault(key(user.email()), Map.of());
    }

    private static JsonCatalog parseCatalog(JsonNode root) {
        if (root == null || !root.isObject()) {
            throw new IllegalArgumentException("Catalog must be a JSON object");
        }
        var recipes = new ArrayList<CandidateRecipe>();
        for (JsonNode node : root.path("recipes")) {
            recipes.add(parseRecipe(node));
        }

        var users = new LinkedHashMap<String, UserProfile>();
        for (JsonNode node : root.path("users")) {
            UserProfile user = parseUser(node);
            users.put(key(user.email()), user);
        }

        var feedback = new LinkedHashMap<String, Map<Long, UserFeedback>>();
        for (JsonNode node : root.path("feedback")) {
            String email = required(node, "user_email").asText();
            UserFeedback entry = parseFeedback(node);
            feedback.computeIfAbsent(key(email), k -> new LinkedHashMap<>()).put(entry.recipeId(), entry);
        }
        feedback.replaceAll((email, entries) -> Map.copyOf(entries));

        log.info("Loaded catalog: {} recipes, {} users, {} users with feedback",
            recipes.size(), users.size(), feedback.size());
        return new JsonCatalog(recipes, users, feedback);
    }

    private static CandidateRecipe parseRecipe(JsonNode node) {
        Set<String> tags = new LinkedHashSet<>();
        node.path("tags").forEach(t -> tags.add(t.asText()));
        return new CandidateRecipe(
            required(node, "id").asLong(),
            node.path("title").asText(""),
            tags,
            node.path("calories").asDouble(0.0),
            node.path("protein").asDouble(0.0),
            node.path("carbohydrate").asDouble(0.0),
            node.path("fat").asDouble(0.0),
            node.hasNonNull("average_rating") ? node.get("average_rating").asDouble() : null,
            node.hasNonNull("global_cooked_count") ? node.get("global_cooked_count").asInt() : null);
    }

    private static UserProfile parseUser(JsonNode node) {
        Set<String> preferences = new LinkedHashSet<>();
        node.path("dietary_preferences").forEach(p -> preferences.add(p.asText()));
        return new UserProfile(
            required(node, "email").asText(),
            node.hasNonNull("name") ? node.get("name").asText() : null,
            node.hasNonNull("physical_activity") ? node.get("physical_activity").asText() : null,
            preferences);
    }

    private static UserFeedback parseFeedback(JsonNode node) {
        return new UserFeedback(
            required(node, "recipe_id").asLong(),
            node.hasNonNull("rating") ? node.get("rating").asInt() : null,
            node.hasNonNull("liked") ? node.get("liked").asBoolean() : null,
            node.path("cooked_count").asInt(0),
            node.path("skip_count").asInt(0));
    }

    private static JsonNode required(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            throw new IllegalArgumentException("Catalog entry is missing '%s': %s".formatted(field, node));
        }
        return value;
    }

    private static String key(String email) {
        return email.trim().toLowerCase(Locale.ROOT);
    }
}
