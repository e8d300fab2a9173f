package dev.mealplans.catalog;

import dev.mealplans.model.CandidateRecipe;
import dev.mealplans.model.UserFeedback;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JsonCatalogTest {

    private static final String CATALOG = """
        {
          "recipes": [
            {"id": 1, "title": "Tofu bowl", "tags": ["Vegan", "lunch", "main course"],
             "calories": 520.5, "protein": 25, "carbohydrate": 60, "fat": 18,
             "average_rating": 4.5, "global_cooked_count": 12},
            {"id": 2, "title": "Steak", "tags": ["dinner", "main course"], "calories": 700}
          ],
          "users": [
            {"email": "Ana@Example.com", "name": "Ana", "physical_activity": "high",
             "dietary_preferences": ["vegan"]},
            {"email": "bo@example.com"}
          ],
          "feedback": [
            {"user_email": "ana@example.com", "recipe_id": 1, "rating": 5, "liked": true, "cooked_count": 3}
          ]
        }
        """;

    @Test
    void loadsRecipesWithNutrition() throws Exception {
        JsonCatalog catalog = JsonCatalog.loadFromString(CATALOG);

        assertThat(catalog.recipes()).hasSize(2);
        CandidateRecipe tofu = catalog.recipes().get(0);
        assertThat(tofu.calories()).isEqualTo(520.5);
        assertThat(tofu.hasTag("vegan")).isTrue();
        assertThat(tofu.averageRating()).isEqualTo(4.5);
        assertThat(catalog.recipes().get(1).averageRating()).isNull();
    }

    @Test
    void findsUsersCaseInsensitively() throws Exception {
        JsonCatalog catalog = JsonCatalog.loadFromString(CATALOG);

        var ana = catalog.findUser("ana@example.com").orElseThrow();
        assertThat(ana.isActive()).isTrue();
        assertThat(ana.dietaryPreferences()).containsExactly("vegan");
        assertThat(catalog.findUser("nobody@example.com")).isEmpty();
    }

    @Test
    void poolFollowsDietaryPreferences() throws Exception {
        JsonCatalog catalog = JsonCatalog.loadFromString(CATALOG);

        assertThat(catalog.candidatesFor(catalog.findUser("ana@example.com").orElseThrow()).size()).isEqualTo(1);
        assertThat(catalog.candidatesFor(catalog.findUser("bo@example.com").orElseThrow()).size()).isEqualTo(2);
    }

    @Test
    void feedbackIsKeyedByRecipe() throws Exception {
        JsonCatalog catalog = JsonCatalog.loadFromString(CATALOG);

        var feedback = catalog.feedbackFor(catalog.findUser("ana@example.com").orElseThrow());
        assertThat(feedback).containsOnlyKeys(1L);
        assertThat(feedback.get(1L)).isEqualTo(new UserFeedback(1, 5, true, 3, 0));
        assertThat(catalog.feedbackFor(catalog.findUser("bo@example.com").orElseThrow())).isEmpty();
    }

    @Test
    void rejectsRecipeWithoutId() {
        assertThatThrownBy(() -> JsonCatalog.loadFromString("{\"recipes\": [{\"title\": \"x\"}]}"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("'id'");
    }
}
