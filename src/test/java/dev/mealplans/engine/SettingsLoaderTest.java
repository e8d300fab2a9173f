package dev.mealplans.engine;

import dev.mealplans.model.PlannerSettings;
import dev.mealplans.model.UserProfile;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SettingsLoaderTest {

    @Test
    void emptyObjectGivesDefaults() throws Exception {
        assertThat(SettingsLoader.loadFromString("{}")).isEqualTo(PlannerSettings.defaults());
    }

    @Test
    void overridesOnlyGivenFields() throws Exception {
        PlannerSettings settings = SettingsLoader.loadFromString("""
            {"minimumCandidates": 12, "draftTimeoutSeconds": 30, "model": "mistral", "seed": 99}
            """);

        assertThat(settings.minimumCandidates()).isEqualTo(12);
        assertThat(settings.draftTimeout()).isEqualTo(Duration.ofSeconds(30));
        assertThat(settings.model()).isEqualTo("mistral");
        assertThat(settings.seed()).isEqualTo(99L);
        assertThat(settings.calorieTolerance()).isEqualTo(PlannerSettings.DEFAULT_CALORIE_TOLERANCE);
        assertThat(settings.activityUplift()).isEqualTo(PlannerSettings.DEFAULT_ACTIVITY_UPLIFT);
    }

    @Test
    void rejectsToleranceOutOfRange() {
        assertThatThrownBy(() -> SettingsLoader.loadFromString("{\"calorieTolerance\": 1.5}"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("calorieTolerance");
    }

    @Test
    void activityUpliftAppliesToActiveUsers() {
        var settings = PlannerSettings.defaults();
        var active = new UserProfile("a@b.c", null, "High", null);

        assertThat(settings.adjustedBase(2000, active)).isEqualTo(2200);
        assertThat(settings.adjustedBase(2000, PlanFixtures.USER)).isEqualTo(2000);
        assertThat(settings.adjustedBase(2000, null)).isEqualTo(2000);
    }
}
