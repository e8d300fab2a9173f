package dev.mealplans.engine;

import dev.mealplans.model.DayType;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.entry;

class CalorieAllocatorTest {

    @Test
    void allocatesBaseMealsByWeight() {
        var allocations = CalorieAllocator.allocate(2000, DayType.REGULAR.expectedMealTypes());

        assertThat(allocations).containsExactly(
            entry("breakfast", 500),
            entry("lunch", 700),
            entry("dinner", 600),
            entry("mid_morning", 100),
            entry("mid_afternoon", 100),
            entry("supper", 200));
    }

    @Test
    void workoutMealsGetFivePercent() {
        var allocations = CalorieAllocator.allocate(2400, DayType.WORKOUT.expectedMealTypes());

        assertThat(allocations).containsEntry("pre-workout", 120).containsEntry("post-workout", 120);
        assertThat(allocations).hasSize(8);
    }

    @Test
    void allocationsAreFloored() {
        assertThat(CalorieAllocator.allocate(1999, "breakfast")).isEqualTo(499);
        assertThat(CalorieAllocator.allocate(1999, "supper")).isEqualTo(199);
    }

    @Test
    void unknownMealTypeGetsZero() {
        assertThat(CalorieAllocator.allocate(2000, List.of("brunch", "lunch")))
            .containsEntry("brunch", 0)
            .containsEntry("lunch", 700);
    }

    @Test
    void negativeTargetAllocatesNothing() {
        assertThat(CalorieAllocator.allocate(-500, DayType.REGULAR.expectedMealTypes()).values())
            .containsOnly(0);
    }

    @Test
    void allocationsStayWithinTarget() {
        for (int target : new int[] {1, 7, 150, 1234, 2000, 5321}) {
            for (DayType type : DayType.values()) {
                assertThat(CalorieAllocator.allocate(target, type.expectedMealTypes()).values())
                    .allSatisfy(value -> assertThat(value).isBetween(0, target));
            }
        }
    }
}
