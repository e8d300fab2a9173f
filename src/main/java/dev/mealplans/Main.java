package dev.mealplans;

import dev.mealplans.cli.MealPlannerCli;

public class Main {
    public static void main(String[] args) {
        int exitCode = MealPlannerCli.commandLine().execute(args);
        System.exit(exitCode);
    }
}
