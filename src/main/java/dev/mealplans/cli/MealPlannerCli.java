package dev.mealplans.cli;

import picocli.CommandLine;
import picocli.CommandLine.Command;

/**
 * CLI entry point for meal-planner.
 */
@Command(
    name = "meal-planner",
    mixinStandardHelpOptions = true,
    description = "Generate, validate and repair 3-day meal plans.",
    subcommands = {GenerateCommand.class, OptimizeCommand.class}
)
public class MealPlannerCli implements Runnable {

    static final int EXIT_INPUT_ERROR = 1;
    static final int EXIT_GENERATION_FAILED = 2;

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @Override
    public void run() {
        throw new CommandLine.ParameterException(spec.commandLine(), "Missing subcommand: generate or optimize");
    }

    public static CommandLine commandLine() {
        var commandLine = new CommandLine(new MealPlannerCli());
        commandLine.setParameterExceptionHandler((ex, args) -> {
            CommandLine failed = ex.getCommandLine();
            failed.getErr().println(ex.getMessage());
            failed.usage(failed.getErr());
            return EXIT_INPUT_ERROR;
        });
        return commandLine;
    }
}
