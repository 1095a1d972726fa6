package com.taskweave.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/**
 * Top-level CLI command for Taskweave.
 */
@Command(
        name = "taskweave",
        mixinStandardHelpOptions = true,
        version = "Taskweave 0.1.0",
        description = "Task orchestration core: priority queues, agents, schedules and events",
        subcommands = {
                SubmitCommand.class,
                ListCommand.class,
                InspectCommand.class,
                QueuesCommand.class,
                CleanupCommand.class,
                ServeCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class TaskweaveCommand implements Runnable {

    @Spec
    private CommandSpec spec;

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        // When no subcommand is given, show usage help
        spec.commandLine().usage(System.out);
    }
}
