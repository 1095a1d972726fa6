package com.taskweave.dispatch.cli;

import com.taskweave.core.model.Task;
import com.taskweave.core.model.TaskState;
import picocli.CommandLine;

/**
 * ANSI-colored terminal output utilities for the Taskweave CLI.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) TASKWEAVE v0.1.0|@"));
        System.out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [TASKWEAVE]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    public static void taskRow(Task task) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(String.format("  %-28s %s  %-10s %-6s retries %d/%d",
                task.id(), stateLabel(task.state()), task.agentId(), task.priorityClass(),
                task.metadata().retries(), task.metadata().maxRetries())));
    }

    static String stateLabel(TaskState state) {
        String color = switch (state) {
            case COMPLETED -> "fg(green)";
            case FAILED -> "fg(red)";
            case CANCELLED -> "fg(white)";
            case RUNNING, QUEUED -> "fg(blue)";
            case PENDING -> "fg(yellow)";
        };
        return "@|" + color + " " + String.format("%-9s", state.name()) + "|@";
    }
}
