package com.taskweave.dispatch.cli;

import com.taskweave.config.TaskweaveProperties;
import com.taskweave.core.tasks.TaskManager;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.time.Duration;
import java.time.Instant;

/**
 * CLI command: taskweave cleanup [--older-than-days N]
 * <p>
 * Deletes COMPLETED and CANCELLED tasks last updated before the cutoff.
 */
@Command(name = "cleanup", mixinStandardHelpOptions = true, description = "Remove old finished tasks")
@Component
public class CleanupCommand implements Runnable {

    @Option(names = {"--older-than-days", "-d"}, description = "Age cutoff in days (default: configured retention)")
    private Integer olderThanDays;

    private final TaskManager taskManager;
    private final TaskweaveProperties properties;

    public CleanupCommand(TaskManager taskManager, TaskweaveProperties properties) {
        this.taskManager = taskManager;
        this.properties = properties;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        Duration age = olderThanDays != null ? Duration.ofDays(olderThanDays) : properties.getRetention();
        taskManager.load();
        int removed = taskManager.cleanup(Instant.now().minus(age));
        ConsoleOutput.success("Removed " + removed + " finished task" + (removed != 1 ? "s" : "")
                + " older than " + age.toDays() + " days");
    }
}
