package com.taskweave.dispatch.cli;

import com.taskweave.core.model.PriorityClass;
import com.taskweave.core.tasks.TaskManager;
import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;

import java.util.Map;

/**
 * CLI command: taskweave queues
 * <p>
 * Shows how many recovered PENDING tasks wait in each priority queue.
 */
@Command(name = "queues", mixinStandardHelpOptions = true, description = "Show priority queue sizes")
@Component
public class QueuesCommand implements Runnable {

    private final TaskManager taskManager;

    public QueuesCommand(TaskManager taskManager) {
        this.taskManager = taskManager;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        taskManager.load();

        Map<PriorityClass, Integer> sizes = taskManager.queueStatus();
        System.out.println();
        for (PriorityClass pc : PriorityClass.values()) {
            int size = sizes.getOrDefault(pc, 0);
            String color = size > 0 ? "fg(yellow)" : "fg(white)";
            System.out.println(CommandLine.Help.Ansi.AUTO.string(
                    String.format("  %-7s @|%s %d|@", pc, color, size)));
        }
    }
}
