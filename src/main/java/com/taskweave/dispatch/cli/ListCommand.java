package com.taskweave.dispatch.cli;

import com.taskweave.core.model.Task;
import com.taskweave.core.model.TaskState;
import com.taskweave.core.tasks.TaskManager;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.util.Comparator;
import java.util.List;

/**
 * CLI command: taskweave list [--state PENDING]
 * <p>
 * Lists persisted tasks, oldest first.
 */
@Command(name = "list", mixinStandardHelpOptions = true, description = "List tasks")
@Component
public class ListCommand implements Runnable {

    @Option(names = {"--state", "-s"}, description = "Only show tasks in this state: ${COMPLETION-CANDIDATES}")
    private TaskState state;

    private final TaskManager taskManager;

    public ListCommand(TaskManager taskManager) {
        this.taskManager = taskManager;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        taskManager.load();

        List<Task> tasks = taskManager.list().stream()
                .filter(t -> state == null || t.state() == state)
                .sorted(Comparator.comparing(t -> t.metadata().createdAt()))
                .toList();

        if (tasks.isEmpty()) {
            ConsoleOutput.info(state == null ? "No tasks found." : "No " + state + " tasks found.");
            return;
        }

        System.out.println();
        System.out.println(String.format("  %-28s %-9s  %-10s %-6s %s", "TASK", "STATE", "AGENT", "QUEUE", "RETRIES"));
        for (Task task : tasks) {
            ConsoleOutput.taskRow(task);
        }
        System.out.println();
        ConsoleOutput.info(tasks.size() + " task" + (tasks.size() != 1 ? "s" : ""));
    }
}
