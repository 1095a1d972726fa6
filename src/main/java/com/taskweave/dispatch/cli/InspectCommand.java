package com.taskweave.dispatch.cli;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.taskweave.core.model.Task;
import com.taskweave.core.store.TaskJson;
import com.taskweave.core.store.TaskStore;
import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

/**
 * CLI command: taskweave inspect &lt;task-id&gt;
 * <p>
 * Shows the persisted record of one task, including its payload and last error.
 */
@Command(name = "inspect", mixinStandardHelpOptions = true, description = "Inspect a task")
@Component
public class InspectCommand implements Runnable {

    private static final ObjectMapper MAPPER = TaskJson.newMapper();

    @Parameters(index = "0", description = "Task ID")
    private String taskId;

    private final TaskStore taskStore;

    public InspectCommand(TaskStore taskStore) {
        this.taskStore = taskStore;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();

        var found = taskStore.get(taskId);
        if (found.isEmpty()) {
            ConsoleOutput.error("Task not found: " + taskId);
            return;
        }
        Task task = found.get();
        var meta = task.metadata();

        System.out.println();
        System.out.println("TASK " + task.id());
        System.out.println("──────────────────────────────────");
        System.out.println(CommandLine.Help.Ansi.AUTO.string("  State:       " + ConsoleOutput.stateLabel(task.state())));
        System.out.println("  Agent:       " + task.agentId());
        System.out.println("  Priority:    " + task.priority() + " (" + task.priorityClass() + ")");
        System.out.println("  Retries:     " + meta.retries() + " / " + meta.maxRetries());
        System.out.println("  Created:     " + meta.createdAt());
        System.out.println("  Updated:     " + meta.updatedAt());
        System.out.println("  Last error:  " + (meta.lastError() != null ? meta.lastError() : "-"));
        System.out.println();
        System.out.println("  PAYLOAD:");
        System.out.println("  " + prettyPayload(task));
    }

    private static String prettyPayload(Task task) {
        try {
            return MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(task.payload())
                    .replace("\n", "\n  ");
        } catch (JsonProcessingException e) {
            return String.valueOf(task.payload());
        }
    }
}
