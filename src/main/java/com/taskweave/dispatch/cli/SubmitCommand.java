package com.taskweave.dispatch.cli;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.taskweave.core.TaskweaveException;
import com.taskweave.core.engine.ExecutionStatus;
import com.taskweave.core.engine.TaskweaveRuntime;
import com.taskweave.core.model.Task;
import com.taskweave.core.store.TaskJson;
import com.taskweave.core.tasks.TaskManager;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * CLI command: taskweave submit &lt;task-id&gt; [--agent echo] [--priority 1] [--payload '{...}'] [--wait]
 * <p>
 * Persists a new PENDING task. With {@code --wait} the runtime is started in
 * process and the command blocks until the task reaches a terminal state.
 */
@Command(name = "submit", mixinStandardHelpOptions = true, description = "Create a task")
@Component
public class SubmitCommand implements Callable<Integer> {

    private static final ObjectMapper MAPPER = TaskJson.newMapper();
    private static final long POLL_MILLIS = 100;

    @Parameters(index = "0", description = "Task ID")
    private String taskId;

    @Option(names = {"--agent", "-a"}, description = "Agent ID (default: ${DEFAULT-VALUE})", defaultValue = "echo")
    private String agentId;

    @Option(names = {"--priority", "-p"}, description = "Priority, >1 HIGH, 1 MEDIUM, <1 LOW (default: ${DEFAULT-VALUE})",
            defaultValue = "1")
    private int priority;

    @Option(names = {"--payload"}, description = "JSON object passed to the agent (default: ${DEFAULT-VALUE})",
            defaultValue = "{}")
    private String payload;

    @Option(names = {"--max-retries"}, description = "Retry budget (default: configured value)")
    private Integer maxRetries;

    @Option(names = {"--wait", "-w"}, description = "Run the task in process and wait for its outcome")
    private boolean wait;

    @Option(names = {"--timeout"}, description = "Seconds to wait with --wait (default: ${DEFAULT-VALUE})",
            defaultValue = "30")
    private int timeoutSeconds;

    private final TaskweaveRuntime runtime;

    public SubmitCommand(TaskweaveRuntime runtime) {
        this.runtime = runtime;
    }

    @Override
    public Integer call() {
        Map<String, Object> parsed;
        try {
            parsed = MAPPER.readValue(payload, new TypeReference<Map<String, Object>>() {});
        } catch (JsonProcessingException e) {
            ConsoleOutput.error("Payload is not a JSON object: " + e.getOriginalMessage());
            return 2;
        }

        TaskManager taskManager = runtime.taskManager();
        Task task;
        try {
            task = maxRetries != null
                    ? taskManager.create(taskId, parsed, agentId, priority, maxRetries)
                    : taskManager.create(taskId, parsed, agentId, priority);
        } catch (TaskweaveException e) {
            ConsoleOutput.error(e.getMessage());
            return 1;
        }
        ConsoleOutput.success("Created task " + task.id() + " for agent " + task.agentId()
                + " (" + task.priorityClass() + " queue)");

        if (!wait) {
            return 0;
        }
        return runAndWait(task.id());
    }

    private int runAndWait(String id) {
        runtime.start();
        try {
            Instant deadline = Instant.now().plus(Duration.ofSeconds(timeoutSeconds));
            while (Instant.now().isBefore(deadline)) {
                Task current = runtime.taskManager().get(id).orElse(null);
                if (current != null && current.state().isTerminal() && !stillTracked(id)) {
                    return report(current);
                }
                Thread.sleep(POLL_MILLIS);
            }
            ConsoleOutput.error("Task " + id + " did not finish within " + timeoutSeconds + "s");
            return 1;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            ConsoleOutput.error("Interrupted while waiting for task " + id);
            return 1;
        } finally {
            runtime.stop();
        }
    }

    // the orchestrator records the result just after the state change
    private boolean stillTracked(String id) {
        return runtime.orchestrator().status(id).phase() == ExecutionStatus.Phase.RUNNING;
    }

    private int report(Task task) {
        ExecutionStatus status = runtime.orchestrator().status(task.id());
        switch (task.state()) {
            case COMPLETED -> {
                ConsoleOutput.success("Task " + task.id() + " completed");
                if (status.result() != null) {
                    System.out.println("  Result: " + toJson(status.result()));
                }
                return 0;
            }
            case FAILED -> {
                ConsoleOutput.error("Task " + task.id() + " failed after " + task.metadata().retries()
                        + " retries: " + task.metadata().lastError());
                return 1;
            }
            default -> {
                ConsoleOutput.info("Task " + task.id() + " is " + task.state());
                return 1;
            }
        }
    }

    private static String toJson(Object value) {
        try {
            return MAPPER.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            return String.valueOf(value);
        }
    }
}
