package com.taskweave.core.engine;

import com.taskweave.core.TaskweaveException;
import com.taskweave.core.metrics.TaskweaveMetrics;
import com.taskweave.core.model.Task;
import com.taskweave.core.model.TaskState;
import com.taskweave.core.tasks.DuplicateTaskException;
import com.taskweave.core.tasks.TaskManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Optional;

/**
 * Background loop feeding the priority queues into the {@link Orchestrator}.
 * <p>
 * While a worker slot is free the head of the highest non-empty queue is
 * submitted; otherwise the loop sleeps for the poll interval. Tasks whose agent
 * is not registered are failed without retry.
 */
public class TaskDispatcher {

    private static final Logger log = LoggerFactory.getLogger(TaskDispatcher.class);

    private static final long JOIN_MILLIS = 5_000;

    private final TaskManager taskManager;
    private final Orchestrator orchestrator;
    private final TaskweaveMetrics metrics;
    private final Duration pollInterval;

    private volatile boolean running;
    private Thread loop;

    public TaskDispatcher(TaskManager taskManager, Orchestrator orchestrator, TaskweaveMetrics metrics,
                          Duration pollInterval) {
        this.taskManager = taskManager;
        this.orchestrator = orchestrator;
        this.metrics = metrics;
        this.pollInterval = pollInterval;
    }

    public synchronized void start() {
        if (running) {
            return;
        }
        running = true;
        loop = new Thread(this::runLoop, "taskweave-dispatcher");
        loop.setDaemon(true);
        loop.start();
        log.info("Task dispatcher started (poll every {}ms)", pollInterval.toMillis());
    }

    public synchronized void stop() {
        if (!running) {
            return;
        }
        running = false;
        Thread t = loop;
        loop = null;
        t.interrupt();
        try {
            t.join(JOIN_MILLIS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        log.info("Task dispatcher stopped");
    }

    public boolean isRunning() {
        return running;
    }

    /**
     * Submit ready tasks until the queues are empty, no worker slot is free or a
     * submission fails.
     *
     * @return number of tasks handed to the orchestrator
     */
    public int dispatchReady() {
        int dispatched = 0;
        while (orchestrator.availableSlots() > 0) {
            Optional<Task> next = taskManager.nextReady();
            if (next.isEmpty()) {
                break;
            }
            if (!dispatch(next.get())) {
                break;
            }
            dispatched++;
        }
        return dispatched;
    }

    private boolean dispatch(Task task) {
        try {
            orchestrator.submitDequeued(task);
            if (metrics != null) {
                metrics.recordDispatch(task.priorityClass().name());
            }
            return true;
        } catch (AgentNotFoundException e) {
            log.error("Task {} targets unregistered agent {}, failing it", task.id(), task.agentId());
            taskManager.abandon(task.id(), e.getMessage());
        } catch (DuplicateTaskException e) {
            log.warn("Task {} is already executing", task.id());
        } catch (IllegalStateException e) {
            log.warn("Orchestrator refused task {}: {}", task.id(), e.getMessage());
            requeue(task);
        } catch (TaskweaveException e) {
            log.error("Could not dispatch task {}: {}", task.id(), e.getMessage());
            requeue(task);
        }
        return false;
    }

    private void requeue(Task task) {
        taskManager.get(task.id())
                .filter(t -> t.state() == TaskState.RUNNING)
                .ifPresent(t -> taskManager.updateState(t.id(), TaskState.PENDING, null));
    }

    private void runLoop() {
        while (running) {
            try {
                if (dispatchReady() == 0) {
                    Thread.sleep(pollInterval.toMillis());
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            } catch (RuntimeException e) {
                log.error("Dispatch loop error: {}", e.getMessage(), e);
                sleepQuietly();
            }
        }
    }

    private void sleepQuietly() {
        try {
            Thread.sleep(pollInterval.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            running = false;
        }
    }
}
