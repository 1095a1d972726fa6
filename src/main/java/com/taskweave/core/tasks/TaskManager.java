package com.taskweave.core.tasks;

import com.taskweave.core.model.PriorityClass;
import com.taskweave.core.model.Task;
import com.taskweave.core.model.TaskState;
import com.taskweave.core.store.TaskStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Owns the lifecycle of every task: creation, the three priority queues,
 * validated state transitions, the automatic retry policy and persistence.
 * <p>
 * One lock guards the task map and the queues. Every mutation is written to the
 * {@link TaskStore} before in-memory state changes, so a storage failure leaves
 * the map and the queues exactly as they were.
 */
public class TaskManager {

    private static final Logger log = LoggerFactory.getLogger(TaskManager.class);

    public static final int DEFAULT_MAX_RETRIES = 3;

    private final TaskStore store;
    private final Clock clock;
    private final int defaultMaxRetries;

    private final Object lock = new Object();
    private final Map<String, Task> tasks = new HashMap<>();
    private final Map<PriorityClass, Deque<String>> queues = new EnumMap<>(PriorityClass.class);

    public TaskManager(TaskStore store) {
        this(store, Clock.systemUTC(), DEFAULT_MAX_RETRIES);
    }

    public TaskManager(TaskStore store, Clock clock, int defaultMaxRetries) {
        this.store = store;
        this.clock = clock;
        this.defaultMaxRetries = defaultMaxRetries;
        for (PriorityClass pc : PriorityClass.values()) {
            queues.put(pc, new ArrayDeque<>());
        }
    }

    public Task create(String id, Map<String, Object> payload, String agentId, int priority) {
        return create(id, payload, agentId, priority, defaultMaxRetries);
    }

    /**
     * Create a task in PENDING and append it to the queue of its priority class.
     *
     * @throws DuplicateTaskException if a task with this id is known or persisted
     */
    public Task create(String id, Map<String, Object> payload, String agentId, int priority, int maxRetries) {
        synchronized (lock) {
            if (tasks.containsKey(id) || store.get(id).isPresent()) {
                throw new DuplicateTaskException(id);
            }
            Task task = Task.newTask(id, payload, agentId, priority, maxRetries, clock.instant());
            store.put(task);
            tasks.put(id, task);
            queues.get(task.priorityClass()).addLast(id);
            log.info("Created task {} for agent {} ({} priority)", id, agentId, task.priorityClass());
            return task;
        }
    }

    /**
     * Pop the head of the highest non-empty queue and mark it RUNNING.
     * At most one caller receives a given task.
     */
    public Optional<Task> nextReady() {
        synchronized (lock) {
            for (PriorityClass pc : PriorityClass.values()) {
                Deque<String> queue = queues.get(pc);
                String id = queue.peekFirst();
                if (id == null) {
                    continue;
                }
                Task running = tasks.get(id).withState(TaskState.RUNNING, clock.instant());
                store.put(running);
                queue.pollFirst();
                tasks.put(id, running);
                log.debug("Dequeued task {} from {} queue", id, pc);
                return Optional.of(running);
            }
            return Optional.empty();
        }
    }

    /**
     * Move a task to {@code newState}. A transition to FAILED that carries an error
     * applies the retry policy: while retries remain the task goes back to PENDING
     * in its original queue with its retry counter incremented.
     *
     * @param error failure message, recorded as {@code last_error} (nullable)
     * @return the task as it stands after the update
     * @throws TaskNotFoundException      if the id is unknown
     * @throws IllegalTaskStateException  if the transition is not allowed
     */
    public Task updateState(String id, TaskState newState, String error) {
        synchronized (lock) {
            Task current = require(id);
            checkTransition(current, newState);
            Instant now = clock.instant();

            if (newState == TaskState.FAILED && error != null) {
                Task failed = current.withMetadata(current.metadata().withError(error, now));
                if (failed.metadata().retriesRemaining()) {
                    Task retry = new Task(failed.id(), failed.payload(), failed.agentId(), failed.priority(),
                            TaskState.PENDING, failed.metadata().withRetry(now));
                    apply(current, retry);
                    log.warn("Task {} failed ({}), retry {}/{}", id, error,
                            retry.metadata().retries(), retry.metadata().maxRetries());
                    return retry;
                }
                Task terminal = new Task(failed.id(), failed.payload(), failed.agentId(), failed.priority(),
                        TaskState.FAILED, failed.metadata());
                apply(current, terminal);
                log.error("Task {} failed permanently after {} retries: {}", id,
                        terminal.metadata().retries(), error);
                return terminal;
            }

            Task updated = current.withState(newState, now);
            if (error != null) {
                updated = updated.withMetadata(updated.metadata().withError(error, now));
            }
            apply(current, updated);
            log.debug("Task {} {} -> {}", id, current.state(), newState);
            return updated;
        }
    }

    /**
     * Cancel a task that has not started yet.
     *
     * @throws IllegalTaskStateException if the task is running or finished
     */
    public Task cancel(String id) {
        synchronized (lock) {
            Task current = require(id);
            if (current.state() != TaskState.PENDING && current.state() != TaskState.QUEUED) {
                throw new IllegalTaskStateException(id, current.state(), TaskState.CANCELLED);
            }
            Task cancelled = current.withState(TaskState.CANCELLED, clock.instant());
            apply(current, cancelled);
            log.info("Cancelled task {}", id);
            return cancelled;
        }
    }

    /**
     * Take a task out of its queue because the worker pool accepted it.
     * Tasks already QUEUED or RUNNING are returned unchanged.
     */
    public Task acceptForDispatch(String id) {
        synchronized (lock) {
            Task current = require(id);
            switch (current.state()) {
                case QUEUED, RUNNING -> {
                    return current;
                }
                case PENDING -> {
                    Task queued = current.withState(TaskState.QUEUED, clock.instant());
                    apply(current, queued);
                    return queued;
                }
                default -> throw new IllegalTaskStateException(id, current.state(), TaskState.QUEUED);
            }
        }
    }

    /**
     * Mark a task RUNNING as a worker picks it up.
     *
     * @return empty if the task vanished, was cancelled or already finished
     */
    public Optional<Task> beginExecution(String id) {
        synchronized (lock) {
            Task current = tasks.get(id);
            if (current == null) {
                return Optional.empty();
            }
            return switch (current.state()) {
                case RUNNING -> Optional.of(current);
                case PENDING, QUEUED -> {
                    Task running = current.withState(TaskState.RUNNING, clock.instant());
                    apply(current, running);
                    yield Optional.of(running);
                }
                default -> Optional.empty();
            };
        }
    }

    /**
     * Fail a running task without consulting the retry policy.
     */
    public Task abandon(String id, String reason) {
        synchronized (lock) {
            Task current = require(id);
            checkTransition(current, TaskState.FAILED);
            Instant now = clock.instant();
            Task failed = current.withState(TaskState.FAILED, now);
            failed = failed.withMetadata(failed.metadata().withError(reason, now));
            apply(current, failed);
            log.warn("Abandoned task {}: {}", id, reason);
            return failed;
        }
    }

    /**
     * Read every persisted task. PENDING tasks, and QUEUED tasks that never started
     * (reset to PENDING), are appended to their queues in creation order. Tasks
     * already known to this manager are skipped, so loading twice is harmless.
     *
     * @return number of tasks re-enqueued
     */
    public int load() {
        synchronized (lock) {
            List<Task> persisted = new ArrayList<>(store.list());
            persisted.sort(Comparator.comparing(t -> t.metadata().createdAt()));
            int enqueued = 0;
            for (Task task : persisted) {
                if (tasks.containsKey(task.id())) {
                    continue;
                }
                Task restored = task;
                if (task.state() == TaskState.QUEUED) {
                    restored = task.withState(TaskState.PENDING, clock.instant());
                    store.put(restored);
                }
                tasks.put(restored.id(), restored);
                if (restored.state() == TaskState.PENDING) {
                    queues.get(restored.priorityClass()).addLast(restored.id());
                    enqueued++;
                }
            }
            log.info("Loaded {} persisted tasks, {} re-enqueued", persisted.size(), enqueued);
            return enqueued;
        }
    }

    /**
     * Remove COMPLETED and CANCELLED tasks last updated before {@code olderThan}
     * from memory and from the store.
     *
     * @return number of tasks removed
     */
    public int cleanup(Instant olderThan) {
        synchronized (lock) {
            List<String> expired = tasks.values().stream()
                    .filter(t -> t.state() == TaskState.COMPLETED || t.state() == TaskState.CANCELLED)
                    .filter(t -> t.metadata().updatedAt().isBefore(olderThan))
                    .map(Task::id)
                    .toList();
            for (String id : expired) {
                store.delete(id);
                tasks.remove(id);
            }
            if (!expired.isEmpty()) {
                log.info("Cleaned up {} finished tasks older than {}", expired.size(), olderThan);
            }
            return expired.size();
        }
    }

    public Optional<Task> get(String id) {
        synchronized (lock) {
            return Optional.ofNullable(tasks.get(id));
        }
    }

    public List<Task> list() {
        synchronized (lock) {
            return List.copyOf(tasks.values());
        }
    }

    public Map<PriorityClass, Integer> queueStatus() {
        synchronized (lock) {
            Map<PriorityClass, Integer> sizes = new EnumMap<>(PriorityClass.class);
            queues.forEach((pc, q) -> sizes.put(pc, q.size()));
            return sizes;
        }
    }

    public int defaultMaxRetries() {
        return defaultMaxRetries;
    }

    private Task require(String id) {
        Task task = tasks.get(id);
        if (task == null) {
            throw new TaskNotFoundException(id);
        }
        return task;
    }

    private static void checkTransition(Task current, TaskState target) {
        if (!current.state().canTransitionTo(target)) {
            throw new IllegalTaskStateException(current.id(), current.state(), target);
        }
    }

    // Caller holds the lock. Persists first; queue membership follows the PENDING state.
    private void apply(Task before, Task after) {
        store.put(after);
        tasks.put(after.id(), after);
        boolean wasQueued = before.state() == TaskState.PENDING;
        boolean nowQueued = after.state() == TaskState.PENDING;
        if (wasQueued && !nowQueued) {
            queues.get(before.priorityClass()).remove(before.id());
        } else if (!wasQueued && nowQueued) {
            queues.get(after.priorityClass()).addLast(after.id());
        }
    }
}
