package com.taskweave.core.engine;

import com.taskweave.core.TaskweaveException;
import com.taskweave.core.events.Event;
import com.taskweave.core.events.EventBus;
import com.taskweave.core.events.EventPriority;
import com.taskweave.core.events.EventTypes;
import com.taskweave.core.events.QueueFullException;
import com.taskweave.core.logging.MdcContext;
import com.taskweave.core.metrics.TaskweaveMetrics;
import com.taskweave.core.model.Task;
import com.taskweave.core.model.TaskState;
import com.taskweave.core.scheduler.ExecutionGateway;
import com.taskweave.core.tasks.DuplicateTaskException;
import com.taskweave.core.tasks.IllegalTaskStateException;
import com.taskweave.core.tasks.TaskManager;
import com.taskweave.core.tasks.TaskNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs tasks on registered agents using a fixed pool of worker threads.
 * <p>
 * {@link #submit(Task)} validates the task, marks it QUEUED and returns at once.
 * A worker then marks it RUNNING, invokes the agent (bounded by the agent's timeout
 * when one applies), records the outcome through {@link TaskManager#updateState}
 * and publishes {@code task_completed} or {@code task_failed}. Failures with retries
 * left go back to their priority queue, where the {@link TaskDispatcher} picks them
 * up again.
 */
public class Orchestrator implements ExecutionGateway {

    private static final Logger log = LoggerFactory.getLogger(Orchestrator.class);

    public static final int DEFAULT_WORKERS = 5;

    private static final String SOURCE = "orchestrator";
    private static final long SHUTDOWN_POLL_SECONDS = 30;

    private final TaskManager taskManager;
    private final EventBus eventBus;
    private final TaskweaveMetrics metrics;
    private final Clock clock;
    private final Duration defaultTimeout;
    private final int workers;

    private final ThreadPoolExecutor pool;
    private final ExecutorService timeoutPool;

    private final ConcurrentHashMap<String, RegisteredAgent> agents = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Execution> executions = new ConcurrentHashMap<>();
    private final AtomicInteger inFlight = new AtomicInteger();

    private volatile boolean shutdown;

    public Orchestrator(TaskManager taskManager, EventBus eventBus) {
        this(taskManager, eventBus, null, Clock.systemUTC(), DEFAULT_WORKERS, null);
    }

    /**
     * @param defaultTimeout timeout for agents registered without one; null or zero for none
     */
    public Orchestrator(TaskManager taskManager, EventBus eventBus, TaskweaveMetrics metrics, Clock clock,
                        int workers, Duration defaultTimeout) {
        if (workers <= 0) {
            throw new IllegalArgumentException("workers must be positive: " + workers);
        }
        this.taskManager = taskManager;
        this.eventBus = eventBus;
        this.metrics = metrics;
        this.clock = clock;
        this.workers = workers;
        this.defaultTimeout = defaultTimeout;
        this.pool = new ThreadPoolExecutor(workers, workers, 0L, TimeUnit.MILLISECONDS,
                new LinkedBlockingQueue<>(), namedThreads("taskweave-worker-"));
        this.timeoutPool = Executors.newCachedThreadPool(namedThreads("taskweave-agent-"));
    }

    // -- agents ---------------------------------------------------------------

    public void register(String agentId, Agent agent) {
        register(agentId, agent, null);
    }

    /**
     * Register or replace an agent.
     *
     * @param timeout per-agent execution timeout; null to use the default
     */
    public void register(String agentId, Agent agent, Duration timeout) {
        agents.put(agentId, new RegisteredAgent(agentId, agent, timeout));
        log.info("Registered agent {}{}", agentId, timeout != null ? " (timeout " + timeout + ")" : "");
    }

    /**
     * Remove an agent. Executions already handed to it run to completion.
     *
     * @return whether the agent was registered
     */
    public boolean unregister(String agentId) {
        boolean removed = agents.remove(agentId) != null;
        if (removed) {
            log.info("Unregistered agent {}", agentId);
        }
        return removed;
    }

    public boolean isRegistered(String agentId) {
        return agents.containsKey(agentId);
    }

    public List<AgentStatus> agentStatus() {
        return agents.values().stream()
                .map(a -> new AgentStatus(a.agentId, a.timeout, a.completed.get(), a.failed.get(), a.lastActivity))
                .toList();
    }

    // -- submission -----------------------------------------------------------

    /**
     * Hand a task to the worker pool.
     * <p>
     * A task the {@link TaskDispatcher} took from its queue between creation and this
     * call is already executing on its behalf; the first such submit returns normally
     * without starting a second execution.
     *
     * @throws AgentNotFoundException  if the task's agent is not registered
     * @throws DuplicateTaskException  if an execution of this task is still in flight
     * @throws TaskNotFoundException   if the task manager does not know the task
     * @throws IllegalTaskStateException if the task already finished
     * @throws IllegalStateException   after {@link #shutdown(boolean)}
     */
    @Override
    public void submit(Task task) {
        submit(task, false);
    }

    /**
     * Submit a task the dispatcher dequeued through {@link TaskManager#nextReady()}.
     */
    void submitDequeued(Task task) {
        submit(task, true);
    }

    private void submit(Task task, boolean dequeued) {
        if (shutdown) {
            throw new IllegalStateException("Orchestrator is shut down");
        }
        String taskId = task.id();
        RegisteredAgent agent = agents.get(task.agentId());
        if (agent == null) {
            throw new AgentNotFoundException(task.agentId());
        }
        if (taskManager.get(taskId).isEmpty()) {
            throw new TaskNotFoundException(taskId);
        }

        Execution execution = new Execution(taskId, agent, clock.instant(), dequeued);
        Execution[] replaced = new Execution[1];
        Execution tracked = executions.compute(taskId, (id, prior) -> {
            if (prior != null && !dequeued && prior.dequeued && !prior.adopted) {
                prior.adopted = true;
                return prior;
            }
            if (prior != null && !prior.isFinished()) {
                throw new DuplicateTaskException(id);
            }
            replaced[0] = prior;
            return execution;
        });
        if (tracked != execution) {
            log.debug("Task {} was already taken from its queue by the dispatcher", taskId);
            return;
        }

        try {
            taskManager.acceptForDispatch(taskId);
        } catch (TaskweaveException e) {
            if (replaced[0] != null) {
                executions.replace(taskId, execution, replaced[0]);
            } else {
                executions.remove(taskId, execution);
            }
            throw e;
        }

        inFlight.incrementAndGet();
        synchronized (execution) {
            try {
                execution.future = pool.submit(() -> run(execution));
            } catch (RejectedExecutionException e) {
                inFlight.decrementAndGet();
                executions.remove(taskId, execution);
                revertToPending(taskId);
                throw new IllegalStateException("Worker pool rejected task " + taskId, e);
            }
        }

        log.info("Submitted task {} to agent {}", taskId, task.agentId());
        Map<String, Object> data = new HashMap<>();
        data.put("task_id", taskId);
        data.put("agent_id", task.agentId());
        data.put("priority", task.priority());
        publishQuietly(Event.of(EventTypes.TASK_SUBMITTED, data, EventPriority.LOW, SOURCE));
    }

    /**
     * Latest execution status of a task submitted to this orchestrator.
     */
    public ExecutionStatus status(String taskId) {
        Execution execution = executions.get(taskId);
        if (execution == null) {
            return ExecutionStatus.notFound(taskId);
        }
        return execution.toStatus();
    }

    public List<ExecutionStatus> trackedTasks() {
        List<ExecutionStatus> statuses = new ArrayList<>();
        executions.values().forEach(e -> statuses.add(e.toStatus()));
        return statuses;
    }

    /**
     * Cancel an execution that no worker has started yet.
     *
     * @return false when the task is unknown, already started or finished
     */
    public boolean cancel(String taskId) {
        Execution execution = executions.get(taskId);
        if (execution == null) {
            return false;
        }
        synchronized (execution) {
            if (execution.started || execution.isFinished()) {
                return false;
            }
            try {
                taskManager.cancel(taskId);
            } catch (IllegalTaskStateException | TaskNotFoundException e) {
                log.debug("Task {} cannot be cancelled: {}", taskId, e.getMessage());
                return false;
            }
            execution.cancelled = true;
            if (execution.future != null && execution.future.cancel(false)) {
                inFlight.decrementAndGet();
            }
        }
        executions.remove(taskId, execution);
        log.info("Cancelled task {} before execution", taskId);
        publishQuietly(Event.of(EventTypes.TASK_CANCELLED, Map.of("task_id", taskId),
                EventPriority.NORMAL, SOURCE));
        return true;
    }

    /**
     * Worker threads not occupied by an unfinished execution.
     */
    public int availableSlots() {
        return shutdown ? 0 : Math.max(0, workers - inFlight.get());
    }

    @Override
    public boolean isReachable() {
        return !shutdown && !agents.isEmpty();
    }

    public boolean isShutdown() {
        return shutdown;
    }

    /**
     * Stop accepting submissions. With {@code wait} the call blocks until every
     * accepted execution finished; without it queued executions are dropped and
     * running agents interrupted. Tracking is cleared either way.
     */
    public void shutdown(boolean wait) {
        if (shutdown) {
            return;
        }
        shutdown = true;
        log.info("Shutting down orchestrator (wait={}, {} in flight)", wait, inFlight.get());
        if (wait) {
            pool.shutdown();
            try {
                while (!pool.awaitTermination(SHUTDOWN_POLL_SECONDS, TimeUnit.SECONDS)) {
                    log.info("Waiting for {} executions to finish", inFlight.get());
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                pool.shutdownNow();
            }
        } else {
            pool.shutdownNow();
        }
        timeoutPool.shutdownNow();
        executions.clear();
        log.info("Orchestrator stopped");
    }

    // -- worker ---------------------------------------------------------------

    private void run(Execution execution) {
        String taskId = execution.taskId;
        RegisteredAgent agent = execution.agent;
        MdcContext.setTask(taskId, agent.agentId);
        try {
            synchronized (execution) {
                if (execution.cancelled) {
                    return;
                }
                execution.started = true;
            }
            Task task = taskManager.beginExecution(taskId).orElse(null);
            if (task == null) {
                log.info("Task {} is no longer runnable, skipping", taskId);
                executions.remove(taskId, execution);
                return;
            }
            execution.startedAt = clock.instant();
            log.info("Executing task {} on agent {}", taskId, agent.agentId);

            long startNanos = System.nanoTime();
            AgentResult result = invoke(agent, task);
            long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
            if (metrics != null) {
                metrics.recordExecution(agent.agentId, elapsedMs);
            }

            if (result.success()) {
                taskManager.updateState(taskId, TaskState.COMPLETED, null);
                execution.complete(result.result());
                agent.completed.incrementAndGet();
                agent.lastActivity = clock.instant();
                recordOutcome(agent.agentId, "completed");
                log.info("Task {} completed in {}ms", taskId, elapsedMs);

                Map<String, Object> data = new HashMap<>();
                data.put("task_id", taskId);
                data.put("agent_id", agent.agentId);
                data.put("duration_ms", elapsedMs);
                publishQuietly(Event.of(EventTypes.TASK_COMPLETED, data, EventPriority.NORMAL, SOURCE));
            } else {
                // finish tracking first, a retry may be resubmitted as soon as it is re-enqueued
                execution.fail(result.error());
                Task after = taskManager.updateState(taskId, TaskState.FAILED, result.error());
                boolean willRetry = after.state() == TaskState.PENDING;
                agent.failed.incrementAndGet();
                agent.lastActivity = clock.instant();
                recordOutcome(agent.agentId, willRetry ? "retried" : "failed");
                log.warn("Task {} failed after {}ms: {}", taskId, elapsedMs, result.error());

                Map<String, Object> data = new HashMap<>();
                data.put("task_id", taskId);
                data.put("agent_id", agent.agentId);
                data.put("error", result.error());
                data.put("will_retry", willRetry);
                data.put("retries", after.metadata().retries());
                publishQuietly(Event.of(EventTypes.TASK_FAILED, data, EventPriority.HIGH, SOURCE));
            }
        } catch (TaskweaveException e) {
            log.error("Could not record outcome of task {}: {}", taskId, e.getMessage(), e);
            execution.fail(e.getMessage());
        } finally {
            inFlight.decrementAndGet();
            MdcContext.clear();
        }
    }

    private AgentResult invoke(RegisteredAgent agent, Task task) {
        Duration timeout = agent.timeout != null ? agent.timeout : defaultTimeout;
        if (timeout == null || timeout.isZero() || timeout.isNegative()) {
            return safeExecute(agent, task);
        }
        Future<AgentResult> future = timeoutPool.submit(() -> safeExecute(agent, task));
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            recordOutcome(agent.agentId, "timeout");
            return AgentResult.failure("Agent " + agent.agentId + " timed out after " + timeout.toMillis() + "ms");
        } catch (ExecutionException e) {
            return AgentResult.failure(describe(e.getCause()));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            return AgentResult.failure("Interrupted while waiting for agent " + agent.agentId);
        }
    }

    private static AgentResult safeExecute(RegisteredAgent agent, Task task) {
        try {
            AgentResult result = agent.agent.execute(task.payload());
            return result != null ? result : AgentResult.failure("Agent " + agent.agentId + " returned no result");
        } catch (VirtualMachineError e) {
            throw e;
        } catch (Throwable e) {
            log.warn("Agent {} threw while executing task {}: {}", agent.agentId, task.id(), e.getMessage());
            return AgentResult.failure(describe(e));
        }
    }

    private void revertToPending(String taskId) {
        try {
            taskManager.updateState(taskId, TaskState.PENDING, null);
        } catch (TaskweaveException e) {
            log.error("Could not return task {} to its queue: {}", taskId, e.getMessage());
        }
    }

    private void recordOutcome(String agentId, String outcome) {
        if (metrics != null) {
            metrics.recordOutcome(agentId, outcome);
        }
    }

    private void publishQuietly(Event event) {
        if (eventBus == null) {
            return;
        }
        try {
            eventBus.publish(event);
        } catch (QueueFullException e) {
            log.warn("Dropped {} event: {}", event.type(), e.getMessage());
        }
    }

    private static String describe(Throwable t) {
        if (t == null) return "unknown error";
        return t.getMessage() != null ? t.getMessage() : t.getClass().getSimpleName();
    }

    private static ThreadFactory namedThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }

    private static final class RegisteredAgent {
        final String agentId;
        final Agent agent;
        final Duration timeout;
        final AtomicInteger completed = new AtomicInteger();
        final AtomicInteger failed = new AtomicInteger();
        volatile Instant lastActivity;

        RegisteredAgent(String agentId, Agent agent, Duration timeout) {
            this.agentId = agentId;
            this.agent = agent;
            this.timeout = timeout;
        }
    }

    /**
     * Tracking entry for one submission. {@code started}, {@code cancelled} and
     * {@code future} are guarded by the entry's monitor; {@code adopted} only
     * changes inside {@code executions.compute}.
     */
    private static final class Execution {
        final String taskId;
        final RegisteredAgent agent;
        final Instant submittedAt;
        final boolean dequeued;

        Future<?> future;
        boolean started;
        boolean cancelled;
        boolean adopted;

        volatile Instant startedAt;
        private volatile ExecutionStatus outcome;

        Execution(String taskId, RegisteredAgent agent, Instant submittedAt, boolean dequeued) {
            this.taskId = taskId;
            this.agent = agent;
            this.submittedAt = submittedAt;
            this.dequeued = dequeued;
        }

        boolean isFinished() {
            return outcome != null;
        }

        void complete(Object result) {
            outcome = ExecutionStatus.completed(taskId, result);
        }

        void fail(String error) {
            outcome = ExecutionStatus.failed(taskId, error);
        }

        ExecutionStatus toStatus() {
            ExecutionStatus done = outcome;
            if (done != null) {
                return done;
            }
            Map<String, Object> context = new HashMap<>();
            context.put("agent_id", agent.agentId);
            context.put("submitted_at", submittedAt);
            Instant started = startedAt;
            context.put("started", started != null);
            if (started != null) {
                context.put("started_at", started);
            }
            return ExecutionStatus.running(taskId, context);
        }
    }
}
