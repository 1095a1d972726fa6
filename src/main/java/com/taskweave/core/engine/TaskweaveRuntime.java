package com.taskweave.core.engine;

import com.taskweave.core.events.EventBus;
import com.taskweave.core.metrics.TaskweaveMetrics;
import com.taskweave.core.scheduler.JobScheduler;
import com.taskweave.core.tasks.TaskManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.TaskScheduler;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ScheduledFuture;

/**
 * Owns the orchestration components and their background threads.
 * <p>
 * {@link #start()} recovers persisted tasks, then starts the event bus, the job
 * scheduler, the dispatcher and the retention sweeper. {@link #stop()} stops them
 * in reverse order and waits for in-flight executions.
 */
public class TaskweaveRuntime {

    private static final Logger log = LoggerFactory.getLogger(TaskweaveRuntime.class);

    private final TaskManager taskManager;
    private final EventBus eventBus;
    private final Orchestrator orchestrator;
    private final JobScheduler jobScheduler;
    private final TaskDispatcher dispatcher;
    private final TaskScheduler taskScheduler;
    private final TaskweaveMetrics metrics;
    private final Clock clock;
    private final Duration retention;
    private final Duration cleanupInterval;

    private ScheduledFuture<?> sweeper;
    private volatile boolean running;

    public TaskweaveRuntime(TaskManager taskManager, EventBus eventBus, Orchestrator orchestrator,
                            JobScheduler jobScheduler, TaskDispatcher dispatcher, TaskScheduler taskScheduler,
                            TaskweaveMetrics metrics, Clock clock, Duration retention, Duration cleanupInterval) {
        this.taskManager = taskManager;
        this.eventBus = eventBus;
        this.orchestrator = orchestrator;
        this.jobScheduler = jobScheduler;
        this.dispatcher = dispatcher;
        this.taskScheduler = taskScheduler;
        this.metrics = metrics;
        this.clock = clock;
        this.retention = retention;
        this.cleanupInterval = cleanupInterval;
    }

    public synchronized void start() {
        if (running) {
            return;
        }
        int recovered = taskManager.load();
        eventBus.start();
        jobScheduler.start();
        dispatcher.start();
        sweeper = taskScheduler.scheduleAtFixedRate(this::sweep, clock.instant().plus(cleanupInterval),
                cleanupInterval);
        running = true;
        log.info("Taskweave runtime started ({} tasks recovered, retention {})", recovered, retention);
    }

    public synchronized void stop() {
        if (!running) {
            return;
        }
        running = false;
        if (sweeper != null) {
            sweeper.cancel(false);
            sweeper = null;
        }
        dispatcher.stop();
        jobScheduler.stop();
        orchestrator.shutdown(true);
        eventBus.stop();
        log.info("Taskweave runtime stopped");
    }

    public boolean isRunning() {
        return running;
    }

    /**
     * Remove finished tasks older than the retention period.
     *
     * @return number of tasks removed
     */
    public int cleanupNow() {
        Instant cutoff = clock.instant().minus(retention);
        int removed = taskManager.cleanup(cutoff);
        if (metrics != null && removed > 0) {
            metrics.recordCleanup(removed);
        }
        return removed;
    }

    public TaskManager taskManager() {
        return taskManager;
    }

    public EventBus eventBus() {
        return eventBus;
    }

    public Orchestrator orchestrator() {
        return orchestrator;
    }

    public JobScheduler jobScheduler() {
        return jobScheduler;
    }

    public TaskDispatcher dispatcher() {
        return dispatcher;
    }

    private void sweep() {
        try {
            cleanupNow();
        } catch (RuntimeException e) {
            log.warn("Retention sweep failed: {}", e.getMessage(), e);
        }
    }
}
