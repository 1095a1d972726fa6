package com.taskweave.core.scheduler;

import com.taskweave.core.engine.AgentNotFoundException;
import com.taskweave.core.events.Event;
import com.taskweave.core.events.EventBus;
import com.taskweave.core.events.EventPriority;
import com.taskweave.core.events.EventTypes;
import com.taskweave.core.events.QueueFullException;
import com.taskweave.core.logging.MdcContext;
import com.taskweave.core.metrics.TaskweaveMetrics;
import com.taskweave.core.model.ScheduleConfig;
import com.taskweave.core.model.Task;
import com.taskweave.core.model.TaskState;
import com.taskweave.core.tasks.DuplicateTaskException;
import com.taskweave.core.tasks.IllegalTaskStateException;
import com.taskweave.core.tasks.TaskManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.TaskScheduler;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ScheduledFuture;

/**
 * Fires scheduled jobs on a Spring {@link TaskScheduler}.
 * <p>
 * Every fire materializes a task {@code <jobId>#<n>} through the {@link TaskManager}
 * and hands it to the {@link ExecutionGateway} in one synchronous call. Failed
 * hand-offs are retried per job after {@code retry_delay} while the job's retry
 * budget lasts; firings made while the gateway is unreachable are parked and
 * re-attempted by {@link #drainOffline()}. Each fire ends with one
 * {@code task_executed} event.
 */
public class JobScheduler {

    private static final Logger log = LoggerFactory.getLogger(JobScheduler.class);

    private static final String SOURCE = "scheduler";

    private final TaskScheduler taskScheduler;
    private final TaskManager taskManager;
    private final ExecutionGateway gateway;
    private final EventBus eventBus;
    private final TaskweaveMetrics metrics;
    private final Clock clock;
    private final ZoneId zone;
    private final Duration offlineDrainInterval;

    private final Object lock = new Object();
    private final Map<String, ScheduledJob> jobs = new LinkedHashMap<>();
    private final List<Parked> offline = new ArrayList<>();

    private ScheduledFuture<?> drainTask;

    public JobScheduler(TaskScheduler taskScheduler, TaskManager taskManager, ExecutionGateway gateway,
                        EventBus eventBus, TaskweaveMetrics metrics, Clock clock, ZoneId zone,
                        Duration offlineDrainInterval) {
        this.taskScheduler = taskScheduler;
        this.taskManager = taskManager;
        this.gateway = gateway;
        this.eventBus = eventBus;
        this.metrics = metrics;
        this.clock = clock;
        this.zone = zone;
        this.offlineDrainInterval = offlineDrainInterval;
    }

    /**
     * Register a job and arm its first trigger.
     *
     * @throws DuplicateScheduleException if {@code jobId} is already scheduled
     * @throws InvalidScheduleException   if {@code config} is inconsistent with its kind
     *                                    or never produces a fire time
     */
    public ScheduledJobView schedule(String jobId, Map<String, Object> payload, ScheduleConfig config,
                                     String agentId, int priority) {
        ScheduledJobView created;
        synchronized (lock) {
            if (jobs.containsKey(jobId)) {
                throw new DuplicateScheduleException(jobId);
            }
            ScheduleTrigger trigger = ScheduleTrigger.of(config, zone);
            Instant first = trigger.firstFire(clock.instant())
                    .orElseThrow(() -> new InvalidScheduleException("Schedule for " + jobId + " never fires"));
            ScheduledJob job = new ScheduledJob(jobId, payload, agentId, priority, config, trigger);
            jobs.put(jobId, job);
            arm(job, first);
            created = toView(job);
            log.info("Scheduled job {} ({}) for agent {}, first fire at {}", jobId, config.kind(), agentId, first);
        }
        Map<String, Object> data = new HashMap<>();
        data.put("job_id", jobId);
        data.put("agent_id", agentId);
        data.put("kind", config.kind().name());
        publishQuietly(Event.of(EventTypes.TASK_SCHEDULED, data, EventPriority.NORMAL, SOURCE));
        return created;
    }

    /**
     * Remove a job with its pending trigger, pending retry and parked firings.
     * Executions already handed off are not affected.
     *
     * @throws ScheduleNotFoundException if no such job is active
     */
    public void cancel(String jobId) {
        synchronized (lock) {
            ScheduledJob job = jobs.remove(jobId);
            if (job == null) {
                throw new ScheduleNotFoundException(jobId);
            }
            job.cancel();
            offline.removeIf(p -> p.job() == job);
        }
        log.info("Cancelled scheduled job {}", jobId);
        publishQuietly(Event.of(EventTypes.SCHEDULE_CANCELLED, Map.of("job_id", jobId),
                EventPriority.NORMAL, SOURCE));
    }

    public List<ScheduledJobView> list() {
        synchronized (lock) {
            return jobs.values().stream().map(JobScheduler::toView).toList();
        }
    }

    public List<OfflineFiring> offlineFirings() {
        synchronized (lock) {
            return offline.stream().map(Parked::firing).toList();
        }
    }

    /**
     * Re-attempt every parked firing if the execution layer is reachable.
     * Firings that fail again with a transient error are parked again.
     *
     * @return number of firings handed off
     */
    public int drainOffline() {
        if (!gateway.isReachable()) {
            return 0;
        }
        List<Parked> batch;
        synchronized (lock) {
            if (offline.isEmpty()) {
                return 0;
            }
            batch = new ArrayList<>(offline);
            offline.clear();
        }
        int dispatched = 0;
        List<Parked> failed = new ArrayList<>();
        for (Parked parked : batch) {
            ScheduledJob job = parked.job();
            if (job.isCancelled()) {
                continue;
            }
            try {
                MdcContext.setJob(job.jobId());
                Task task = handOff(job, parked.firing().sequence());
                dispatched++;
                succeeded(job, task.id());
            } catch (AgentNotFoundException | DuplicateTaskException e) {
                rejected(job, parked.firing().taskId(), e);
            } catch (RuntimeException e) {
                log.warn("Offline firing {} still failing: {}", parked.firing().taskId(), e.getMessage());
                failed.add(parked);
            } finally {
                MdcContext.clear();
            }
        }
        if (!failed.isEmpty()) {
            synchronized (lock) {
                failed.stream().filter(p -> !p.job().isCancelled()).forEach(offline::add);
            }
        }
        if (dispatched > 0) {
            log.info("Drained {} offline firings", dispatched);
        }
        return dispatched;
    }

    /**
     * Start the periodic offline drain. Triggers fire whether or not the
     * scheduler is started.
     */
    public synchronized void start() {
        if (drainTask != null) {
            return;
        }
        drainTask = taskScheduler.scheduleAtFixedRate(this::drainQuietly, offlineDrainInterval);
        log.info("Job scheduler started (zone {}, offline drain every {})", zone, offlineDrainInterval);
    }

    /**
     * Stop the offline drain and disarm every job.
     */
    public synchronized void stop() {
        if (drainTask != null) {
            drainTask.cancel(false);
            drainTask = null;
        }
        synchronized (lock) {
            jobs.values().forEach(ScheduledJob::cancel);
            jobs.clear();
        }
        log.info("Job scheduler stopped");
    }

    public boolean isStarted() {
        return drainTask != null;
    }

    // -- firing ---------------------------------------------------------------

    private void onTrigger(ScheduledJob job, Instant scheduledAt) {
        int sequence;
        synchronized (lock) {
            if (job.isCancelled()) {
                return;
            }
            job.nextTrigger = null;
            job.nextFireAt = null;
            sequence = job.nextSequence();
            job.trigger().nextFire(scheduledAt).ifPresent(next -> arm(job, next));
        }
        attempt(job, sequence);
    }

    private void onRetry(ScheduledJob job, int sequence) {
        synchronized (lock) {
            if (job.isCancelled()) {
                return;
            }
            job.clearRetry(sequence);
        }
        attempt(job, sequence);
    }

    private void attempt(ScheduledJob job, int sequence) {
        String taskId = job.taskIdFor(sequence);
        MdcContext.setJob(job.jobId());
        try {
            if (!gateway.isReachable()) {
                park(job, sequence, taskId);
                return;
            }
            try {
                Task task = handOff(job, sequence);
                synchronized (lock) {
                    job.resetRetries();
                }
                succeeded(job, task.id());
            } catch (AgentNotFoundException | DuplicateTaskException e) {
                rejected(job, taskId, e);
            } catch (RuntimeException e) {
                if (!gateway.isReachable()) {
                    park(job, sequence, taskId);
                    return;
                }
                failed(job, sequence, taskId, e);
            }
        } finally {
            destroyIfExhausted(job);
            MdcContext.clear();
        }
    }

    /**
     * Materialize the firing's task unless a previous attempt already did, then
     * submit it. A task that already left PENDING counts as handed off, including
     * one the dispatcher picked from its queue between creation and submission.
     */
    private Task handOff(ScheduledJob job, int sequence) {
        String taskId = job.taskIdFor(sequence);
        Task task = taskManager.get(taskId).orElse(null);
        if (task == null) {
            task = taskManager.create(taskId, job.payload(), job.agentId(), job.priority());
        } else if (task.state() != TaskState.PENDING) {
            log.debug("Task {} already handed off ({})", taskId, task.state());
            return task;
        }
        try {
            gateway.submit(task);
        } catch (DuplicateTaskException | IllegalTaskStateException e) {
            log.debug("Task {} was dispatched from its queue first: {}", taskId, e.getMessage());
        }
        return task;
    }

    private void succeeded(ScheduledJob job, String taskId) {
        log.info("Job {} fired, dispatched task {}", job.jobId(), taskId);
        recordFiring("dispatched");
        publishExecuted(job, taskId, true, "dispatched " + taskId, null);
    }

    private void rejected(ScheduledJob job, String taskId, RuntimeException e) {
        log.error("Job {} firing {} rejected: {}", job.jobId(), taskId, e.getMessage());
        recordFiring("failed");
        publishExecuted(job, taskId, false, null, e.getMessage());
    }

    private void failed(ScheduledJob job, int sequence, String taskId, RuntimeException e) {
        Instant retryAt = null;
        synchronized (lock) {
            if (!job.isCancelled() && job.tryConsumeRetry()) {
                retryAt = clock.instant().plus(job.config().retryDelay());
                job.addRetry(sequence, taskScheduler.schedule(() -> onRetry(job, sequence), retryAt), retryAt);
            }
        }
        if (retryAt != null) {
            log.warn("Job {} firing {} failed ({}), retry {}/{} at {}", job.jobId(), taskId, e.getMessage(),
                    job.retryCount(), job.config().maxRetries(), retryAt);
            recordFiring("retry");
            return;
        }
        log.error("Job {} firing {} failed: {}", job.jobId(), taskId, e.getMessage(), e);
        recordFiring("failed");
        publishExecuted(job, taskId, false, null, e.getMessage());
    }

    private void park(ScheduledJob job, int sequence, String taskId) {
        synchronized (lock) {
            if (job.isCancelled()) {
                return;
            }
            offline.add(new Parked(job, new OfflineFiring(job.jobId(), taskId, sequence, clock.instant())));
        }
        log.warn("Execution layer unreachable, parked firing {} of job {}", taskId, job.jobId());
        recordFiring("offline");
    }

    // Caller holds the lock.
    private void arm(ScheduledJob job, Instant at) {
        job.nextFireAt = at;
        job.nextTrigger = taskScheduler.schedule(() -> onTrigger(job, at), at);
    }

    private void destroyIfExhausted(ScheduledJob job) {
        synchronized (lock) {
            if (jobs.get(job.jobId()) == job && job.isExhausted()) {
                jobs.remove(job.jobId());
                log.info("Job {} has no further fires, removed", job.jobId());
            }
        }
    }

    private void drainQuietly() {
        try {
            drainOffline();
        } catch (RuntimeException e) {
            log.warn("Offline drain failed: {}", e.getMessage(), e);
        }
    }

    // -- views and events -----------------------------------------------------

    private static ScheduledJobView toView(ScheduledJob job) {
        Instant next = job.nextFireAt;
        Instant retryAt = job.earliestRetryAt();
        if (retryAt != null && (next == null || retryAt.isBefore(next))) {
            next = retryAt;
        }
        return new ScheduledJobView(job.jobId(), job.agentId(), job.priority(), job.config().kind(),
                job.config(), next, job.retryCount());
    }

    private void publishExecuted(ScheduledJob job, String taskId, boolean success, String result, String error) {
        Map<String, Object> data = new HashMap<>();
        data.put("job_id", job.jobId());
        data.put("task_id", taskId);
        data.put("agent_id", job.agentId());
        data.put("success", success);
        if (result != null) data.put("result", result);
        if (error != null) data.put("error", error);
        publishQuietly(Event.of(EventTypes.TASK_EXECUTED, data, EventPriority.HIGH, SOURCE));
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

    private void recordFiring(String result) {
        if (metrics != null) {
            metrics.recordFiring(result);
        }
    }

    private record Parked(ScheduledJob job, OfflineFiring firing) {}
}
