package com.taskweave.core.scheduler;

import com.taskweave.core.engine.AgentNotFoundException;
import com.taskweave.core.events.Event;
import com.taskweave.core.events.EventBus;
import com.taskweave.core.events.EventTypes;
import com.taskweave.core.events.QueueFullException;
import com.taskweave.core.model.ScheduleConfig;
import com.taskweave.core.model.Task;
import com.taskweave.core.model.TaskState;
import com.taskweave.core.store.InMemoryTaskStore;
import com.taskweave.core.tasks.DuplicateTaskException;
import com.taskweave.core.tasks.TaskManager;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.scheduling.TaskScheduler;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ScheduledFuture;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class JobSchedulerTest {

    private static final Instant NOW = Instant.parse("2026-05-04T10:00:00Z");
    private static final Duration RETRY_DELAY = Duration.ofSeconds(30);

    private record Armed(Runnable action, Instant at, ScheduledFuture<?> future) {}

    private TaskScheduler taskScheduler;
    private ExecutionGateway gateway;
    private EventBus eventBus;
    private TaskManager taskManager;
    private JobScheduler scheduler;
    private final List<Armed> armed = new ArrayList<>();

    @BeforeEach
    void setUp() {
        taskScheduler = mock(TaskScheduler.class);
        when(taskScheduler.schedule(any(Runnable.class), any(Instant.class))).thenAnswer(inv -> {
            ScheduledFuture<?> future = mock(ScheduledFuture.class);
            armed.add(new Armed(inv.getArgument(0), inv.getArgument(1), future));
            return future;
        });
        gateway = mock(ExecutionGateway.class);
        when(gateway.isReachable()).thenReturn(true);
        eventBus = mock(EventBus.class);
        taskManager = new TaskManager(new InMemoryTaskStore(), Clock.fixed(NOW, ZoneOffset.UTC), 3);
        scheduler = new JobScheduler(taskScheduler, taskManager, gateway, eventBus, null,
                Clock.fixed(NOW, ZoneOffset.UTC), ZoneOffset.UTC, Duration.ofSeconds(60));
    }

    private ScheduleConfig oneTime() {
        return ScheduleConfig.oneTime(NOW.plusSeconds(3600)).withRetry(true, 2, RETRY_DELAY);
    }

    private ScheduledJobView schedule(String jobId, ScheduleConfig config) {
        return scheduler.schedule(jobId, Map.of("report", "daily"), config, "echo", 2);
    }

    private void fire(int index) {
        armed.get(index).action().run();
    }

    private List<Event> published(String type) {
        ArgumentCaptor<Event> captor = ArgumentCaptor.forClass(Event.class);
        verify(eventBus, atLeast(0)).publish(captor.capture());
        return captor.getAllValues().stream().filter(e -> e.type().equals(type)).toList();
    }

    @Nested
    @DisplayName("registration")
    class RegistrationTests {

        @Test
        @DisplayName("arms the first trigger and announces the job")
        void schedulesJob() {
            ScheduledJobView view = schedule("nightly", oneTime());

            assertEquals("nightly", view.jobId());
            assertEquals(NOW.plusSeconds(3600), view.nextFireAt());
            assertEquals(1, armed.size());
            assertEquals(NOW.plusSeconds(3600), armed.get(0).at());
            assertEquals(List.of("nightly"), scheduler.list().stream().map(ScheduledJobView::jobId).toList());

            List<Event> scheduled = published(EventTypes.TASK_SCHEDULED);
            assertEquals(1, scheduled.size());
            assertEquals("nightly", scheduled.get(0).data().get("job_id"));
        }

        @Test
        @DisplayName("rejects a duplicate job id")
        void duplicate() {
            schedule("nightly", oneTime());
            assertThrows(DuplicateScheduleException.class, () -> schedule("nightly", oneTime()));
            assertEquals(1, armed.size());
        }

        @Test
        @DisplayName("rejects invalid or never-firing schedules without registering them")
        void invalid() {
            assertThrows(InvalidScheduleException.class,
                    () -> schedule("bad", ScheduleConfig.recurring(Duration.ZERO)));
            ScheduleConfig expired = ScheduleConfig.recurring(Duration.ofMinutes(1))
                    .between(NOW.minusSeconds(600), NOW.minusSeconds(300));
            assertThrows(InvalidScheduleException.class, () -> schedule("expired", expired));

            assertTrue(scheduler.list().isEmpty());
            assertTrue(armed.isEmpty());
        }

        @Test
        @DisplayName("an event queue that is full does not fail registration")
        void eventQueueFull() {
            doThrow(new QueueFullException("event queue full")).when(eventBus).publish(any(Event.class));
            assertNotNull(schedule("nightly", oneTime()));
        }
    }

    @Nested
    @DisplayName("firing")
    class FiringTests {

        @Test
        @DisplayName("materializes a task, hands it off and reports success")
        void firesOneTime() {
            schedule("nightly", oneTime());
            fire(0);

            Task task = taskManager.get("nightly#1").orElseThrow();
            assertEquals("echo", task.agentId());
            assertEquals(2, task.priority());
            assertEquals("daily", task.payload().get("report"));
            verify(gateway).submit(argThat(t -> t.id().equals("nightly#1")));

            List<Event> executed = published(EventTypes.TASK_EXECUTED);
            assertEquals(1, executed.size());
            assertEquals(true, executed.get(0).data().get("success"));
            assertEquals("nightly#1", executed.get(0).data().get("task_id"));

            assertTrue(scheduler.list().isEmpty(), "one-time job is removed after its fire");
        }

        @Test
        @DisplayName("recurring job re-arms one interval after the previous fire")
        void recurringRearms() {
            schedule("poll", ScheduleConfig.recurring(Duration.ofMinutes(5)));
            Instant first = armed.get(0).at();
            fire(0);

            assertEquals(2, armed.size());
            assertEquals(first.plus(Duration.ofMinutes(5)), armed.get(1).at());
            assertEquals(first.plus(Duration.ofMinutes(5)), scheduler.list().get(0).nextFireAt());

            fire(1);
            assertTrue(taskManager.get("poll#1").isPresent());
            assertTrue(taskManager.get("poll#2").isPresent());
        }

        @Test
        @DisplayName("a failed hand-off is retried with the same task after the retry delay")
        void retriesFailure() {
            doThrow(new RuntimeException("pool saturated")).doNothing().when(gateway).submit(any(Task.class));
            schedule("nightly", oneTime());
            fire(0);

            assertEquals(2, armed.size());
            assertEquals(NOW.plus(RETRY_DELAY), armed.get(1).at());
            ScheduledJobView pending = scheduler.list().get(0);
            assertEquals(1, pending.retryCount());
            assertEquals(NOW.plus(RETRY_DELAY), pending.nextFireAt());
            assertTrue(published(EventTypes.TASK_EXECUTED).isEmpty());

            fire(1);

            verify(gateway, times(2)).submit(argThat(t -> t.id().equals("nightly#1")));
            assertTrue(taskManager.get("nightly#2").isEmpty());
            List<Event> executed = published(EventTypes.TASK_EXECUTED);
            assertEquals(1, executed.size());
            assertEquals(true, executed.get(0).data().get("success"));
            assertTrue(scheduler.list().isEmpty());
        }

        @Test
        @DisplayName("stops retrying once the budget is spent")
        void retriesExhausted() {
            doThrow(new RuntimeException("boom")).when(gateway).submit(any(Task.class));
            schedule("nightly", ScheduleConfig.oneTime(NOW.plusSeconds(60)).withRetry(true, 1, RETRY_DELAY));

            fire(0);
            assertEquals(2, armed.size());
            fire(1);
            assertEquals(2, armed.size());

            List<Event> executed = published(EventTypes.TASK_EXECUTED);
            assertEquals(1, executed.size());
            assertEquals(false, executed.get(0).data().get("success"));
            assertEquals("boom", executed.get(0).data().get("error"));
            assertTrue(scheduler.list().isEmpty());
        }

        @Test
        @DisplayName("retry disabled reports the failure on the first attempt")
        void retryDisabled() {
            doThrow(new RuntimeException("boom")).when(gateway).submit(any(Task.class));
            schedule("nightly", ScheduleConfig.oneTime(NOW.plusSeconds(60)).withRetry(false, 3, RETRY_DELAY));

            fire(0);

            assertEquals(1, armed.size());
            assertEquals(1, published(EventTypes.TASK_EXECUTED).size());
        }

        @Test
        @DisplayName("an unknown agent is not retried")
        void agentNotFound() {
            doThrow(new AgentNotFoundException("echo")).when(gateway).submit(any(Task.class));
            schedule("nightly", oneTime());

            fire(0);

            assertEquals(1, armed.size());
            List<Event> executed = published(EventTypes.TASK_EXECUTED);
            assertEquals(1, executed.size());
            assertEquals(false, executed.get(0).data().get("success"));
        }

        @Test
        @DisplayName("a task the dispatcher already picked up counts as handed off")
        void dispatcherWonTheRace() {
            doThrow(new DuplicateTaskException("nightly#1")).when(gateway).submit(any(Task.class));
            schedule("nightly", oneTime());

            fire(0);

            assertEquals(1, armed.size());
            List<Event> executed = published(EventTypes.TASK_EXECUTED);
            assertEquals(1, executed.size());
            assertEquals(true, executed.get(0).data().get("success"));
        }

        @Test
        @DisplayName("overlapping failed firings of one job keep separate retries")
        void overlappingRetries() {
            doThrow(new RuntimeException("pool saturated")).when(gateway).submit(any(Task.class));
            schedule("poll", ScheduleConfig.recurring(Duration.ofMinutes(5)).withRetry(true, 5, RETRY_DELAY));

            // armed: 0 first fire, 1 second fire, 2 retry of #1, 3 third fire, 4 retry of #2
            fire(0);
            fire(1);
            assertEquals(5, armed.size());
            assertEquals(NOW.plus(RETRY_DELAY), armed.get(2).at());
            assertEquals(NOW.plus(RETRY_DELAY), armed.get(4).at());

            doNothing().when(gateway).submit(any(Task.class));
            fire(2);
            assertEquals(NOW.plus(RETRY_DELAY), scheduler.list().get(0).nextFireAt());

            scheduler.cancel("poll");
            verify(armed.get(3).future()).cancel(false);
            verify(armed.get(4).future()).cancel(false);
            fire(4);
            verify(gateway, times(1)).submit(argThat(t -> t.id().equals("poll#2")));
        }

        @Test
        @DisplayName("a successful fire resets the retry counter")
        void successResetsRetries() {
            doThrow(new RuntimeException("flaky")).doNothing().when(gateway).submit(any(Task.class));
            schedule("poll", ScheduleConfig.recurring(Duration.ofMinutes(5)).withRetry(true, 2, RETRY_DELAY));

            fire(0);
            assertEquals(1, scheduler.list().get(0).retryCount());
            // armed: 0 first fire, 1 next fire, 2 retry
            fire(2);
            assertEquals(0, scheduler.list().get(0).retryCount());
        }
    }

    @Nested
    @DisplayName("offline firings")
    class OfflineTests {

        @Test
        @DisplayName("firings are parked while the gateway is unreachable and drained later")
        void parksAndDrains() {
            when(gateway.isReachable()).thenReturn(false);
            schedule("nightly", oneTime());
            fire(0);

            verify(gateway, never()).submit(any(Task.class));
            List<OfflineFiring> parked = scheduler.offlineFirings();
            assertEquals(1, parked.size());
            assertEquals("nightly#1", parked.get(0).taskId());
            assertEquals(0, scheduler.drainOffline());

            when(gateway.isReachable()).thenReturn(true);
            assertEquals(1, scheduler.drainOffline());

            verify(gateway).submit(argThat(t -> t.id().equals("nightly#1")));
            assertTrue(scheduler.offlineFirings().isEmpty());
            assertEquals(TaskState.PENDING, taskManager.get("nightly#1").orElseThrow().state());
            assertEquals(1, published(EventTypes.TASK_EXECUTED).size());
        }

        @Test
        @DisplayName("transient drain failures stay parked")
        void drainFailureReparks() {
            when(gateway.isReachable()).thenReturn(false);
            schedule("nightly", oneTime());
            fire(0);

            when(gateway.isReachable()).thenReturn(true);
            doThrow(new RuntimeException("still warming up")).when(gateway).submit(any(Task.class));

            assertEquals(0, scheduler.drainOffline());
            assertEquals(1, scheduler.offlineFirings().size());
        }

        @Test
        @DisplayName("non-retryable drain failures are dropped with a failure event")
        void drainRejectionDropped() {
            when(gateway.isReachable()).thenReturn(false);
            schedule("nightly", oneTime());
            fire(0);

            when(gateway.isReachable()).thenReturn(true);
            doThrow(new AgentNotFoundException("echo")).when(gateway).submit(any(Task.class));

            assertEquals(0, scheduler.drainOffline());
            assertTrue(scheduler.offlineFirings().isEmpty());
            List<Event> executed = published(EventTypes.TASK_EXECUTED);
            assertEquals(1, executed.size());
            assertEquals(false, executed.get(0).data().get("success"));
        }
    }

    @Nested
    @DisplayName("cancellation and lifecycle")
    class CancelTests {

        @Test
        @DisplayName("cancel disarms the trigger and later fires do nothing")
        void cancel() {
            schedule("poll", ScheduleConfig.recurring(Duration.ofMinutes(5)));
            scheduler.cancel("poll");

            verify(armed.get(0).future()).cancel(false);
            assertTrue(scheduler.list().isEmpty());
            assertEquals(1, published(EventTypes.SCHEDULE_CANCELLED).size());

            fire(0);
            verify(gateway, never()).submit(any(Task.class));
            assertThrows(ScheduleNotFoundException.class, () -> scheduler.cancel("poll"));
        }

        @Test
        @DisplayName("cancel drops parked firings of the job")
        void cancelDropsOffline() {
            when(gateway.isReachable()).thenReturn(false);
            schedule("poll", ScheduleConfig.recurring(Duration.ofMinutes(5)));
            fire(0);
            assertEquals(1, scheduler.offlineFirings().size());

            scheduler.cancel("poll");

            assertTrue(scheduler.offlineFirings().isEmpty());
        }

        @Test
        @DisplayName("cancel leaves tasks already handed off alone")
        void cancelKeepsDispatchedTasks() {
            schedule("poll", ScheduleConfig.recurring(Duration.ofMinutes(5)));
            fire(0);
            scheduler.cancel("poll");

            assertTrue(taskManager.get("poll#1").isPresent());
        }

        @Test
        @DisplayName("start arms the periodic drain and stop disarms everything")
        void startStop() {
            ScheduledFuture<?> drain = mock(ScheduledFuture.class);
            when(taskScheduler.scheduleAtFixedRate(any(Runnable.class), any(Duration.class)))
                    .thenAnswer(inv -> drain);
            schedule("poll", ScheduleConfig.recurring(Duration.ofMinutes(5)));

            scheduler.start();
            scheduler.start();
            assertTrue(scheduler.isStarted());
            verify(taskScheduler, times(1)).scheduleAtFixedRate(any(Runnable.class), eq(Duration.ofSeconds(60)));

            scheduler.stop();
            assertFalse(scheduler.isStarted());
            verify(drain).cancel(false);
            verify(armed.get(0).future()).cancel(false);
            assertTrue(scheduler.list().isEmpty());
        }
    }
}
