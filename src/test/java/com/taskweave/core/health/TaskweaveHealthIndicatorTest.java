package com.taskweave.core.health;

import com.taskweave.core.engine.AgentStatus;
import com.taskweave.core.engine.Orchestrator;
import com.taskweave.core.engine.TaskweaveRuntime;
import com.taskweave.core.events.EventBus;
import com.taskweave.core.model.PriorityClass;
import com.taskweave.core.scheduler.JobScheduler;
import com.taskweave.core.scheduler.OfflineFiring;
import com.taskweave.core.tasks.TaskManager;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.Status;

import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class TaskweaveHealthIndicatorTest {

    private TaskweaveRuntime runtime;
    private Orchestrator orchestrator;
    private TaskweaveHealthIndicator indicator;

    @BeforeEach
    void setUp() {
        runtime = mock(TaskweaveRuntime.class);
        orchestrator = mock(Orchestrator.class);
        TaskManager taskManager = mock(TaskManager.class);
        EventBus eventBus = mock(EventBus.class);
        JobScheduler jobScheduler = mock(JobScheduler.class);

        Map<PriorityClass, Integer> queues = new EnumMap<>(PriorityClass.class);
        queues.put(PriorityClass.HIGH, 2);
        queues.put(PriorityClass.MEDIUM, 0);
        queues.put(PriorityClass.LOW, 1);

        when(runtime.orchestrator()).thenReturn(orchestrator);
        when(runtime.taskManager()).thenReturn(taskManager);
        when(runtime.eventBus()).thenReturn(eventBus);
        when(runtime.jobScheduler()).thenReturn(jobScheduler);
        when(taskManager.queueStatus()).thenReturn(queues);
        when(orchestrator.availableSlots()).thenReturn(3);
        when(orchestrator.agentStatus()).thenReturn(List.of(new AgentStatus("echo", null, 4, 1, Instant.now())));
        when(eventBus.queueDepth()).thenReturn(7);
        when(jobScheduler.offlineFirings()).thenReturn(
                List.of(new OfflineFiring("nightly", "nightly#1", 1, Instant.now())));

        indicator = new TaskweaveHealthIndicator(runtime);
    }

    @Test
    void unknownUntilStarted() {
        when(runtime.isRunning()).thenReturn(false);

        Health health = indicator.health();

        assertEquals(Status.UNKNOWN, health.getStatus());
        assertEquals("runtime not started", health.getDetails().get("reason"));
    }

    @Test
    void upWhileReachable() {
        when(runtime.isRunning()).thenReturn(true);
        when(orchestrator.isReachable()).thenReturn(true);

        Health health = indicator.health();

        assertEquals(Status.UP, health.getStatus());
        assertEquals(2, health.getDetails().get("queue.high"));
        assertEquals(1, health.getDetails().get("queue.low"));
        assertEquals(3, health.getDetails().get("availableSlots"));
        assertEquals(1, health.getDetails().get("agents"));
        assertEquals(7, health.getDetails().get("eventQueueDepth"));
        assertEquals(1, health.getDetails().get("offlineFirings"));
    }

    @Test
    void downWhenUnreachable() {
        when(runtime.isRunning()).thenReturn(true);
        when(orchestrator.isReachable()).thenReturn(false);

        assertEquals(Status.DOWN, indicator.health().getStatus());
    }
}
