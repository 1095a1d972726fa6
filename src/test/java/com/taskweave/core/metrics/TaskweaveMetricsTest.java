package com.taskweave.core.metrics;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class TaskweaveMetricsTest {

    private SimpleMeterRegistry registry;
    private TaskweaveMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new TaskweaveMetrics(registry);
    }

    @Test
    @DisplayName("recordExecution records by agent tag")
    void recordExecution() {
        metrics.recordExecution("echo", 200);
        metrics.recordExecution("echo", 100);
        metrics.recordExecution("report", 50);

        var echo = registry.find("taskweave.execution.duration").tag("agent", "echo").timer();
        var report = registry.find("taskweave.execution.duration").tag("agent", "report").timer();

        assertNotNull(echo);
        assertNotNull(report);
        assertEquals(2, echo.count());
        assertEquals(300.0, echo.totalTime(TimeUnit.MILLISECONDS));
        assertEquals(1, report.count());
    }

    @Test
    @DisplayName("recordOutcome increments the counter for agent and outcome")
    void recordOutcome() {
        metrics.recordOutcome("echo", "completed");
        metrics.recordOutcome("echo", "completed");
        metrics.recordOutcome("echo", "retried");

        var completed = registry.find("taskweave.tasks.outcomes")
                .tag("agent", "echo").tag("outcome", "completed").counter();
        var retried = registry.find("taskweave.tasks.outcomes")
                .tag("agent", "echo").tag("outcome", "retried").counter();

        assertNotNull(completed);
        assertNotNull(retried);
        assertEquals(2.0, completed.count());
        assertEquals(1.0, retried.count());
    }

    @Test
    @DisplayName("recordDispatch counts per priority class")
    void recordDispatch() {
        metrics.recordDispatch("HIGH");
        metrics.recordDispatch("LOW");
        metrics.recordDispatch("HIGH");

        assertEquals(2.0, registry.find("taskweave.tasks.dispatched").tag("class", "HIGH").counter().count());
        assertEquals(1.0, registry.find("taskweave.tasks.dispatched").tag("class", "LOW").counter().count());
    }

    @Test
    @DisplayName("recordFiring counts per result")
    void recordFiring() {
        metrics.recordFiring("dispatched");
        metrics.recordFiring("offline");

        assertEquals(1.0, registry.find("taskweave.scheduler.firings").tag("result", "dispatched").counter().count());
        assertEquals(1.0, registry.find("taskweave.scheduler.firings").tag("result", "offline").counter().count());
        assertNull(registry.find("taskweave.scheduler.firings").tag("result", "retry").counter());
    }

    @Test
    @DisplayName("recordDeliveryFailure and recordCleanup increment their counters")
    void deliveryFailureAndCleanup() {
        metrics.recordDeliveryFailure("task_completed");
        metrics.recordCleanup(4);
        metrics.recordCleanup(2);

        assertEquals(1.0, registry.find("taskweave.events.delivery_failures")
                .tag("type", "task_completed").counter().count());
        assertEquals(6.0, registry.find("taskweave.tasks.cleaned").counter().count());
    }
}
