package com.taskweave.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for task execution, scheduling and event delivery.
 */
public class TaskweaveMetrics {

    private final MeterRegistry registry;

    public TaskweaveMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordExecution(String agentId, long ms) {
        Timer.builder("taskweave.execution.duration")
                .tag("agent", agentId)
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    /**
     * @param outcome "completed", "failed", "retried" or "timeout"
     */
    public void recordOutcome(String agentId, String outcome) {
        Counter.builder("taskweave.tasks.outcomes")
                .tag("agent", agentId)
                .tag("outcome", outcome)
                .register(registry)
                .increment();
    }

    public void recordDispatch(String priorityClass) {
        Counter.builder("taskweave.tasks.dispatched")
                .description("Tasks pulled from a priority queue and submitted to the worker pool")
                .tag("class", priorityClass)
                .register(registry)
                .increment();
    }

    /**
     * @param result "dispatched", "retry", "offline" or "failed"
     */
    public void recordFiring(String result) {
        Counter.builder("taskweave.scheduler.firings")
                .tag("result", result)
                .register(registry)
                .increment();
    }

    public void recordDeliveryFailure(String eventType) {
        Counter.builder("taskweave.events.delivery_failures")
                .description("Subscriber callbacks that threw while handling an event")
                .tag("type", eventType)
                .register(registry)
                .increment();
    }

    public void recordCleanup(int removed) {
        Counter.builder("taskweave.tasks.cleaned")
                .register(registry)
                .increment(removed);
    }
}
