package com.taskweave.core.health;

import com.taskweave.core.engine.TaskweaveRuntime;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;

/**
 * Actuator health indicator for the orchestration runtime.
 * Reports queue sizes, free worker slots and event backlog.
 */
public class TaskweaveHealthIndicator implements HealthIndicator {

    private final TaskweaveRuntime runtime;

    public TaskweaveHealthIndicator(TaskweaveRuntime runtime) {
        this.runtime = runtime;
    }

    @Override
    public Health health() {
        if (!runtime.isRunning()) {
            return Health.unknown().withDetail("reason", "runtime not started").build();
        }
        var orchestrator = runtime.orchestrator();
        var builder = orchestrator.isReachable() ? Health.up() : Health.down();
        runtime.taskManager().queueStatus()
                .forEach((pc, size) -> builder.withDetail("queue." + pc.name().toLowerCase(), size));
        return builder
                .withDetail("availableSlots", orchestrator.availableSlots())
                .withDetail("agents", orchestrator.agentStatus().size())
                .withDetail("eventQueueDepth", runtime.eventBus().queueDepth())
                .withDetail("offlineFirings", runtime.jobScheduler().offlineFirings().size())
                .build();
    }
}
