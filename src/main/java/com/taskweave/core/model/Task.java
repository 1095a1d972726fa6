package com.taskweave.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A unit of work routed to an agent. Instances are immutable; state changes
 * produce a new record that the task manager persists before publishing it.
 *
 * @param id       unique identifier, fixed once assigned
 * @param payload  agent-specific input, opaque to the core
 * @param agentId  agent that executes the task
 * @param priority integer priority, see {@link PriorityClass#of(int)}
 * @param state    lifecycle state
 * @param metadata timestamps, retry counters and last error
 */
public record Task(
    @JsonProperty("id") String id,
    @JsonProperty("payload") Map<String, Object> payload,
    @JsonProperty("agent_id") String agentId,
    @JsonProperty("priority") int priority,
    @JsonProperty("state") TaskState state,
    @JsonProperty("metadata") TaskMetadata metadata
) {

    public Task {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(agentId, "agentId must not be null");
        Objects.requireNonNull(state, "state must not be null");
        Objects.requireNonNull(metadata, "metadata must not be null");
        payload = payload == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(payload));
    }

    public static Task newTask(String id, Map<String, Object> payload, String agentId,
                               int priority, int maxRetries, Instant now) {
        return new Task(id, payload, agentId, priority, TaskState.PENDING,
                TaskMetadata.initial(now, maxRetries));
    }

    @JsonIgnore
    public PriorityClass priorityClass() {
        return PriorityClass.of(priority);
    }

    public Task withState(TaskState newState, Instant now) {
        return new Task(id, payload, agentId, priority, newState, metadata.touched(now));
    }

    public Task withMetadata(TaskMetadata newMetadata) {
        return new Task(id, payload, agentId, priority, state, newMetadata);
    }
}
