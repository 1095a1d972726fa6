package com.taskweave.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class TaskTest {

    private static final Instant NOW = Instant.parse("2026-02-01T08:30:00Z");

    @Test
    @DisplayName("later changes to the caller's payload map do not reach the task")
    void payloadIsCopied() {
        Map<String, Object> payload = new HashMap<>();
        payload.put("message", "hello");
        Task task = Task.newTask("t1", payload, "echo", 1, 3, NOW);

        payload.put("message", "changed");
        payload.put("extra", 1);

        assertEquals(Map.of("message", "hello"), task.payload());
        assertThrows(UnsupportedOperationException.class, () -> task.payload().put("k", "v"));
    }

    @Test
    @DisplayName("null payload values are kept")
    void nullValuesKept() {
        Map<String, Object> payload = new HashMap<>();
        payload.put("optional", null);
        Task task = Task.newTask("t1", payload, "echo", 1, 3, NOW);

        assertTrue(task.payload().containsKey("optional"));
        assertNull(task.payload().get("optional"));
    }
}
