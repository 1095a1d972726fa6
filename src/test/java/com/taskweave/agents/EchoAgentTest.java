package com.taskweave.agents;

import com.taskweave.core.engine.AgentResult;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class EchoAgentTest {

    @Test
    void returnsPayloadUnchanged() {
        Map<String, Object> payload = Map.of("message", "hello", "count", 2);

        AgentResult result = new EchoAgent().execute(payload);

        assertTrue(result.success());
        assertSame(payload, result.result());
        assertNull(result.error());
    }

    @Test
    void echoesEmptyPayload() {
        AgentResult result = new EchoAgent().execute(Map.of());
        assertTrue(result.success());
        assertEquals(Map.of(), result.result());
    }
}
