package com.taskweave.config;

import com.taskweave.core.engine.Orchestrator;
import com.taskweave.core.engine.TaskweaveRuntime;
import com.taskweave.core.events.EventBus;
import com.taskweave.core.metrics.TaskweaveMetrics;
import com.taskweave.core.store.InMemoryTaskStore;
import com.taskweave.core.store.JsonFileTaskStore;
import com.taskweave.core.tasks.TaskManager;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;

import static org.junit.jupiter.api.Assertions.*;

class TaskweaveConfigTest {

    private final TaskweaveConfig config = new TaskweaveConfig();

    @Test
    void storeFollowsConfiguredType(@TempDir Path dir) {
        var props = new TaskweaveProperties();
        props.getStore().setDirectory(dir.resolve("tasks").toString());
        assertInstanceOf(JsonFileTaskStore.class, config.taskStore(props));
        assertTrue(Files.isDirectory(dir.resolve("tasks")));

        props.getStore().setType("memory");
        assertInstanceOf(InMemoryTaskStore.class, config.taskStore(props));
    }

    @Test
    void orchestratorRegistersEchoAgentWhenEnabled() {
        var props = new TaskweaveProperties();
        var taskManager = new TaskManager(new InMemoryTaskStore());
        var eventBus = new EventBus();

        Orchestrator withEcho = config.orchestrator(taskManager, eventBus, Clock.systemUTC(), props, null);
        props.getOrchestrator().setEchoAgentEnabled(false);
        Orchestrator without = config.orchestrator(taskManager, eventBus, Clock.systemUTC(), props, null);
        try {
            assertTrue(withEcho.isRegistered("echo"));
            assertFalse(without.isRegistered("echo"));
            assertEquals(5, withEcho.availableSlots());
        } finally {
            withEcho.shutdown(false);
            without.shutdown(false);
        }
    }

    @Test
    void runtimeIsWiredButNotStarted() {
        var props = new TaskweaveProperties();
        props.getStore().setType("memory");
        Clock clock = config.clock();
        TaskweaveMetrics metrics = config.taskweaveMetrics(new SimpleMeterRegistry());
        var store = config.taskStore(props);
        var taskManager = config.taskManager(store, clock, props);
        var eventBus = config.eventBus(props, clock, metrics);
        var orchestrator = config.orchestrator(taskManager, eventBus, clock, props, metrics);
        var scheduler = config.taskweaveTaskScheduler(props);
        scheduler.initialize();
        var jobScheduler = config.jobScheduler(scheduler, taskManager, orchestrator, eventBus, clock, props, metrics);
        var dispatcher = config.taskDispatcher(taskManager, orchestrator, props, metrics);

        TaskweaveRuntime runtime = config.taskweaveRuntime(taskManager, eventBus, orchestrator, jobScheduler,
                dispatcher, scheduler, clock, props, metrics);
        try {
            assertFalse(runtime.isRunning());
            assertFalse(eventBus.isRunning());
            assertEquals(3, taskManager.defaultMaxRetries());
            assertNotNull(config.taskweaveHealthIndicator(runtime).health());
        } finally {
            orchestrator.shutdown(false);
            scheduler.shutdown();
        }
    }
}
