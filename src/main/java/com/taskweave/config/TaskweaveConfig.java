package com.taskweave.config;

import com.taskweave.agents.EchoAgent;
import com.taskweave.core.engine.Orchestrator;
import com.taskweave.core.engine.TaskDispatcher;
import com.taskweave.core.engine.TaskweaveRuntime;
import com.taskweave.core.events.EventBus;
import com.taskweave.core.health.TaskweaveHealthIndicator;
import com.taskweave.core.metrics.TaskweaveMetrics;
import com.taskweave.core.scheduler.JobScheduler;
import com.taskweave.core.store.InMemoryTaskStore;
import com.taskweave.core.store.JsonFileTaskStore;
import com.taskweave.core.store.TaskStore;
import com.taskweave.core.tasks.TaskManager;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.nio.file.Path;
import java.time.Clock;

/**
 * Wires the orchestration components from {@link TaskweaveProperties}.
 * Background threads only run once {@link TaskweaveRuntime#start()} is called.
 */
@Configuration
public class TaskweaveConfig {

    private static final Logger log = LoggerFactory.getLogger(TaskweaveConfig.class);

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public TaskweaveMetrics taskweaveMetrics(MeterRegistry registry) {
        return new TaskweaveMetrics(registry);
    }

    @Bean
    public TaskStore taskStore(TaskweaveProperties properties) {
        if (properties.isFileStore()) {
            return new JsonFileTaskStore(Path.of(properties.getStore().getDirectory()));
        }
        log.info("Using in-memory task store, tasks will not survive a restart");
        return new InMemoryTaskStore();
    }

    @Bean
    public TaskManager taskManager(TaskStore taskStore, Clock clock, TaskweaveProperties properties) {
        return new TaskManager(taskStore, clock, properties.getTasks().getDefaultMaxRetries());
    }

    @Bean
    public EventBus eventBus(TaskweaveProperties properties, Clock clock,
                             @Autowired(required = false) TaskweaveMetrics metrics) {
        return new EventBus(properties.getEvents().getQueueCapacity(), clock, metrics);
    }

    @Bean
    public Orchestrator orchestrator(TaskManager taskManager, EventBus eventBus, Clock clock,
                                     TaskweaveProperties properties,
                                     @Autowired(required = false) TaskweaveMetrics metrics) {
        var orchestrator = new Orchestrator(taskManager, eventBus, metrics, clock,
                properties.getOrchestrator().getWorkers(), properties.getAgentTimeout());
        if (properties.getOrchestrator().isEchoAgentEnabled()) {
            orchestrator.register(EchoAgent.AGENT_ID, new EchoAgent());
        }
        return orchestrator;
    }

    @Bean
    public ThreadPoolTaskScheduler taskweaveTaskScheduler(TaskweaveProperties properties) {
        var scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(properties.getScheduler().getPoolSize());
        scheduler.setThreadNamePrefix("taskweave-scheduler-");
        scheduler.setDaemon(true);
        scheduler.setWaitForTasksToCompleteOnShutdown(false);
        return scheduler;
    }

    @Bean
    public JobScheduler jobScheduler(ThreadPoolTaskScheduler taskweaveTaskScheduler, TaskManager taskManager,
                                     Orchestrator orchestrator, EventBus eventBus, Clock clock,
                                     TaskweaveProperties properties,
                                     @Autowired(required = false) TaskweaveMetrics metrics) {
        return new JobScheduler(taskweaveTaskScheduler, taskManager, orchestrator, eventBus, metrics, clock,
                properties.getZoneId(), properties.getOfflineDrainInterval());
    }

    @Bean
    public TaskDispatcher taskDispatcher(TaskManager taskManager, Orchestrator orchestrator,
                                         TaskweaveProperties properties,
                                         @Autowired(required = false) TaskweaveMetrics metrics) {
        return new TaskDispatcher(taskManager, orchestrator, metrics, properties.getDispatchPollInterval());
    }

    @Bean(destroyMethod = "stop")
    public TaskweaveRuntime taskweaveRuntime(TaskManager taskManager, EventBus eventBus, Orchestrator orchestrator,
                                             JobScheduler jobScheduler, TaskDispatcher taskDispatcher,
                                             ThreadPoolTaskScheduler taskweaveTaskScheduler, Clock clock,
                                             TaskweaveProperties properties,
                                             @Autowired(required = false) TaskweaveMetrics metrics) {
        return new TaskweaveRuntime(taskManager, eventBus, orchestrator, jobScheduler, taskDispatcher,
                taskweaveTaskScheduler, metrics, clock, properties.getRetention(), properties.getCleanupInterval());
    }

    @Bean
    public TaskweaveHealthIndicator taskweaveHealthIndicator(TaskweaveRuntime taskweaveRuntime) {
        return new TaskweaveHealthIndicator(taskweaveRuntime);
    }
}
