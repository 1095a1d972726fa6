package com.taskweave.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.ZoneId;

@Component
@ConfigurationProperties(prefix = "taskweave")
public class TaskweaveProperties {

    private Store store = new Store();
    private Tasks tasks = new Tasks();
    private Orchestrator orchestrator = new Orchestrator();
    private Events events = new Events();
    private Scheduler scheduler = new Scheduler();

    // -- derived values --
    public boolean isFileStore() { return "file".equalsIgnoreCase(store.type); }
    public Duration getRetention() { return Duration.ofDays(tasks.retentionDays); }
    public Duration getCleanupInterval() { return Duration.ofMinutes(tasks.cleanupIntervalMinutes); }

    /**
     * Default agent timeout, or null when agents may run unbounded.
     */
    public Duration getAgentTimeout() {
        return orchestrator.agentTimeoutSeconds > 0 ? Duration.ofSeconds(orchestrator.agentTimeoutSeconds) : null;
    }

    public Duration getDispatchPollInterval() { return Duration.ofMillis(orchestrator.dispatchPollMillis); }
    public Duration getOfflineDrainInterval() { return Duration.ofSeconds(scheduler.offlineDrainIntervalSeconds); }
    public ZoneId getZoneId() { return ZoneId.of(scheduler.zone); }

    public Store getStore() { return store; }
    public void setStore(Store store) { this.store = store; }
    public Tasks getTasks() { return tasks; }
    public void setTasks(Tasks tasks) { this.tasks = tasks; }
    public Orchestrator getOrchestrator() { return orchestrator; }
    public void setOrchestrator(Orchestrator orchestrator) { this.orchestrator = orchestrator; }
    public Events getEvents() { return events; }
    public void setEvents(Events events) { this.events = events; }
    public Scheduler getScheduler() { return scheduler; }
    public void setScheduler(Scheduler scheduler) { this.scheduler = scheduler; }

    public static class Store {
        private String type = "file";
        private String directory = "task_storage";

        public String getType() { return type; }
        public void setType(String type) { this.type = type; }
        public String getDirectory() { return directory; }
        public void setDirectory(String directory) { this.directory = directory; }
    }

    public static class Tasks {
        private int defaultMaxRetries = 3;
        private int retentionDays = 7;
        private int cleanupIntervalMinutes = 60;

        public int getDefaultMaxRetries() { return defaultMaxRetries; }
        public void setDefaultMaxRetries(int defaultMaxRetries) { this.defaultMaxRetries = defaultMaxRetries; }
        public int getRetentionDays() { return retentionDays; }
        public void setRetentionDays(int retentionDays) { this.retentionDays = retentionDays; }
        public int getCleanupIntervalMinutes() { return cleanupIntervalMinutes; }
        public void setCleanupIntervalMinutes(int cleanupIntervalMinutes) { this.cleanupIntervalMinutes = cleanupIntervalMinutes; }
    }

    public static class Orchestrator {
        private int workers = 5;
        private int agentTimeoutSeconds = 0;
        private long dispatchPollMillis = 200;
        private boolean echoAgentEnabled = true;

        public int getWorkers() { return workers; }
        public void setWorkers(int workers) { this.workers = workers; }
        public int getAgentTimeoutSeconds() { return agentTimeoutSeconds; }
        public void setAgentTimeoutSeconds(int agentTimeoutSeconds) { this.agentTimeoutSeconds = agentTimeoutSeconds; }
        public long getDispatchPollMillis() { return dispatchPollMillis; }
        public void setDispatchPollMillis(long dispatchPollMillis) { this.dispatchPollMillis = dispatchPollMillis; }
        public boolean isEchoAgentEnabled() { return echoAgentEnabled; }
        public void setEchoAgentEnabled(boolean echoAgentEnabled) { this.echoAgentEnabled = echoAgentEnabled; }
    }

    public static class Events {
        private int queueCapacity = 1000;

        public int getQueueCapacity() { return queueCapacity; }
        public void setQueueCapacity(int queueCapacity) { this.queueCapacity = queueCapacity; }
    }

    public static class Scheduler {
        private int poolSize = 2;
        private int offlineDrainIntervalSeconds = 30;
        private String zone = "UTC";

        public int getPoolSize() { return poolSize; }
        public void setPoolSize(int poolSize) { this.poolSize = poolSize; }
        public int getOfflineDrainIntervalSeconds() { return offlineDrainIntervalSeconds; }
        public void setOfflineDrainIntervalSeconds(int offlineDrainIntervalSeconds) { this.offlineDrainIntervalSeconds = offlineDrainIntervalSeconds; }
        public String getZone() { return zone; }
        public void setZone(String zone) { this.zone = zone; }
    }
}
