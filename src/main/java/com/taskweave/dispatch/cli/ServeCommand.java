package com.taskweave.dispatch.cli;

import com.taskweave.core.engine.AgentStatus;
import com.taskweave.core.engine.TaskweaveRuntime;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.ContextClosedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

import java.util.concurrent.CountDownLatch;

/**
 * CLI command: taskweave serve
 * <p>
 * Starts the runtime (task recovery, dispatcher, scheduler, event bus, retention
 * sweeper) and keeps the process alive until the application context closes,
 * typically on Ctrl+C.
 */
@Command(name = "serve", mixinStandardHelpOptions = true,
        description = "Run the orchestration runtime until interrupted")
@Component
public class ServeCommand implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(ServeCommand.class);

    private final TaskweaveRuntime runtime;
    private final CountDownLatch closed = new CountDownLatch(1);

    public ServeCommand(TaskweaveRuntime runtime) {
        this.runtime = runtime;
    }

    @Override
    public void run() {
        runtime.start();
        printBanner();
        try {
            closed.await();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.info("Serve loop interrupted");
        }
    }

    @EventListener
    public void onContextClosed(ContextClosedEvent event) {
        closed.countDown();
    }

    /**
     * Release a blocked {@link #run()}.
     */
    void release() {
        closed.countDown();
    }

    private void printBanner() {
        ConsoleOutput.printBanner();
        ConsoleOutput.info("Taskweave runtime running");
        System.out.println();
        for (AgentStatus agent : runtime.orchestrator().agentStatus()) {
            System.out.println("  Agent:  " + agent.agentId());
        }
        System.out.println("  Slots:  " + runtime.orchestrator().availableSlots());
        System.out.println();
        ConsoleOutput.info("Press Ctrl+C to stop.");
    }
}
