package com.taskweave.core.events;

import com.taskweave.core.metrics.TaskweaveMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * In-memory pub/sub event bus keyed by event type.
 * <p>
 * Publishers append to a bounded FIFO queue and never block; a single consumer
 * thread, started with {@link #start()}, delivers each event to the subscribers
 * of its type in arrival order. {@link EventPriority} is carried as metadata only.
 * A subscriber that throws is logged and skipped; delivery continues with the
 * remaining subscribers and the next event.
 */
public class EventBus {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    public static final int DEFAULT_CAPACITY = 1000;

    private static final long POLL_MILLIS = 100;
    private static final long JOIN_MILLIS = 5_000;

    private final ConcurrentHashMap<String, CopyOnWriteArrayList<Listener>> subscribers =
            new ConcurrentHashMap<>();

    private final BlockingQueue<Event> queue;
    private final int capacity;
    private final Clock clock;
    private final TaskweaveMetrics metrics;

    private volatile boolean running;
    private Thread consumer;

    public EventBus() {
        this(DEFAULT_CAPACITY, Clock.systemUTC(), null);
    }

    public EventBus(int capacity) {
        this(capacity, Clock.systemUTC(), null);
    }

    public EventBus(int capacity, Clock clock, TaskweaveMetrics metrics) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive: " + capacity);
        }
        this.capacity = capacity;
        this.queue = new ArrayBlockingQueue<>(capacity);
        this.clock = clock;
        this.metrics = metrics;
    }

    /**
     * Subscribe a callback to one event type. Subscribing the same callback twice
     * for the same type has no additional effect.
     *
     * @return a {@link Subscription} handle to unsubscribe later
     */
    public Subscription subscribe(String eventType, Consumer<Event> callback) {
        return register(eventType, new Listener(callback, event -> {
            callback.accept(event);
            return null;
        }));
    }

    /**
     * Subscribe an asynchronous callback. The consumer waits for the returned stage
     * to complete before it moves on to the next subscriber.
     */
    public Subscription subscribeAsync(String eventType, Function<Event, ? extends CompletionStage<?>> callback) {
        return register(eventType, new Listener(callback, callback));
    }

    /**
     * Remove a callback previously passed to {@link #subscribe} or {@link #subscribeAsync}.
     * Unknown callbacks are ignored.
     *
     * @return always {@code true}
     */
    public boolean unsubscribe(String eventType, Object callback) {
        subscribers.computeIfPresent(eventType, (type, listeners) -> {
            listeners.removeIf(l -> l.callback == callback);
            return listeners.isEmpty() ? null : listeners;
        });
        log.debug("Unsubscribed from event type {}", eventType);
        return true;
    }

    /**
     * Append an event to the delivery queue, stamping its timestamp when absent.
     *
     * @throws QueueFullException when the queue already holds {@code capacity} events
     */
    public void publish(Event event) {
        Event stamped = event.timestamp() == null ? event.withTimestamp(clock.instant()) : event;
        if (!queue.offer(stamped)) {
            throw new QueueFullException("Event queue is full (capacity " + capacity
                    + "), dropped " + event.type());
        }
        log.debug("Published event {}", event.type());
    }

    public int queueDepth() {
        return queue.size();
    }

    public int subscriberCount(String eventType) {
        List<Listener> listeners = subscribers.get(eventType);
        return listeners == null ? 0 : listeners.size();
    }

    /**
     * Drop every queued event without delivering it.
     *
     * @return number of discarded events
     */
    public int clear() {
        List<Event> dropped = new ArrayList<>();
        queue.drainTo(dropped);
        log.info("Event queue cleared ({} events dropped)", dropped.size());
        return dropped.size();
    }

    public synchronized void start() {
        if (running) {
            return;
        }
        running = true;
        consumer = new Thread(this::consumeLoop, "taskweave-event-bus");
        consumer.setDaemon(true);
        consumer.start();
        log.info("Event bus started (capacity {})", capacity);
    }

    /**
     * Stop the consumer and wait for it to finish the event it is delivering.
     * Events still queued stay queued.
     */
    public synchronized void stop() {
        if (!running) {
            return;
        }
        running = false;
        Thread t = consumer;
        consumer = null;
        try {
            t.join(JOIN_MILLIS);
            if (t.isAlive()) {
                log.warn("Event bus consumer did not stop within {}ms, interrupting", JOIN_MILLIS);
                t.interrupt();
                t.join(JOIN_MILLIS);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        log.info("Event bus stopped");
    }

    public boolean isRunning() {
        return running;
    }

    /**
     * Deliver every queued event on the calling thread. Test hook for exercising
     * delivery without a consumer thread; production code calls {@link #start()}.
     *
     * @return number of events delivered
     */
    int deliverPending() {
        int delivered = 0;
        Event event;
        while ((event = queue.poll()) != null) {
            dispatch(event);
            delivered++;
        }
        return delivered;
    }

    private void consumeLoop() {
        while (running) {
            try {
                Event event = queue.poll(POLL_MILLIS, TimeUnit.MILLISECONDS);
                if (event != null) {
                    dispatch(event);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            }
        }
    }

    private void dispatch(Event event) {
        List<Listener> listeners = subscribers.get(event.type());
        if (listeners == null) {
            return;
        }
        for (Listener listener : listeners) {
            deliverSafely(listener, event);
        }
    }

    private void deliverSafely(Listener listener, Event event) {
        try {
            CompletionStage<?> stage = listener.invoker.apply(event);
            if (stage != null) {
                stage.toCompletableFuture().join();
            }
        } catch (VirtualMachineError e) {
            throw e;
        } catch (Throwable e) {
            log.warn("Subscriber threw exception processing event {}: {}",
                    event.type(), e.getMessage(), e);
            if (metrics != null) {
                metrics.recordDeliveryFailure(event.type());
            }
        }
    }

    private Subscription register(String eventType, Listener listener) {
        boolean[] added = new boolean[1];
        subscribers.compute(eventType, (type, listeners) -> {
            CopyOnWriteArrayList<Listener> target = listeners == null ? new CopyOnWriteArrayList<>() : listeners;
            added[0] = target.addIfAbsent(listener);
            return target;
        });
        if (added[0]) {
            log.info("Subscribed to event type {}", eventType);
        }
        return () -> unsubscribe(eventType, listener.callback);
    }

    /**
     * Handle for cancelling a subscription.
     */
    @FunctionalInterface
    public interface Subscription {
        void unsubscribe();
    }

    /**
     * Subscriber entry; equality follows the identity of the caller's callback so
     * that repeated subscriptions collapse into one.
     */
    private static final class Listener {
        private final Object callback;
        private final Function<Event, ? extends CompletionStage<?>> invoker;

        Listener(Object callback, Function<Event, ? extends CompletionStage<?>> invoker) {
            this.callback = callback;
            this.invoker = invoker;
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Listener other && other.callback == callback;
        }

        @Override
        public int hashCode() {
            return System.identityHashCode(callback);
        }
    }
}
