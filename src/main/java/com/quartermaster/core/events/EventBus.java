package com.quartermaster.core.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * In-process pub/sub bus for orchestration events.
 * <p>
 * Delivery is synchronous on the publishing thread and fire-and-forget: a failing subscriber
 * is logged and skipped, nothing is persisted or replayed. Supports per-task subscriptions
 * and global subscriptions that receive all events.
 */
@Service
public class EventBus {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    /** Per-task subscribers keyed by taskId. */
    private final ConcurrentHashMap<String, CopyOnWriteArrayList<Consumer<OrchestrationEvent>>> taskSubscribers =
            new ConcurrentHashMap<>();

    /** Global subscribers that receive every event. */
    private final CopyOnWriteArrayList<Consumer<OrchestrationEvent>> globalSubscribers =
            new CopyOnWriteArrayList<>();

    /**
     * Publish an event to all matching subscribers (task-specific and global).
     *
     * @param event the event to publish
     */
    public void publish(OrchestrationEvent event) {
        log.debug("Publishing event: {} for task {}", event.eventType(), event.taskId());

        if (event.taskId() != null) {
            List<Consumer<OrchestrationEvent>> subs = taskSubscribers.get(event.taskId());
            if (subs != null) {
                for (Consumer<OrchestrationEvent> subscriber : subs) {
                    deliverSafely(subscriber, event);
                }
            }
        }

        for (Consumer<OrchestrationEvent> subscriber : globalSubscribers) {
            deliverSafely(subscriber, event);
        }
    }

    /**
     * Subscribe to events for a specific task.
     *
     * @param taskId   the task to subscribe to
     * @param consumer callback invoked for each event
     * @return a {@link Subscription} handle to unsubscribe later
     */
    public Subscription subscribe(String taskId, Consumer<OrchestrationEvent> consumer) {
        taskSubscribers.computeIfAbsent(taskId, k -> new CopyOnWriteArrayList<>()).add(consumer);
        log.debug("Subscribed to task {}", taskId);
        return () -> {
            CopyOnWriteArrayList<Consumer<OrchestrationEvent>> subs = taskSubscribers.get(taskId);
            if (subs != null) {
                subs.remove(consumer);
            }
        };
    }

    /**
     * Subscribe to events from all tasks.
     *
     * @param consumer callback invoked for each event
     * @return a {@link Subscription} handle to unsubscribe later
     */
    public Subscription subscribeAll(Consumer<OrchestrationEvent> consumer) {
        globalSubscribers.add(consumer);
        log.debug("Subscribed to all events (global)");
        return () -> globalSubscribers.remove(consumer);
    }

    /**
     * Handle for cancelling a subscription.
     */
    @FunctionalInterface
    public interface Subscription {
        void unsubscribe();
    }

    private void deliverSafely(Consumer<OrchestrationEvent> subscriber, OrchestrationEvent event) {
        try {
            subscriber.accept(event);
        } catch (Exception e) {
            log.warn("Subscriber threw exception processing event {}: {}",
                    event.eventType(), e.getMessage(), e);
        }
    }
}
