package com.docweaver.core.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * In-memory pub/sub bus for task progress events.
 * <p>
 * Supports per-task subscriptions and global subscriptions that receive all events.
 * A subscriber that throws is logged and skipped; it never affects the publisher or
 * other subscribers.
 */
@Service
public class EventBus {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    private final ConcurrentHashMap<String, CopyOnWriteArrayList<Consumer<PipelineEvent>>> taskSubscribers =
            new ConcurrentHashMap<>();

    private final CopyOnWriteArrayList<Consumer<PipelineEvent>> globalSubscribers =
            new CopyOnWriteArrayList<>();

    public void publish(PipelineEvent event) {
        log.debug("Publishing event: {} for task {}", event.eventType(), event.taskId());

        List<Consumer<PipelineEvent>> subs = taskSubscribers.get(event.taskId());
        if (subs != null) {
            for (Consumer<PipelineEvent> subscriber : subs) {
                deliverSafely(subscriber, event);
            }
        }

        for (Consumer<PipelineEvent> subscriber : globalSubscribers) {
            deliverSafely(subscriber, event);
        }
    }

    /**
     * Subscribe to events for a specific task.
     *
     * @return a {@link Subscription} handle to unsubscribe later
     */
    public Subscription subscribe(String taskId, Consumer<PipelineEvent> consumer) {
        taskSubscribers.computeIfAbsent(taskId, k -> new CopyOnWriteArrayList<>()).add(consumer);
        log.debug("Subscribed to task {}", taskId);
        return () -> taskSubscribers.computeIfPresent(taskId, (id, list) -> {
            list.remove(consumer);
            return list.isEmpty() ? null : list;
        });
    }

    public Subscription subscribeAll(Consumer<PipelineEvent> consumer) {
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

    private void deliverSafely(Consumer<PipelineEvent> subscriber, PipelineEvent event) {
        try {
            subscriber.accept(event);
        } catch (Exception e) {
            log.warn("Subscriber threw exception processing event {}: {}",
                    event.eventType(), e.getMessage(), e);
        }
    }
}
