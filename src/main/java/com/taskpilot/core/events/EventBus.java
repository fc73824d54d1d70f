package com.taskpilot.core.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * In-memory pub/sub for orchestration events.
 * <p>
 * Subscribers either follow one task or receive everything. A subscriber that throws
 * never affects the publisher or other subscribers.
 */
@Service
public class EventBus {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    private final ConcurrentHashMap<String, CopyOnWriteArrayList<Consumer<TaskPilotEvent>>> taskSubscribers =
            new ConcurrentHashMap<>();

    private final CopyOnWriteArrayList<Consumer<TaskPilotEvent>> globalSubscribers =
            new CopyOnWriteArrayList<>();

    public void publish(TaskPilotEvent event) {
        log.debug("Publishing event: {} for task {}", event.eventType(), event.taskId());

        if (event.taskId() != null) {
            List<Consumer<TaskPilotEvent>> subs = taskSubscribers.get(event.taskId());
            if (subs != null) {
                for (Consumer<TaskPilotEvent> subscriber : subs) {
                    deliverSafely(subscriber, event);
                }
            }
        }

        for (Consumer<TaskPilotEvent> subscriber : globalSubscribers) {
            deliverSafely(subscriber, event);
        }
    }

    /**
     * Subscribe to events for one task.
     *
     * @return a handle to unsubscribe later
     */
    public Subscription subscribe(String taskId, Consumer<TaskPilotEvent> consumer) {
        taskSubscribers.computeIfAbsent(taskId, k -> new CopyOnWriteArrayList<>()).add(consumer);
        return () -> {
            CopyOnWriteArrayList<Consumer<TaskPilotEvent>> subs = taskSubscribers.get(taskId);
            if (subs != null) {
                subs.remove(consumer);
            }
        };
    }

    public Subscription subscribeAll(Consumer<TaskPilotEvent> consumer) {
        globalSubscribers.add(consumer);
        return () -> globalSubscribers.remove(consumer);
    }

    @FunctionalInterface
    public interface Subscription {
        void unsubscribe();
    }

    private void deliverSafely(Consumer<TaskPilotEvent> subscriber, TaskPilotEvent event) {
        try {
            subscriber.accept(event);
        } catch (Exception e) {
            log.warn("Subscriber threw exception processing event {}: {}",
                    event.eventType(), e.getMessage(), e);
        }
    }
}
