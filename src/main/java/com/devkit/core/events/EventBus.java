package com.devkit.core.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * In-memory pub/sub for run events.
 * <p>
 * Supports per-run subscriptions and global subscriptions that receive all events.
 * A failing subscriber never affects the publisher or other subscribers.
 */
@Service
public class EventBus {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    private final ConcurrentHashMap<String, CopyOnWriteArrayList<Consumer<DevkitEvent>>> runSubscribers =
            new ConcurrentHashMap<>();

    private final CopyOnWriteArrayList<Consumer<DevkitEvent>> globalSubscribers =
            new CopyOnWriteArrayList<>();

    public void publish(DevkitEvent event) {
        log.debug("Publishing event: {} for run {}", event.eventType(), event.runId());

        List<Consumer<DevkitEvent>> subs = runSubscribers.get(event.runId());
        if (subs != null) {
            for (Consumer<DevkitEvent> subscriber : subs) {
                deliverSafely(subscriber, event);
            }
        }
        for (Consumer<DevkitEvent> subscriber : globalSubscribers) {
            deliverSafely(subscriber, event);
        }
    }

    /**
     * Subscribe to events of a single run.
     *
     * @return a handle to cancel the subscription
     */
    public Subscription subscribe(String runId, Consumer<DevkitEvent> consumer) {
        runSubscribers.computeIfAbsent(runId, k -> new CopyOnWriteArrayList<>()).add(consumer);
        return () -> {
            CopyOnWriteArrayList<Consumer<DevkitEvent>> subs = runSubscribers.get(runId);
            if (subs != null) {
                subs.remove(consumer);
            }
        };
    }

    public Subscription subscribeAll(Consumer<DevkitEvent> consumer) {
        globalSubscribers.add(consumer);
        return () -> globalSubscribers.remove(consumer);
    }

    @FunctionalInterface
    public interface Subscription {
        void unsubscribe();
    }

    private void deliverSafely(Consumer<DevkitEvent> subscriber, DevkitEvent event) {
        try {
            subscriber.accept(event);
        } catch (Exception e) {
            log.warn("Subscriber threw exception processing event {}: {}",
                    event.eventType(), e.getMessage(), e);
        }
    }
}
