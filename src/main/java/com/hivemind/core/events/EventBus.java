package com.hivemind.core.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * In-memory pub/sub event bus for orchestrator events.
 * <p>
 * Supports per-event-type subscriptions and global subscriptions that receive all events.
 * Delivery is synchronous on the publishing thread and best-effort: a subscriber that
 * throws is logged and skipped. Thread-safe for concurrent publish and subscribe operations.
 */
public class EventBus {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    /** Per-type subscribers; every type has a list from construction on. */
    private final Map<EventType, CopyOnWriteArrayList<Consumer<OrchestratorEvent>>> typeSubscribers =
            new EnumMap<>(EventType.class);

    /** Global subscribers that receive every event. */
    private final CopyOnWriteArrayList<Consumer<OrchestratorEvent>> globalSubscribers =
            new CopyOnWriteArrayList<>();

    public EventBus() {
        for (EventType type : EventType.values()) {
            typeSubscribers.put(type, new CopyOnWriteArrayList<>());
        }
    }

    /**
     * Publish an event to all matching subscribers (type-specific first, then global).
     *
     * @param event the event to publish
     */
    public void publish(OrchestratorEvent event) {
        log.debug("Publishing event: {} for task {}", event.type().eventName(), event.taskId());

        List<Consumer<OrchestratorEvent>> subs = typeSubscribers.get(event.type());
        for (Consumer<OrchestratorEvent> subscriber : subs) {
            deliverSafely(subscriber, event);
        }

        for (Consumer<OrchestratorEvent> subscriber : globalSubscribers) {
            deliverSafely(subscriber, event);
        }
    }

    /**
     * Subscribe to one type of event.
     *
     * @param type     the event type to receive
     * @param consumer callback invoked for each matching event
     * @return a {@link Subscription} handle to unsubscribe later
     */
    public Subscription subscribe(EventType type, Consumer<OrchestratorEvent> consumer) {
        CopyOnWriteArrayList<Consumer<OrchestratorEvent>> subs = typeSubscribers.get(type);
        subs.add(consumer);
        log.debug("Subscribed to {}", type.eventName());
        return () -> subs.remove(consumer);
    }

    /**
     * Subscribe to every event type.
     *
     * @param consumer callback invoked for each event
     * @return a {@link Subscription} handle to unsubscribe later
     */
    public Subscription subscribeAll(Consumer<OrchestratorEvent> consumer) {
        globalSubscribers.add(consumer);
        log.debug("Subscribed to all events (global)");
        return () -> globalSubscribers.remove(consumer);
    }

    public int subscriberCount() {
        int count = globalSubscribers.size();
        for (var subs : typeSubscribers.values()) {
            count += subs.size();
        }
        return count;
    }

    /**
     * Handle for cancelling a subscription.
     */
    @FunctionalInterface
    public interface Subscription {
        void unsubscribe();
    }

    private void deliverSafely(Consumer<OrchestratorEvent> subscriber, OrchestratorEvent event) {
        try {
            subscriber.accept(event);
        } catch (Exception e) {
            log.warn("Subscriber threw exception processing event {}: {}",
                    event.type().eventName(), e.getMessage(), e);
        }
    }
}
