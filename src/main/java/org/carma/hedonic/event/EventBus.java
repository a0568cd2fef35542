package org.carma.hedonic.event;

import java.util.*;
import java.util.concurrent.*;
import java.util.function.Consumer;

/**
 * Event bus for publish-subscribe communication.
 *
 * Provides:
 * - Type-safe subscription
 * - Synchronous event dispatch
 * - Event history for replaying a search trace
 */
public class EventBus {

    private final Map<Class<? extends Event>, List<Consumer<Event>>> subscribers;
    private final List<Event> eventHistory;
    private final boolean recordHistory;

    public EventBus() {
        this(true);
    }

    public EventBus(boolean recordHistory) {
        this.subscribers = new ConcurrentHashMap<>();
        this.eventHistory = Collections.synchronizedList(new ArrayList<>());
        this.recordHistory = recordHistory;
    }

    // ========================================================================
    // Subscription
    // ========================================================================

    @SuppressWarnings("unchecked")
    public <T extends Event> void subscribe(Class<T> eventType, Consumer<T> handler) {
        subscribers.computeIfAbsent(eventType, k -> new CopyOnWriteArrayList<>())
            .add(event -> handler.accept((T) event));
    }

    public void subscribeAll(Consumer<Event> handler) {
        subscribe(Event.SearchStartedEvent.class, handler::accept);
        subscribe(Event.HypothesisSelectedEvent.class, handler::accept);
        subscribe(Event.StableAssignmentEvent.class, handler::accept);
        subscribe(Event.SearchCompletedEvent.class, handler::accept);
    }

    // ========================================================================
    // Publishing
    // ========================================================================

    /**
     * Publish an event to all subscribers. A failing handler does not stop the others.
     */
    public void publish(Event event) {
        if (recordHistory) {
            eventHistory.add(event);
        }

        List<Consumer<Event>> handlers = subscribers.get(event.getClass());
        if (handlers != null) {
            for (Consumer<Event> handler : handlers) {
                try {
                    handler.accept(event);
                } catch (RuntimeException e) {
                    System.err.println("Error in event handler for " + event.eventType() + ": " + e.getMessage());
                }
            }
        }
    }

    // ========================================================================
    // History
    // ========================================================================

    public List<Event> getHistory() {
        synchronized (eventHistory) {
            return new ArrayList<>(eventHistory);
        }
    }

    @SuppressWarnings("unchecked")
    public <T extends Event> List<T> getHistory(Class<T> eventType) {
        List<T> filtered = new ArrayList<>();
        for (Event event : getHistory()) {
            if (eventType.isInstance(event)) {
                filtered.add((T) event);
            }
        }
        return filtered;
    }
}
