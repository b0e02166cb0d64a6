package com.browserpilot.core.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * In-memory pub/sub for client state transitions.
 * <p>
 * Subscribers either follow one session or receive everything. Delivery happens
 * on the publishing thread, which is the event loop for polling events.
 */
@Service
public class EventBus {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    /** Per-session subscribers keyed by sessionId. */
    private final ConcurrentHashMap<String, CopyOnWriteArrayList<Consumer<PilotEvent>>> sessionSubscribers =
            new ConcurrentHashMap<>();

    /** Subscribers that see every event, session-scoped or not. */
    private final CopyOnWriteArrayList<Consumer<PilotEvent>> globalSubscribers =
            new CopyOnWriteArrayList<>();

    /**
     * Delivers an event to the subscribers of its session, then to global ones.
     * Events without a session only reach global subscribers.
     *
     * @param event the event to deliver
     */
    public void publish(PilotEvent event) {
        log.debug("Publishing event: {} for session {}", event.eventType(), event.sessionId());

        if (event.sessionId() != null) {
            List<Consumer<PilotEvent>> subs = sessionSubscribers.get(event.sessionId());
            if (subs != null) {
                for (Consumer<PilotEvent> subscriber : subs) {
                    deliverSafely(subscriber, event);
                }
            }
        }
        for (Consumer<PilotEvent> subscriber : globalSubscribers) {
            deliverSafely(subscriber, event);
        }
    }

    /**
     * Subscribe to events of one session.
     *
     * @param sessionId the automation session to follow
     * @param consumer  callback invoked on the publishing thread
     * @return a {@link Subscription} handle to unsubscribe later; the last
     *         unsubscribe for a session drops its entry
     */
    public Subscription subscribe(String sessionId, Consumer<PilotEvent> consumer) {
        sessionSubscribers.computeIfAbsent(sessionId, k -> new CopyOnWriteArrayList<>()).add(consumer);
        return () -> {
            CopyOnWriteArrayList<Consumer<PilotEvent>> subs = sessionSubscribers.get(sessionId);
            if (subs != null) {
                subs.remove(consumer);
                if (subs.isEmpty()) {
                    sessionSubscribers.remove(sessionId, subs);
                }
            }
        };
    }

    /**
     * Subscribe to every event, including session-less agent events.
     *
     * @param consumer callback invoked on the publishing thread
     * @return a {@link Subscription} handle to unsubscribe later
     */
    public Subscription subscribeAll(Consumer<PilotEvent> consumer) {
        globalSubscribers.add(consumer);
        return () -> globalSubscribers.remove(consumer);
    }

    /**
     * Handle returned by the subscribe methods. Unsubscribing twice is harmless.
     */
    @FunctionalInterface
    public interface Subscription {
        void unsubscribe();
    }

    private void deliverSafely(Consumer<PilotEvent> subscriber, PilotEvent event) {
        try {
            subscriber.accept(event);
        } catch (Exception e) {
            log.warn("Subscriber threw exception processing event {}: {}",
                    event.eventType(), e.getMessage(), e);
        }
    }
}
