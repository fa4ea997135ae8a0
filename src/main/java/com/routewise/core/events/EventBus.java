package com.routewise.core.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * In-memory pub/sub bus for routing events.
 * <p>
 * Thread-safe for concurrent publish and subscribe. A subscriber that throws is
 * logged and skipped; it never affects routing or other subscribers.
 */
@Service
public class EventBus {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    private final CopyOnWriteArrayList<Consumer<RoutingEvent>> subscribers = new CopyOnWriteArrayList<>();

    public void publish(RoutingEvent event) {
        log.debug("Publishing event: {} for routing {}", event.eventType(), event.routingId());
        for (Consumer<RoutingEvent> subscriber : subscribers) {
            deliverSafely(subscriber, event);
        }
    }

    /**
     * Subscribe to all routing events.
     *
     * @param consumer callback invoked for each event
     * @return a {@link Subscription} handle to unsubscribe later
     */
    public Subscription subscribe(Consumer<RoutingEvent> consumer) {
        subscribers.add(consumer);
        return () -> subscribers.remove(consumer);
    }

    /**
     * Handle for cancelling a subscription.
     */
    @FunctionalInterface
    public interface Subscription {
        void unsubscribe();
    }

    private void deliverSafely(Consumer<RoutingEvent> subscriber, RoutingEvent event) {
        try {
            subscriber.accept(event);
        } catch (Exception e) {
            log.warn("Subscriber threw exception processing event {}: {}",
                    event.eventType(), e.getMessage(), e);
        }
    }
}
