package com.backstop.core.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * In-memory pub/sub for tier changes and recovery outcomes.
 * <p>
 * Subscribers register either for a set of event types or for everything. Delivery is
 * synchronous on the publishing thread.
 */
@Service
public class EventBus {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    private final ConcurrentHashMap<String, CopyOnWriteArrayList<Consumer<BackstopEvent>>> typeSubscribers =
            new ConcurrentHashMap<>();

    private final CopyOnWriteArrayList<Consumer<BackstopEvent>> globalSubscribers =
            new CopyOnWriteArrayList<>();

    /**
     * Delivers {@code event} to the subscribers of its type, then to the global ones.
     * A subscriber that throws does not stop delivery to the others.
     */
    public void publish(BackstopEvent event) {
        log.debug("Publishing {} for {}", event.eventType(),
                event.componentId() != null ? event.componentId() : "system");

        List<Consumer<BackstopEvent>> subs = typeSubscribers.get(event.eventType());
        if (subs != null) {
            subs.forEach(subscriber -> deliverSafely(subscriber, event));
        }
        globalSubscribers.forEach(subscriber -> deliverSafely(subscriber, event));
    }

    /**
     * Subscribes {@code consumer} to every event whose type is in {@code eventTypes}.
     * The consumer receives each matching event once.
     */
    public Subscription subscribe(Set<String> eventTypes, Consumer<BackstopEvent> consumer) {
        if (eventTypes.isEmpty()) {
            throw new IllegalArgumentException("At least one event type is required");
        }
        for (String type : eventTypes) {
            typeSubscribers.computeIfAbsent(type, k -> new CopyOnWriteArrayList<>()).add(consumer);
        }
        log.debug("Subscribed to {}", eventTypes);
        return () -> eventTypes.forEach(type -> {
            CopyOnWriteArrayList<Consumer<BackstopEvent>> subs = typeSubscribers.get(type);
            if (subs != null) {
                subs.remove(consumer);
            }
        });
    }

    public Subscription subscribeAll(Consumer<BackstopEvent> consumer) {
        globalSubscribers.add(consumer);
        return () -> globalSubscribers.remove(consumer);
    }

    @FunctionalInterface
    public interface Subscription {
        void unsubscribe();
    }

    private void deliverSafely(Consumer<BackstopEvent> subscriber, BackstopEvent event) {
        try {
            subscriber.accept(event);
        } catch (Exception e) {
            log.warn("Subscriber failed on {}: {}", event.eventType(), e.getMessage(), e);
        }
    }
}
