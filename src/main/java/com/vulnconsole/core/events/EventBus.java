package com.vulnconsole.core.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * In-memory pub/sub event bus for environment operation events.
 * <p>
 * Subscriptions are keyed by environment id, so a pull stream only sees its own
 * environment's progress. A subscriber that throws never affects delivery to the
 * others or the publishing operation.
 */
@Service
public class EventBus {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    /** Per-environment subscribers keyed by environment id. */
    private final ConcurrentHashMap<String, CopyOnWriteArrayList<Consumer<ConsoleEvent>>> environmentSubscribers =
            new ConcurrentHashMap<>();

    /**
     * Publish an event to the subscribers of its environment.
     *
     * @param event the event to publish
     */
    public void publish(ConsoleEvent event) {
        log.debug("Publishing event: {} for environment {}", event.eventType(), event.environmentId());

        List<Consumer<ConsoleEvent>> subscribers = environmentSubscribers.get(event.environmentId());
        if (subscribers != null) {
            for (Consumer<ConsoleEvent> subscriber : subscribers) {
                deliverSafely(subscriber, event);
            }
        }
    }

    /**
     * Subscribe to events for a specific environment.
     *
     * @param environmentId the environment to subscribe to
     * @param consumer      callback invoked for each event
     * @return a {@link Subscription} handle to unsubscribe later
     */
    public Subscription subscribe(String environmentId, Consumer<ConsoleEvent> consumer) {
        environmentSubscribers.computeIfAbsent(environmentId, k -> new CopyOnWriteArrayList<>()).add(consumer);
        log.debug("Subscribed to environment {}", environmentId);
        return () -> environmentSubscribers.computeIfPresent(environmentId, (k, subs) -> {
            subs.remove(consumer);
            return subs.isEmpty() ? null : subs;
        });
    }

    /** Number of environments with at least one subscriber. */
    public int subscribedEnvironmentCount() {
        return environmentSubscribers.size();
    }

    /**
     * Handle for cancelling a subscription.
     */
    @FunctionalInterface
    public interface Subscription {
        void unsubscribe();
    }

    private void deliverSafely(Consumer<ConsoleEvent> subscriber, ConsoleEvent event) {
        try {
            subscriber.accept(event);
        } catch (Exception e) {
            log.warn("Subscriber threw exception processing event {}: {}",
                    event.eventType(), e.getMessage(), e);
        }
    }
}
