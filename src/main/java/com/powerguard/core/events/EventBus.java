package com.powerguard.core.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * In-memory pub/sub bus for batch execution and alert events.
 * <p>
 * Subscribers either follow one batch or receive everything. A subscriber that throws
 * is logged and skipped; it never affects the publisher or other subscribers.
 */
@Service
public class EventBus {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    private final ConcurrentHashMap<String, CopyOnWriteArrayList<Consumer<PowerGuardEvent>>> batchSubscribers =
            new ConcurrentHashMap<>();

    private final CopyOnWriteArrayList<Consumer<PowerGuardEvent>> globalSubscribers =
            new CopyOnWriteArrayList<>();

    public void publish(PowerGuardEvent event) {
        log.debug("Publishing event: {} for batch {}", event.eventType(), event.batchId());

        if (event.batchId() != null) {
            List<Consumer<PowerGuardEvent>> subs = batchSubscribers.get(event.batchId());
            if (subs != null) {
                for (Consumer<PowerGuardEvent> subscriber : subs) {
                    deliverSafely(subscriber, event);
                }
            }
        }

        for (Consumer<PowerGuardEvent> subscriber : globalSubscribers) {
            deliverSafely(subscriber, event);
        }
    }

    /**
     * Subscribe to events of one batch.
     *
     * @return a {@link Subscription} handle to unsubscribe later
     */
    public Subscription subscribe(String batchId, Consumer<PowerGuardEvent> consumer) {
        batchSubscribers.computeIfAbsent(batchId, k -> new CopyOnWriteArrayList<>()).add(consumer);
        return () -> {
            CopyOnWriteArrayList<Consumer<PowerGuardEvent>> subs = batchSubscribers.get(batchId);
            if (subs != null) {
                subs.remove(consumer);
                if (subs.isEmpty()) {
                    batchSubscribers.remove(batchId, subs);
                }
            }
        };
    }

    public Subscription subscribeAll(Consumer<PowerGuardEvent> consumer) {
        globalSubscribers.add(consumer);
        return () -> globalSubscribers.remove(consumer);
    }

    @FunctionalInterface
    public interface Subscription {
        void unsubscribe();
    }

    private void deliverSafely(Consumer<PowerGuardEvent> subscriber, PowerGuardEvent event) {
        try {
            subscriber.accept(event);
        } catch (Exception e) {
            log.warn("Subscriber threw exception processing event {}: {}",
                    event.eventType(), e.getMessage(), e);
        }
    }
}
