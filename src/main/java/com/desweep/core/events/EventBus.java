package com.desweep.core.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Synchronous in-process fan-out of load and analysis progress.
 * <p>
 * Every subscriber sees every event; events carry their {@code runId} so a
 * listener can filter on it. Delivery happens on the publishing thread, which
 * for the loader is one of its fetch workers. A subscriber that throws is
 * logged and skipped.
 */
@Service
public class EventBus {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    private final List<Consumer<AuditEvent>> subscribers = new CopyOnWriteArrayList<>();

    public void publish(AuditEvent event) {
        log.trace("{} run={} entity={}", event.eventType(), event.runId(), event.entityKey());
        for (Consumer<AuditEvent> subscriber : subscribers) {
            try {
                subscriber.accept(event);
            } catch (RuntimeException e) {
                log.warn("Subscriber failed on {}: {}", event.eventType(), e.getMessage(), e);
            }
        }
    }

    /**
     * Registers {@code subscriber} for all subsequent events.
     *
     * @return handle whose {@link Subscription#unsubscribe()} is safe to call more than once
     */
    public Subscription subscribe(Consumer<AuditEvent> subscriber) {
        subscribers.add(subscriber);
        return () -> subscribers.remove(subscriber);
    }

    int subscriberCount() {
        return subscribers.size();
    }

    @FunctionalInterface
    public interface Subscription {
        void unsubscribe();
    }
}
